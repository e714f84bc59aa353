package com.gentoro.capindex.scoring;

import com.gentoro.capindex.cache.ScoreCache;
import com.gentoro.capindex.profile.SemanticProfile;
import java.util.Optional;
import java.util.Set;

/**
 * Combines Jaccard overlap and entropy agreement into one similarity score per profile pair.
 *
 * <p>Rules, first match wins:
 *
 * <ol>
 *   <li>jaccard above {@code jaccardHigh} with mean entropy below {@code entropyLow}: superficial
 *   <li>jaccard above {@code jaccardHigh} with mean entropy in the moderate band: high confidence
 *   <li>jaccard below {@code jaccardLow}, no shared token and entropies within {@code
 *       entropySimilarDelta}: different domain
 *   <li>otherwise a weighted blend of jaccard and entropy match
 * </ol>
 *
 * Profiles are put in canonical id order before anything is computed, so {@code score(a, b)} and
 * {@code score(b, a)} are identical.
 */
public class SimilarityScorer {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(SimilarityScorer.class);

  private final ScoringThresholds thresholds;
  private final ScoreCache cache;

  public SimilarityScorer(ScoringThresholds thresholds, ScoreCache cache) {
    this.thresholds = thresholds;
    this.cache = cache;
  }

  public ScoringThresholds thresholds() {
    return thresholds;
  }

  public PairScore score(SemanticProfile a, SemanticProfile b) {
    return score(a, b, 0L);
  }

  /** Score a pair, consulting and then populating the cache. */
  public PairScore score(SemanticProfile a, SemanticProfile b, long tick) {
    if (a.elementId().compareTo(b.elementId()) > 0) {
      SemanticProfile t = a;
      a = b;
      b = t;
    }
    PairId id = PairId.of(a.elementId(), b.elementId());
    if (cache != null) {
      Optional<PairScore> cached = cache.get(id);
      if (cached.isPresent()) {
        return cached.get();
      }
    }
    PairScore computed = compute(id, a, b, tick);
    if (cache != null) {
      cache.put(computed);
    }
    return computed;
  }

  /** |A ∩ B| / |A ∪ B|; zero when both sets are empty. */
  public static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() && b.isEmpty()) return 0.0;
    int overlap = overlap(a, b);
    int union = a.size() + b.size() - overlap;
    return union == 0 ? 0.0 : (double) overlap / union;
  }

  /** 1 - |e1 - e2| / max(e1, e2); zero when both entropies are zero. */
  public static double entropyMatch(double e1, double e2) {
    double max = Math.max(e1, e2);
    if (max <= 0.0) return 0.0;
    return clamp(1.0 - Math.abs(e1 - e2) / max);
  }

  private PairScore compute(PairId id, SemanticProfile a, SemanticProfile b, long tick) {
    int overlap = overlap(a.tokenSet(), b.tokenSet());
    double jaccard = jaccard(a.tokenSet(), b.tokenSet());
    double entropyMatch = entropyMatch(a.entropy(), b.entropy());
    double meanEntropy = (a.entropy() + b.entropy()) / 2.0;
    double delta = Math.abs(a.entropy() - b.entropy());

    ScoreInterpretation interpretation;
    double combined;
    if (jaccard > thresholds.jaccardHigh() && meanEntropy < thresholds.entropyLow()) {
      interpretation = ScoreInterpretation.SUPERFICIAL;
      combined = thresholds.superficialScore();
    } else if (jaccard > thresholds.jaccardHigh()
        && meanEntropy >= thresholds.entropyModerateMin()
        && meanEntropy <= thresholds.entropyModerateMax()) {
      interpretation = ScoreInterpretation.HIGH_CONFIDENCE;
      combined = thresholds.highConfidenceScore();
    } else if (jaccard < thresholds.jaccardLow()
        && overlap == 0
        && delta < thresholds.entropySimilarDelta()) {
      interpretation = ScoreInterpretation.DIFFERENT_DOMAIN;
      combined = thresholds.differentDomainScore();
    } else {
      interpretation = ScoreInterpretation.BLEND;
      combined =
          thresholds.jaccardWeight() * jaccard + thresholds.entropyWeight() * entropyMatch;
    }
    PairScore score =
        new PairScore(
            id, jaccard, entropyMatch, clamp(combined), interpretation, overlap, tick);
    if (log.isTraceEnabled()) {
      log.trace(
          "Scored {} jaccard={} entropyMatch={} combined={} ({})",
          id,
          jaccard,
          entropyMatch,
          score.combinedScore(),
          interpretation.wireName());
    }
    return score;
  }

  private static int overlap(Set<String> a, Set<String> b) {
    Set<String> small = a.size() <= b.size() ? a : b;
    Set<String> large = small == a ? b : a;
    int n = 0;
    for (String t : small) {
      if (large.contains(t)) n++;
    }
    return n;
  }

  private static double clamp(double v) {
    if (Double.isNaN(v)) return 0.0;
    return Math.max(0.0, Math.min(1.0, v));
  }
}

package com.gentoro.capindex.scoring;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.capindex.cache.ScoreCache;
import com.gentoro.capindex.profile.LexicalProfiler;
import com.gentoro.capindex.profile.SemanticProfile;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SimilarityScorerTest {

  private final LexicalProfiler profiler = new LexicalProfiler();

  private static String words(int from, int toExclusive) {
    return IntStream.range(from, toExclusive)
        .mapToObj(i -> String.format("w%02d", i))
        .collect(Collectors.joining(" "));
  }

  @Test
  @DisplayName("identical moderate-entropy text scores as high confidence")
  void highConfidenceBand() {
    SemanticProfile a = profiler.profile("a", words(0, 32));
    SemanticProfile b = profiler.profile("b", words(0, 32));
    assertEquals(5.0, a.entropy(), 1e-9);

    PairScore score = new SimilarityScorer(ScoringThresholds.defaults(), null).score(a, b);
    assertEquals(ScoreInterpretation.HIGH_CONFIDENCE, score.interpretation());
    assertEquals(0.95, score.combinedScore(), 1e-9);
    assertEquals(1.0, score.jaccard(), 1e-9);
    assertEquals(32, score.overlapCount());
  }

  @Test
  void sharedKeywordsWithModerateEntropyAreHighConfidence() {
    SemanticProfile dockerAuth =
        new SemanticProfile(
            "docker-auth-fixer", 5.2, Set.of("docker", "auth"), 2, 40, List.of("docker", "auth"));
    SemanticProfile registryLogin =
        new SemanticProfile(
            "registry-login", 4.8, Set.of("auth", "docker"), 2, 35, List.of("auth", "docker"));

    PairScore score =
        new SimilarityScorer(ScoringThresholds.defaults(), null).score(dockerAuth, registryLogin);

    assertEquals(ScoreInterpretation.HIGH_CONFIDENCE, score.interpretation());
    assertEquals(0.95, score.combinedScore(), 1e-9);
    assertEquals(2, score.overlapCount());
  }

  @Test
  @DisplayName("jaccard and scores stay symmetric and bounded for random token sets")
  void randomPairsAreSymmetricAndBounded() {
    Random random = new Random(20240501L);
    List<String> vocabulary = IntStream.range(0, 24).mapToObj(i -> "t" + i).toList();
    SimilarityScorer scorer = new SimilarityScorer(ScoringThresholds.defaults(), null);

    for (int i = 0; i < 400; i++) {
      Set<String> left = randomSubset(random, vocabulary);
      Set<String> right = randomSubset(random, vocabulary);

      double j = SimilarityScorer.jaccard(left, right);
      assertEquals(j, SimilarityScorer.jaccard(right, left), 0.0, "pair " + i);
      assertTrue(j >= 0.0 && j <= 1.0, "jaccard " + j + " for pair " + i);
      if (!left.isEmpty() && left.equals(right)) {
        assertEquals(1.0, j, 0.0);
      }

      SemanticProfile a =
          new SemanticProfile(
              "a" + i, random.nextDouble() * 8.0, left, left.size(), left.size(), List.of());
      SemanticProfile b =
          new SemanticProfile(
              "b" + i, random.nextDouble() * 8.0, right, right.size(), right.size(), List.of());
      PairScore ab = scorer.score(a, b);
      assertEquals(ab, scorer.score(b, a), "pair " + i);
      assertTrue(
          ab.combinedScore() >= 0.0 && ab.combinedScore() <= 1.0,
          "combined " + ab.combinedScore() + " for pair " + i);
      assertTrue(ab.entropyMatch() >= 0.0 && ab.entropyMatch() <= 1.0);
    }
  }

  private static Set<String> randomSubset(Random random, List<String> vocabulary) {
    Set<String> out = new HashSet<>();
    int size = random.nextInt(12);
    for (int k = 0; k < size; k++) {
      out.add(vocabulary.get(random.nextInt(vocabulary.size())));
    }
    return out;
  }

  @Test
  @DisplayName("heavy overlap of low-entropy text is superficial")
  void superficialBand() {
    SemanticProfile a = profiler.profile("a", "the and for with");
    SemanticProfile b = profiler.profile("b", "the and for with");
    PairScore score = new SimilarityScorer(ScoringThresholds.defaults(), null).score(a, b);
    assertEquals(ScoreInterpretation.SUPERFICIAL, score.interpretation());
    assertEquals(0.2, score.combinedScore(), 1e-9);
  }

  @Test
  void disjointTextOfSimilarComplexityIsDifferentDomain() {
    SemanticProfile a = profiler.profile("a", words(0, 8));
    SemanticProfile b = profiler.profile("b", words(50, 58));
    PairScore score = new SimilarityScorer(ScoringThresholds.defaults(), null).score(a, b);
    assertEquals(ScoreInterpretation.DIFFERENT_DOMAIN, score.interpretation());
    assertEquals(0.1, score.combinedScore(), 1e-9);
    assertEquals(0, score.overlapCount());
  }

  @Test
  void partialOverlapBlendsJaccardAndEntropyMatch() {
    SemanticProfile a = profiler.profile("a", words(0, 8));
    SemanticProfile b = profiler.profile("b", words(4, 12));
    PairScore score = new SimilarityScorer(ScoringThresholds.defaults(), null).score(a, b);
    assertEquals(ScoreInterpretation.BLEND, score.interpretation());
    assertEquals(1.0 / 3.0, score.jaccard(), 1e-9);
    assertEquals(1.0, score.entropyMatch(), 1e-9);
    assertEquals(0.7 / 3.0 + 0.3, score.combinedScore(), 1e-9);
  }

  @Test
  void scoringIsSymmetric() {
    SimilarityScorer scorer = new SimilarityScorer(ScoringThresholds.defaults(), null);
    SemanticProfile a = profiler.profile("zeta", "deploy service cluster health check");
    SemanticProfile b = profiler.profile("alpha", "service health monitor alerts");
    PairScore ab = scorer.score(a, b);
    PairScore ba = scorer.score(b, a);
    assertEquals(ab, ba);
    assertEquals(PairId.of("alpha", "zeta"), ab.pairId());
    assertEquals("alpha", ab.pairId().first());
  }

  @Test
  void emptyProfilesScoreZeroOverlap() {
    assertEquals(0.0, SimilarityScorer.jaccard(Set.of(), Set.of()));
    assertEquals(0.0, SimilarityScorer.entropyMatch(0.0, 0.0));
    PairScore score =
        new SimilarityScorer(ScoringThresholds.defaults(), null)
            .score(SemanticProfile.empty("a"), SemanticProfile.empty("b"));
    assertTrue(score.combinedScore() >= 0.0 && score.combinedScore() <= 1.0);
  }

  @Test
  void entropyMatchIsRelativeToLargerEntropy() {
    assertEquals(0.5, SimilarityScorer.entropyMatch(2.0, 4.0), 1e-9);
    assertEquals(0.5, SimilarityScorer.entropyMatch(4.0, 2.0), 1e-9);
  }

  @Test
  void cachedScoreIsReturnedWithoutRecomputation() {
    ScoreCache cache = new ScoreCache(10);
    SimilarityScorer scorer = new SimilarityScorer(ScoringThresholds.defaults(), cache);
    SemanticProfile a = profiler.profile("a", words(0, 8));
    SemanticProfile b = profiler.profile("b", words(4, 12));

    PairScore first = scorer.score(a, b, 1L);
    PairScore second = scorer.score(b, a, 2L);

    assertSame(first, second);
    assertEquals(1L, second.computedAt());
    assertEquals(1, cache.stats().hits());
    assertEquals(1, cache.stats().misses());
  }

  @Test
  void pairIdRejectsNonCanonicalOrderAndSelfPairs() {
    assertThrows(IllegalArgumentException.class, () -> new PairId("b", "a"));
    assertThrows(IllegalArgumentException.class, () -> PairId.of("a", "a"));
    assertEquals("a|b", PairId.of("b", "a").key());
    assertEquals("b", PairId.of("a", "b").other("a"));
  }
}

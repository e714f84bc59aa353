package com.gentoro.capindex.scoring;

/**
 * Band boundaries and weights for {@link SimilarityScorer}. Entropy values are in bits.
 *
 * @param entropyLow mean entropy below which high overlap is considered superficial
 * @param entropyModerateMin lower bound (inclusive) of the moderate entropy band
 * @param entropyModerateMax upper bound (inclusive) of the moderate entropy band
 * @param entropySimilarDelta maximum entropy difference treated as "similar complexity"
 */
public record ScoringThresholds(
    double entropyLow,
    double entropyModerateMin,
    double entropyModerateMax,
    double entropySimilarDelta,
    double jaccardLow,
    double jaccardHigh,
    double jaccardWeight,
    double entropyWeight,
    double highConfidenceScore,
    double superficialScore,
    double differentDomainScore) {

  public static ScoringThresholds defaults() {
    return new ScoringThresholds(3.0, 4.5, 6.0, 1.0, 0.2, 0.6, 0.7, 0.3, 0.95, 0.2, 0.1);
  }
}

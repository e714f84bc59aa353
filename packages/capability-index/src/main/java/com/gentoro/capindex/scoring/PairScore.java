package com.gentoro.capindex.scoring;

/** Result of comparing two profiles. All scores are in {@code [0,1]}. */
public record PairScore(
    PairId pairId,
    double jaccard,
    double entropyMatch,
    double combinedScore,
    ScoreInterpretation interpretation,
    int overlapCount,
    long computedAt) {

  public PairScore {
    checkUnit("jaccard", jaccard);
    checkUnit("entropyMatch", entropyMatch);
    checkUnit("combinedScore", combinedScore);
  }

  private static void checkUnit(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new IllegalArgumentException(name + " must be within [0,1], got " + value);
    }
  }
}

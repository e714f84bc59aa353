package com.gentoro.capindex.budget;

/**
 * Knobs of the comparison budget.
 *
 * @param fullMatrixThreshold largest element count compared exhaustively
 * @param fullMatrixHardCap upper bound on comparisons even in the exhaustive strategy
 * @param maxComparisons total comparisons allowed in the sampled strategy
 * @param keywordClusterBudgetPct share of {@code maxComparisons} spent inside keyword clusters
 * @param clusterSampleLimit members considered per keyword cluster
 * @param samplingSeed seed of the sampling random source, fixed for reproducible builds
 */
public record BudgetSettings(
    int fullMatrixThreshold,
    int fullMatrixHardCap,
    int maxComparisons,
    double keywordClusterBudgetPct,
    int clusterSampleLimit,
    long samplingSeed) {

  public static BudgetSettings defaults() {
    return new BudgetSettings(50, 1225, 500, 0.6, 20, 42L);
  }
}

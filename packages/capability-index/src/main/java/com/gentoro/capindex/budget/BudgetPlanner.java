package com.gentoro.capindex.budget;

/** Decides how many comparisons a build may make and how they are split. */
public class BudgetPlanner {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(BudgetPlanner.class);

  private final BudgetSettings settings;

  public BudgetPlanner(BudgetSettings settings) {
    this.settings = settings;
  }

  public BudgetSettings settings() {
    return settings;
  }

  public BuildBudget plan(int elementCount) {
    if (elementCount < 0) {
      throw new IllegalArgumentException("elementCount must be >= 0");
    }
    long allPairs = pairCount(elementCount);

    if (elementCount <= settings.fullMatrixThreshold()) {
      int max = (int) Math.min(allPairs, settings.fullMatrixHardCap());
      log.debug("Full comparison matrix for {} elements: {} comparisons", elementCount, max);
      return new BuildBudget(
          ComparisonStrategy.FULL, elementCount, max, 0, 0, max < allPairs);
    }

    int max = (int) Math.min(allPairs, settings.maxComparisons());
    int cluster = (int) Math.round(max * settings.keywordClusterBudgetPct());
    cluster = Math.max(0, Math.min(max, cluster));
    int crossType = max - cluster;
    log.info(
        "ScoringBudgetExceeded: {} elements would need {} comparisons; sampling {} ({} keyword"
            + " cluster, {} cross-type)",
        elementCount,
        allPairs,
        max,
        cluster,
        crossType);
    return new BuildBudget(
        ComparisonStrategy.SAMPLED, elementCount, max, cluster, crossType, true);
  }

  static long pairCount(int n) {
    return n < 2 ? 0L : (long) n * (n - 1) / 2;
  }
}

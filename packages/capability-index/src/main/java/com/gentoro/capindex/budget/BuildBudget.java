package com.gentoro.capindex.budget;

/**
 * Comparison allowance fixed for one build before any pair is scored. In the sampled strategy
 * {@code keywordClusterBudget + crossTypeBudget == maxComparisons}; in the full strategy both are
 * zero.
 */
public record BuildBudget(
    ComparisonStrategy strategy,
    int elementCount,
    int maxComparisons,
    int keywordClusterBudget,
    int crossTypeBudget,
    boolean budgetLimited) {}

package com.gentoro.capindex.budget;

import com.gentoro.capindex.scoring.PairId;
import java.util.List;

/** The concrete, distinct pairs a build will score, in scoring order. */
public record ComparisonPlan(
    BuildBudget budget, List<PairId> pairs, int clusterPairs, int crossTypePairs) {

  public ComparisonPlan {
    pairs = List.copyOf(pairs);
  }

  public int size() {
    return pairs.size();
  }
}

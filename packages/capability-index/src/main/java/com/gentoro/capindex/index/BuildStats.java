package com.gentoro.capindex.index;

import com.gentoro.capindex.budget.ComparisonStrategy;
import com.gentoro.capindex.diagnostics.BuildWarning;
import java.util.List;

/** Metrics and warnings of the build that produced an index. */
public record BuildStats(
    ComparisonStrategy strategy,
    int elementCount,
    int plannedComparisons,
    int comparisonsMade,
    int clusterComparisons,
    int crossTypeComparisons,
    long cacheHits,
    long cacheMisses,
    int edgeCount,
    long durationMs,
    Completeness completeness,
    boolean budgetLimited,
    boolean staleLeaseReclaimed,
    List<BuildWarning> warnings) {

  public BuildStats {
    completeness = completeness == null ? Completeness.COMPLETE : completeness;
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }
}

package com.gentoro.capindex.budget;

import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.scoring.PairId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Turns a {@link BuildBudget} into the concrete list of pairs to score. The number of pairs never
 * exceeds the budget; sampled plans contain no duplicate pair. Unused keyword-cluster budget is not
 * handed to the cross-type sampler.
 */
public class ComparisonPlanner {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(ComparisonPlanner.class);

  private final ClusterPairSampler clusterSampler;
  private final CrossTypePairSampler crossTypeSampler;
  private final long seed;

  public ComparisonPlanner(
      ClusterPairSampler clusterSampler, CrossTypePairSampler crossTypeSampler, long seed) {
    this.clusterSampler = clusterSampler;
    this.crossTypeSampler = crossTypeSampler;
    this.seed = seed;
  }

  public static ComparisonPlanner withDefaults(BudgetSettings settings) {
    return new ComparisonPlanner(
        new KeywordBucketSampler(settings.clusterSampleLimit()),
        new CrossTypePairSampler(),
        settings.samplingSeed());
  }

  public ComparisonPlan plan(List<ElementRecord> records, BuildBudget budget) {
    List<ElementRecord> sorted = new ArrayList<>(records);
    sorted.sort(Comparator.comparing(ElementRecord::id));

    if (budget.strategy() == ComparisonStrategy.FULL) {
      List<PairId> pairs = new ArrayList<>();
      outer:
      for (int i = 0; i < sorted.size(); i++) {
        for (int j = i + 1; j < sorted.size(); j++) {
          if (pairs.size() >= budget.maxComparisons()) break outer;
          pairs.add(PairId.of(sorted.get(i).id(), sorted.get(j).id()));
        }
      }
      return new ComparisonPlan(budget, pairs, 0, 0);
    }

    Random random = new Random(seed);
    Set<PairId> taken = new HashSet<>();
    List<PairId> cluster =
        clusterSampler.sample(sorted, budget.keywordClusterBudget(), taken, random);
    List<PairId> cross =
        crossTypeSampler.sample(sorted, budget.crossTypeBudget(), taken, random);

    List<PairId> pairs = new ArrayList<>(cluster.size() + cross.size());
    pairs.addAll(cluster.subList(0, Math.min(cluster.size(), budget.keywordClusterBudget())));
    pairs.addAll(cross.subList(0, Math.min(cross.size(), budget.crossTypeBudget())));
    log.debug(
        "Sampled {} keyword-cluster and {} cross-type pairs (budget {}/{})",
        cluster.size(),
        cross.size(),
        budget.keywordClusterBudget(),
        budget.crossTypeBudget());
    return new ComparisonPlan(
        budget,
        pairs,
        Math.min(cluster.size(), budget.keywordClusterBudget()),
        Math.min(cross.size(), budget.crossTypeBudget()));
  }
}

package com.gentoro.capindex.index;

import com.gentoro.capindex.budget.BudgetPlanner;
import com.gentoro.capindex.budget.BudgetSettings;
import com.gentoro.capindex.budget.ComparisonPlanner;
import com.gentoro.capindex.cache.ScoreCache;
import com.gentoro.capindex.profile.LexicalProfiler;
import com.gentoro.capindex.relationship.ActionTriggerExtractor;
import com.gentoro.capindex.relationship.RelationshipDiscoverer;
import com.gentoro.capindex.relationship.RelationshipRules;
import com.gentoro.capindex.relationship.RelationshipSettings;
import com.gentoro.capindex.relationship.TriggerSettings;
import com.gentoro.capindex.relationship.VerbTaxonomy;
import com.gentoro.capindex.scoring.ScoringThresholds;
import com.gentoro.capindex.scoring.SimilarityScorer;

/** The stateless stages of a build plus the score cache they share, wired once. */
public record BuildPipeline(
    LexicalProfiler profiler,
    BudgetPlanner budgetPlanner,
    ComparisonPlanner comparisonPlanner,
    ScoreCache cache,
    SimilarityScorer scorer,
    ActionTriggerExtractor triggerExtractor,
    RelationshipDiscoverer discoverer) {

  /** Pipeline with default settings throughout and its own cache. */
  public static BuildPipeline defaults() {
    ScoreCache cache = new ScoreCache();
    BudgetSettings budget = BudgetSettings.defaults();
    RelationshipSettings relationships = RelationshipSettings.defaults();
    VerbTaxonomy taxonomy = new VerbTaxonomy();
    return new BuildPipeline(
        new LexicalProfiler(),
        new BudgetPlanner(budget),
        ComparisonPlanner.withDefaults(budget),
        cache,
        new SimilarityScorer(ScoringThresholds.defaults(), cache),
        new ActionTriggerExtractor(TriggerSettings.defaults(), taxonomy),
        new RelationshipDiscoverer(
            relationships, RelationshipRules.forSettings(relationships), taxonomy));
  }
}

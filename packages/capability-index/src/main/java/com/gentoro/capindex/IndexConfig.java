package com.gentoro.capindex;

import com.gentoro.capindex.budget.BudgetSettings;
import com.gentoro.capindex.exception.ConfigException;
import com.gentoro.capindex.index.BuildSettings;
import com.gentoro.capindex.lease.AcquireMode;
import com.gentoro.capindex.relationship.RelationshipKind;
import com.gentoro.capindex.relationship.RelationshipSettings;
import com.gentoro.capindex.relationship.TriggerSettings;
import com.gentoro.capindex.scoring.ScoringThresholds;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.HierarchicalConfiguration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Typed, validated view of the {@code capindex.*} configuration keys. Every key has a default, so
 * an empty configuration is valid.
 */
public record IndexConfig(
    Path indexPath,
    long leaseTimeoutMs,
    long leaseWaitMs,
    long leasePollMs,
    AcquireMode acquireMode,
    int minTokenLength,
    int cacheCapacity,
    BudgetSettings budget,
    ScoringThresholds scoring,
    RelationshipSettings relationships,
    TriggerSettings triggers,
    Map<String, List<String>> customVerbs,
    long deadlineMs,
    int workerThreads,
    int scoringChunkSize) {

  public static final String PREFIX = "capindex.";

  public IndexConfig {
    customVerbs = customVerbs == null ? Map.of() : Map.copyOf(customVerbs);
  }

  public static IndexConfig defaults() {
    return fromConfiguration(new org.apache.commons.configuration2.BaseConfiguration());
  }

  public BuildSettings buildSettings() {
    return new BuildSettings(
        indexPath,
        Duration.ofMillis(leaseWaitMs),
        acquireMode,
        Duration.ofMillis(deadlineMs),
        workerThreads,
        scoringChunkSize);
  }

  public static IndexConfig fromConfiguration(Configuration cfg) {
    try {
      BudgetSettings defaultsBudget = BudgetSettings.defaults();
      BudgetSettings budget =
          new BudgetSettings(
              cfg.getInt(
                  PREFIX + "budget.fullMatrixThreshold", defaultsBudget.fullMatrixThreshold()),
              cfg.getInt(PREFIX + "budget.fullMatrixHardCap", defaultsBudget.fullMatrixHardCap()),
              cfg.getInt(PREFIX + "budget.maxComparisons", defaultsBudget.maxComparisons()),
              cfg.getDouble(
                  PREFIX + "budget.keywordClusterBudgetPct",
                  defaultsBudget.keywordClusterBudgetPct()),
              cfg.getInt(
                  PREFIX + "budget.clusterSampleLimit", defaultsBudget.clusterSampleLimit()),
              cfg.getLong(PREFIX + "budget.samplingSeed", defaultsBudget.samplingSeed()));

      ScoringThresholds d = ScoringThresholds.defaults();
      ScoringThresholds scoring =
          new ScoringThresholds(
              cfg.getDouble(PREFIX + "scoring.entropy.low", d.entropyLow()),
              cfg.getDouble(PREFIX + "scoring.entropy.moderateMin", d.entropyModerateMin()),
              cfg.getDouble(PREFIX + "scoring.entropy.moderateMax", d.entropyModerateMax()),
              cfg.getDouble(PREFIX + "scoring.entropy.similarDelta", d.entropySimilarDelta()),
              cfg.getDouble(PREFIX + "scoring.jaccard.low", d.jaccardLow()),
              cfg.getDouble(PREFIX + "scoring.jaccard.high", d.jaccardHigh()),
              cfg.getDouble(PREFIX + "scoring.weights.jaccard", d.jaccardWeight()),
              cfg.getDouble(PREFIX + "scoring.weights.entropyMatch", d.entropyWeight()),
              cfg.getDouble(PREFIX + "scoring.bands.highConfidence", d.highConfidenceScore()),
              cfg.getDouble(PREFIX + "scoring.bands.superficial", d.superficialScore()),
              cfg.getDouble(PREFIX + "scoring.bands.differentDomain", d.differentDomainScore()));

      RelationshipSettings r = RelationshipSettings.defaults();
      RelationshipSettings relationships =
          new RelationshipSettings(
              cfg.getDouble(
                  PREFIX + "relationships.similarityThreshold", r.similarityThreshold()),
              cfg.getDouble(PREFIX + "relationships.minConfidence", r.minConfidence()),
              cfg.getInt(PREFIX + "relationships.maxPerElement", r.maxPerElement()),
              cfg.getDouble(PREFIX + "relationships.verbConfidence", r.verbConfidence()),
              cfg.getInt(PREFIX + "relationships.maxElementsPerVerb", r.maxElementsPerVerb()),
              customRules(cfg));

      TriggerSettings t = TriggerSettings.defaults();
      TriggerSettings triggers =
          new TriggerSettings(
              cfg.getInt(PREFIX + "triggers.maxPerElement", t.maxPerElement()),
              cfg.getInt(PREFIX + "triggers.maxLength", t.maxLength()));

      String mode = cfg.getString(PREFIX + "index.acquireMode", "wait");
      AcquireMode acquireMode;
      try {
        acquireMode = AcquireMode.fromValue(mode);
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Unknown acquireMode '" + mode + "' (wait or fail-fast)", e);
      }

      IndexConfig config =
          new IndexConfig(
              Paths.get(cfg.getString(PREFIX + "index.path", "capability-index.yaml")),
              cfg.getLong(PREFIX + "index.leaseTimeoutMs", 60_000L),
              cfg.getLong(PREFIX + "index.leaseWaitMs", 30_000L),
              cfg.getLong(PREFIX + "index.leasePollMs", 50L),
              acquireMode,
              cfg.getInt(PREFIX + "scoring.minTokenLength", 2),
              cfg.getInt(PREFIX + "cache.capacity", 1000),
              budget,
              scoring,
              relationships,
              triggers,
              customVerbs(cfg),
              cfg.getLong(PREFIX + "build.deadlineMs", 0L),
              cfg.getInt(PREFIX + "build.workerThreads", 4),
              cfg.getInt(PREFIX + "build.scoringChunkSize", 64));
      config.validate();
      return config;
    } catch (ConversionException e) {
      throw new ConfigException("Invalid configuration value: " + e.getMessage(), e);
    }
  }

  /** Range checks; throws {@link ConfigException} naming the first offending key. */
  public void validate() {
    positive("index.leaseTimeoutMs", leaseTimeoutMs);
    nonNegative("index.leaseWaitMs", leaseWaitMs);
    positive("index.leasePollMs", leasePollMs);
    atLeast("scoring.minTokenLength", minTokenLength, 1);
    positive("cache.capacity", cacheCapacity);

    positive("budget.fullMatrixThreshold", budget.fullMatrixThreshold());
    positive("budget.fullMatrixHardCap", budget.fullMatrixHardCap());
    positive("budget.maxComparisons", budget.maxComparisons());
    unit("budget.keywordClusterBudgetPct", budget.keywordClusterBudgetPct());
    atLeast("budget.clusterSampleLimit", budget.clusterSampleLimit(), 2);

    nonNegative("scoring.entropy.low", scoring.entropyLow());
    nonNegative("scoring.entropy.moderateMin", scoring.entropyModerateMin());
    nonNegative("scoring.entropy.similarDelta", scoring.entropySimilarDelta());
    if (scoring.entropyModerateMin() > scoring.entropyModerateMax()) {
      throw new ConfigException(
          PREFIX + "scoring.entropy.moderateMin must not exceed scoring.entropy.moderateMax");
    }
    unit("scoring.jaccard.low", scoring.jaccardLow());
    unit("scoring.jaccard.high", scoring.jaccardHigh());
    if (scoring.jaccardLow() > scoring.jaccardHigh()) {
      throw new ConfigException(PREFIX + "scoring.jaccard.low must not exceed scoring.jaccard.high");
    }
    unit("scoring.weights.jaccard", scoring.jaccardWeight());
    unit("scoring.weights.entropyMatch", scoring.entropyWeight());
    if (scoring.jaccardWeight() + scoring.entropyWeight() <= 0.0) {
      throw new ConfigException(PREFIX + "scoring.weights must not both be zero");
    }
    unit("scoring.bands.highConfidence", scoring.highConfidenceScore());
    unit("scoring.bands.superficial", scoring.superficialScore());
    unit("scoring.bands.differentDomain", scoring.differentDomainScore());

    unit("relationships.similarityThreshold", relationships.similarityThreshold());
    unit("relationships.minConfidence", relationships.minConfidence());
    unit("relationships.verbConfidence", relationships.verbConfidence());
    positive("relationships.maxPerElement", relationships.maxPerElement());
    atLeast("relationships.maxElementsPerVerb", relationships.maxElementsPerVerb(), 2);

    positive("triggers.maxPerElement", triggers.maxPerElement());
    positive("triggers.maxLength", triggers.maxLength());

    nonNegative("build.deadlineMs", deadlineMs);
    positive("build.workerThreads", workerThreads);
    positive("build.scoringChunkSize", scoringChunkSize);
  }

  private static List<RelationshipSettings.RuleDefinition> customRules(Configuration cfg) {
    List<RelationshipSettings.RuleDefinition> rules = new ArrayList<>();
    if (!(cfg instanceof HierarchicalConfiguration<?> h)) {
      return rules;
    }
    int i = 0;
    for (HierarchicalConfiguration<?> rule : h.configurationsAt(PREFIX + "relationships.rules")) {
      String where = PREFIX + "relationships.rules[" + i++ + "]";
      String name = rule.getString("name", where);
      String pattern = rule.getString("pattern", null);
      String kindName = rule.getString("kind", null);
      if (pattern == null || kindName == null) {
        throw new ConfigException(where + " needs both 'kind' and 'pattern'");
      }
      RelationshipKind kind;
      try {
        kind = RelationshipKind.fromValue(kindName);
        Pattern.compile(pattern);
      } catch (PatternSyntaxException e) {
        throw new ConfigException(where + " has an invalid pattern: " + e.getDescription(), e);
      } catch (IllegalArgumentException e) {
        throw new ConfigException(where + " has an unknown kind '" + kindName + "'", e);
      }
      double confidence = rule.getDouble("confidence", 0.7);
      if (!(confidence >= 0.0 && confidence <= 1.0)) {
        throw new ConfigException(where + ".confidence must be within [0,1]");
      }
      rules.add(
          new RelationshipSettings.RuleDefinition(
              name, kind, pattern, confidence, rule.getString("target", null)));
    }
    return rules;
  }

  private static Map<String, List<String>> customVerbs(Configuration cfg) {
    Map<String, List<String>> out = new LinkedHashMap<>();
    Configuration verbs = cfg.subset(PREFIX + "triggers.customVerbs");
    Iterator<String> keys = verbs.getKeys();
    while (keys.hasNext()) {
      String category = keys.next();
      out.put(category, verbs.getList(String.class, category, List.of()));
    }
    return out;
  }

  private static void positive(String key, long value) {
    if (value <= 0) {
      throw new ConfigException(PREFIX + key + " must be positive, got " + value);
    }
  }

  private static void nonNegative(String key, double value) {
    if (value < 0) {
      throw new ConfigException(PREFIX + key + " must be non-negative, got " + value);
    }
  }

  private static void atLeast(String key, long value, long min) {
    if (value < min) {
      throw new ConfigException(PREFIX + key + " must be at least " + min + ", got " + value);
    }
  }

  private static void unit(String key, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new ConfigException(PREFIX + key + " must be between 0 and 1, got " + value);
    }
  }
}

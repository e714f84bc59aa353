package com.gentoro.capindex;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.capindex.exception.CapIndexErrorCode;
import com.gentoro.capindex.exception.ConfigException;
import com.gentoro.capindex.lease.AcquireMode;
import com.gentoro.capindex.relationship.RelationshipKind;
import com.gentoro.capindex.relationship.RelationshipSettings;
import java.io.StringReader;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.Test;

class IndexConfigTest {

  private static YAMLConfiguration yaml(String text) throws Exception {
    YAMLConfiguration config = new YAMLConfiguration();
    config.read(new StringReader(text));
    return config;
  }

  @Test
  void emptyConfigurationYieldsDefaults() {
    IndexConfig config = IndexConfig.defaults();
    assertEquals(Paths.get("capability-index.yaml"), config.indexPath());
    assertEquals(AcquireMode.WAIT, config.acquireMode());
    assertEquals(500, config.budget().maxComparisons());
    assertEquals(0.95, config.scoring().highConfidenceScore());
    assertEquals(RelationshipSettings.defaults(), config.relationships());
    assertTrue(config.customVerbs().isEmpty());
    assertEquals(Duration.ZERO, config.buildSettings().deadline());
  }

  @Test
  void bundledApplicationYamlMatchesDefaults() {
    ConfigurationProvider provider = new ConfigurationProvider("classpath:application.yaml");
    assertEquals(IndexConfig.defaults(), IndexConfig.fromConfiguration(provider.config()));
  }

  @Test
  void yamlOverridesAreApplied() throws Exception {
    IndexConfig config =
        IndexConfig.fromConfiguration(
            yaml(
                """
                capindex:
                  index:
                    path: /var/lib/capindex/index.yaml
                    acquireMode: fail-fast
                    leaseWaitMs: 0
                  budget:
                    maxComparisons: 800
                    keywordClusterBudgetPct: 0.5
                  scoring:
                    jaccard:
                      high: 0.7
                  build:
                    deadlineMs: 1500
                    workerThreads: 2
                """));

    assertEquals(Paths.get("/var/lib/capindex/index.yaml"), config.indexPath());
    assertEquals(AcquireMode.FAIL_FAST, config.acquireMode());
    assertEquals(800, config.budget().maxComparisons());
    assertEquals(0.5, config.budget().keywordClusterBudgetPct());
    assertEquals(0.7, config.scoring().jaccardHigh());
    assertEquals(0.2, config.scoring().jaccardLow());
    assertEquals(Duration.ofMillis(1500), config.buildSettings().deadline());
    assertEquals(Duration.ZERO, config.buildSettings().leaseWait());
    assertEquals(2, config.buildSettings().workerThreads());
  }

  @Test
  void customRulesAndVerbsAreRead() throws Exception {
    IndexConfig config =
        IndexConfig.fromConfiguration(
            yaml(
                """
                capindex:
                  relationships:
                    rules:
                      - name: escalates
                        kind: depends_on
                        pattern: "escalates? to ([\\\\w-]+)"
                        confidence: 0.75
                      - name: style-guide
                        kind: references
                        pattern: "house style"
                        target: style-guide
                  triggers:
                    customVerbs:
                      deployment: [ship, release]
                """));

    List<RelationshipSettings.RuleDefinition> rules = config.relationships().customRules();
    assertEquals(2, rules.size());
    assertEquals("escalates", rules.get(0).name());
    assertEquals(RelationshipKind.DEPENDS_ON, rules.get(0).kind());
    assertEquals(0.75, rules.get(0).confidence());
    assertNull(rules.get(0).target());
    assertEquals(0.7, rules.get(1).confidence());
    assertEquals("style-guide", rules.get(1).target());
    assertEquals(List.of("ship", "release"), config.customVerbs().get("deployment"));
  }

  @Test
  void outOfRangeValuesAreRejected() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("capindex.budget.keywordClusterBudgetPct", 1.5);
    ConfigException e = assertThrows(ConfigException.class, () -> IndexConfig.fromConfiguration(cfg));
    assertEquals(CapIndexErrorCode.CONFIGURATION_ERROR, e.getCode());
    assertTrue(e.getMessage().contains("capindex.budget.keywordClusterBudgetPct"));

    BaseConfiguration threads = new BaseConfiguration();
    threads.setProperty("capindex.build.workerThreads", 0);
    assertThrows(ConfigException.class, () -> IndexConfig.fromConfiguration(threads));

    BaseConfiguration jaccard = new BaseConfiguration();
    jaccard.setProperty("capindex.scoring.jaccard.low", 0.8);
    assertThrows(ConfigException.class, () -> IndexConfig.fromConfiguration(jaccard));
  }

  @Test
  void malformedValuesAreRejected() throws Exception {
    assertThrows(
        ConfigException.class,
        () -> IndexConfig.fromConfiguration(yaml("capindex:\n  budget:\n    maxComparisons: lots\n")));
    assertThrows(
        ConfigException.class,
        () -> IndexConfig.fromConfiguration(yaml("capindex:\n  index:\n    acquireMode: sometimes\n")));
  }

  @Test
  void invalidCustomRulesAreRejected() throws Exception {
    ConfigException badKind =
        assertThrows(
            ConfigException.class,
            () ->
                IndexConfig.fromConfiguration(
                    yaml(
                        """
                        capindex:
                          relationships:
                            rules:
                              - kind: befriends
                                pattern: "likes (\\\\w+)"
                        """)));
    assertTrue(badKind.getMessage().contains("befriends"));

    assertThrows(
        ConfigException.class,
        () ->
            IndexConfig.fromConfiguration(
                yaml(
                    """
                    capindex:
                      relationships:
                        rules:
                          - kind: uses
                            pattern: "broken ("
                    """)));

    assertThrows(
        ConfigException.class,
        () ->
            IndexConfig.fromConfiguration(
                yaml(
                    """
                    capindex:
                      relationships:
                        rules:
                          - kind: uses
                    """)));
  }
}

package com.gentoro.capindex.relationship;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gentoro.capindex.diagnostics.WarningCode;
import com.gentoro.capindex.diagnostics.WarningCollector;
import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.element.ElementSource;
import com.gentoro.capindex.element.ElementType;
import com.gentoro.capindex.element.TestElements;
import com.gentoro.capindex.index.CapabilityIndexService;
import com.gentoro.capindex.index.IndexBuilder;
import com.gentoro.capindex.scoring.PairId;
import com.gentoro.capindex.scoring.PairScore;
import com.gentoro.capindex.scoring.ScoreInterpretation;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RelationshipDiscovererTest {

  private final VerbTaxonomy taxonomy = new VerbTaxonomy();

  private RelationshipDiscoverer discoverer(RelationshipSettings settings) {
    return new RelationshipDiscoverer(settings, RelationshipRules.forSettings(settings), taxonomy);
  }

  private static PairScore score(String a, String b, double combined) {
    return new PairScore(
        PairId.of(a, b), combined, combined, combined, ScoreInterpretation.BLEND, 1, 0L);
  }

  private static RelationshipSettings withLimits(int maxPerElement, int maxElementsPerVerb) {
    return new RelationshipSettings(0.5, 0.5, maxPerElement, 0.7, maxElementsPerVerb, List.of());
  }

  @Test
  void patternRuleLinksMentionedElementWithInverse() {
    List<ElementRecord> records =
        List.of(
            TestElements.element("deploy-flow", ElementType.TEMPLATE, "uses build-tool daily", null),
            TestElements.element("build-tool", ElementType.SKILL, "compiles sources", null));
    DiscoveryResult result =
        discoverer(RelationshipSettings.defaults())
            .discover(
                new DiscoveryInput(records, List.of(), ActionTriggerMap.empty()),
                new WarningCollector());

    RelationshipEdge uses = result.outbound("deploy-flow").get(0);
    assertEquals(RelationshipKind.USES, uses.kind());
    assertEquals("build-tool", uses.targetId());
    assertEquals(0.8, uses.weight());
    assertInstanceOf(PatternEvidence.class, uses.evidence());
    assertEquals("uses", ((PatternEvidence) uses.evidence()).rule());

    RelationshipEdge usedBy = result.outbound("build-tool").get(0);
    assertEquals(RelationshipKind.USED_BY, usedBy.kind());
    assertEquals("deploy-flow", usedBy.targetId());
    assertTrue(usedBy.inverse());
    assertEquals(1, result.patternEdges());
  }

  @Test
  void patternRuleResolvesNamesLooselyAndSkipsSelfLinks() {
    List<ElementRecord> records =
        List.of(
            ElementRecord.of(
                "code-reviewer",
                ElementType.PERSONA,
                "Code Reviewer",
                "complements Security_Auditor and uses code-reviewer",
                null,
                null,
                null),
            ElementRecord.of(
                "security-auditor", ElementType.PERSONA, "Security Auditor", "", null, null, null));
    DiscoveryResult result =
        discoverer(RelationshipSettings.defaults())
            .discover(
                new DiscoveryInput(records, List.of(), ActionTriggerMap.empty()),
                new WarningCollector());

    assertEquals(1, result.outbound("code-reviewer").size());
    RelationshipEdge edge = result.outbound("code-reviewer").get(0);
    assertEquals(RelationshipKind.COMPLEMENTS, edge.kind());
    assertEquals("security-auditor", edge.targetId());
  }

  @Test
  void customRuleWithFixedTarget() {
    RelationshipSettings settings =
        new RelationshipSettings(
            0.5,
            0.5,
            20,
            0.7,
            10,
            List.of(
                new RelationshipSettings.RuleDefinition(
                    "postmortem", RelationshipKind.LED_TO, "\\bincident\\b", 0.9, "postmortem")));
    List<ElementRecord> records =
        List.of(
            TestElements.element("outage-notes", ElementType.MEMORY, "incident on friday", null),
            TestElements.element("postmortem", ElementType.TEMPLATE, "template", null));
    DiscoveryResult result =
        discoverer(settings)
            .discover(
                new DiscoveryInput(records, List.of(), ActionTriggerMap.empty()),
                new WarningCollector());

    assertEquals(RelationshipKind.LED_TO, result.outbound("outage-notes").get(0).kind());
    assertEquals(RelationshipKind.RESULTED_FROM, result.outbound("postmortem").get(0).kind());
  }

  @Test
  void similarityFeedHonoursThreshold() {
    List<ElementRecord> records =
        List.of(
            TestElements.skill("a", ""), TestElements.skill("b", ""), TestElements.skill("c", ""));
    DiscoveryResult result =
        discoverer(RelationshipSettings.defaults())
            .discover(
                new DiscoveryInput(
                    records, List.of(score("a", "b", 0.95), score("a", "c", 0.3)), ActionTriggerMap.empty()),
                new WarningCollector());

    assertEquals(1, result.similarityEdges());
    assertEquals(2, result.totalEdges());
    RelationshipEdge ab = result.outbound("a").get(0);
    assertEquals(RelationshipKind.SIMILAR_TO, ab.kind());
    assertEquals(0.95, ab.weight());
    assertInstanceOf(ScoreEvidence.class, ab.evidence());
    assertEquals(RelationshipKind.SIMILAR_TO, result.outbound("b").get(0).kind());
    assertTrue(result.outbound("c").isEmpty());
  }

  @Test
  void sharedVerbsLinkElements() {
    List<ElementRecord> records =
        List.of(
            TestElements.skill("a", ""),
            TestElements.skill("b", ""),
            TestElements.skill("c", ""),
            TestElements.skill("d", ""));
    ActionTriggerMap triggers =
        new ActionTriggerMap(Map.of("create", List.of("a", "b"), "deploy", List.of("c", "d")));
    DiscoveryResult result =
        discoverer(RelationshipSettings.defaults())
            .discover(new DiscoveryInput(records, List.of(), triggers), new WarningCollector());

    RelationshipEdge ab = result.outbound("a").get(0);
    assertEquals(RelationshipKind.COMPLEMENTS, ab.kind());
    assertEquals(0.7, ab.weight());
    assertEquals(new TriggerEvidence("create", VerbTaxonomy.CREATION), ab.evidence());

    RelationshipEdge cd = result.outbound("c").get(0);
    assertEquals(RelationshipKind.COMMONLY_USED_WITH, cd.kind());
    assertEquals(2, result.triggerEdges());
  }

  @Test
  void genericVerbsAreIgnored() {
    List<ElementRecord> records =
        List.of(
            TestElements.skill("a", ""), TestElements.skill("b", ""), TestElements.skill("c", ""));
    ActionTriggerMap triggers = new ActionTriggerMap(Map.of("run", List.of("a", "b", "c")));
    DiscoveryResult result =
        discoverer(withLimits(20, 2))
            .discover(new DiscoveryInput(records, List.of(), triggers), new WarningCollector());
    assertEquals(0, result.totalEdges());
  }

  @Test
  void edgesBelowMinConfidenceAreDropped() {
    RelationshipSettings settings = new RelationshipSettings(0.5, 0.75, 20, 0.7, 10, List.of());
    List<ElementRecord> records = List.of(TestElements.skill("a", ""), TestElements.skill("b", ""));
    ActionTriggerMap triggers = new ActionTriggerMap(Map.of("create", List.of("a", "b")));
    DiscoveryResult result =
        discoverer(settings)
            .discover(new DiscoveryInput(records, List.of(), triggers), new WarningCollector());
    assertEquals(0, result.totalEdges());
  }

  @Test
  void perElementLimitKeepsStrongestDiscoveredEdges() {
    List<ElementRecord> records =
        List.of(
            TestElements.skill("a", ""), TestElements.skill("b", ""), TestElements.skill("c", ""));
    DiscoveryResult result =
        discoverer(withLimits(1, 10))
            .discover(
                new DiscoveryInput(
                    records, List.of(score("a", "b", 0.9), score("a", "c", 0.8)), ActionTriggerMap.empty()),
                new WarningCollector());

    assertEquals(1, result.outbound("a").size());
    assertEquals("b", result.outbound("a").get(0).targetId());
    assertTrue(result.outbound("c").isEmpty());
  }

  @Test
  void everyEdgeHasItsInverse() {
    List<ElementRecord> records = new ArrayList<>(TestElements.corpus(12));
    records.add(
        TestElements.element("helper", ElementType.SKILL, "debugs el-001 and requires el-002", null));
    ActionTriggerMap triggers =
        new ActionTriggerMap(Map.of("review", List.of("el-003", "el-004", "el-005")));
    DiscoveryResult result =
        discoverer(RelationshipSettings.defaults())
            .discover(
                new DiscoveryInput(records, List.of(score("el-000", "el-006", 0.8)), triggers),
                new WarningCollector());

    assertTrue(result.totalEdges() > 0);
    for (List<RelationshipEdge> edges : result.outboundEdges().values()) {
      for (RelationshipEdge e : edges) {
        assertTrue(
            result.outbound(e.targetId()).stream()
                .anyMatch(
                    back -> back.targetId().equals(e.sourceId()) && back.kind() == e.kind().inverse()),
            "missing inverse of " + e);
      }
    }
  }

  @Test
  void failingRuleIsRecordedAndSkipped() {
    RelationshipRule failing = mock(RelationshipRule.class);
    when(failing.name()).thenReturn("exploding");
    when(failing.apply(any(), any())).thenThrow(new IllegalStateException("boom"));
    List<RelationshipRule> rules = new ArrayList<>(RelationshipRules.defaults());
    rules.add(0, failing);

    List<ElementRecord> records =
        List.of(
            TestElements.element("a", ElementType.SKILL, "uses b", null),
            TestElements.element("b", ElementType.SKILL, "", null));
    WarningCollector warnings = new WarningCollector();
    DiscoveryResult result =
        new RelationshipDiscoverer(RelationshipSettings.defaults(), rules, taxonomy)
            .discover(new DiscoveryInput(records, List.of(), ActionTriggerMap.empty()), warnings);

    assertTrue(warnings.contains(WarningCode.RULE_FAILURE));
    assertEquals(2, warnings.size());
    assertEquals(RelationshipKind.USES, result.outbound("a").get(0).kind());
  }

  @Test
  @DisplayName("the discoverer holds no reference back to builder, service or element source")
  void discovererHasNoBackReferences() {
    for (Field field : RelationshipDiscoverer.class.getDeclaredFields()) {
      Class<?> type = field.getType();
      assertFalse(IndexBuilder.class.isAssignableFrom(type), field.getName());
      assertFalse(CapabilityIndexService.class.isAssignableFrom(type), field.getName());
      assertFalse(ElementSource.class.isAssignableFrom(type), field.getName());
      assertFalse(type.getPackageName().endsWith(".index"), field.getName());
    }
  }
}

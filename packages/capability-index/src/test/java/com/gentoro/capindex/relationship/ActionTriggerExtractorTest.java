package com.gentoro.capindex.relationship;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.capindex.diagnostics.WarningCode;
import com.gentoro.capindex.diagnostics.WarningCollector;
import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.element.ElementType;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ActionTriggerExtractorTest {

  private final ActionTriggerExtractor extractor =
      new ActionTriggerExtractor(TriggerSettings.defaults(), new VerbTaxonomy());

  private static ElementRecord record(String id, List<String> keywords, List<String> triggers) {
    return ElementRecord.of(id, ElementType.SKILL, id, "", keywords, null, triggers);
  }

  @Test
  void explicitTriggersAreNormalizedAndFiltered() {
    WarningCollector warnings = new WarningCollector();
    Set<String> triggers =
        extractor.triggersOf(
            record("s", null, List.of(" Create ", "bad trigger!", "x1", "re-run", "create")),
            warnings);
    assertEquals(Set.of("create", "re-run"), triggers);
    assertEquals(0, warnings.size());
  }

  @Test
  void verbLikeKeywordsBecomeTriggers() {
    Set<String> triggers =
        extractor.triggersOf(
            record("s", List.of("deploy", "database", "validate", "automation", "automate"), null),
            new WarningCollector());
    assertEquals(Set.of("deploy", "validate", "automate"), triggers);
  }

  @Test
  void tooManyTriggersAreTruncatedWithWarning() {
    ActionTriggerExtractor limited =
        new ActionTriggerExtractor(new TriggerSettings(2, 50), new VerbTaxonomy());
    WarningCollector warnings = new WarningCollector();
    Set<String> triggers =
        limited.triggersOf(record("s", null, List.of("build", "test", "deploy")), warnings);

    assertEquals(2, triggers.size());
    assertTrue(warnings.contains(WarningCode.TRIGGER_LIMIT));
  }

  @Test
  void overlongTriggersAreDropped() {
    ActionTriggerExtractor shortOnly =
        new ActionTriggerExtractor(new TriggerSettings(50, 5), new VerbTaxonomy());
    assertNull(shortOnly.normalize("configure"));
    assertEquals("build", shortOnly.normalize("BUILD"));
  }

  @Test
  void mapsVerbsToSortedElementIds() {
    WarningCollector warnings = new WarningCollector();
    ActionTriggerMap map =
        extractor.extract(
            List.of(
                record("b", null, List.of("review")),
                record("a", null, List.of("review", "debug")),
                record("c", List.of("misc"), null)),
            warnings);

    assertEquals(Map.of("debug", List.of("a"), "review", List.of("a", "b")), map.asMap());
    assertEquals(List.of("debug", "review"), map.verbsFor("a"));
    assertTrue(warnings.contains(WarningCode.INVALID_ELEMENT_RECORD));
    assertEquals("c", warnings.snapshot().get(0).elementId());
  }

  @Test
  void taxonomyResolvesInflectedForms() {
    VerbTaxonomy taxonomy = new VerbTaxonomy();
    assertEquals("debugging", taxonomy.categoryOf("debugging").orElseThrow());
    assertEquals(VerbTaxonomy.CREATION, taxonomy.categoryOf("created").orElseThrow());
    assertEquals(VerbTaxonomy.CREATION, taxonomy.categoryOf("creating").orElseThrow());
    assertEquals(VerbTaxonomy.ANALYSIS, taxonomy.categoryOf("reviews").orElseThrow());
    assertEquals("execution", taxonomy.categoryOf("running").orElseThrow());
    assertTrue(taxonomy.categoryOf("deploy").isEmpty());
  }

  @Test
  void customVerbsExtendButDoNotOverrideDefaults() {
    VerbTaxonomy taxonomy =
        new VerbTaxonomy(Map.of("release", List.of("deploy", "ship", "create")));
    assertEquals("release", taxonomy.categoryOf("deploy").orElseThrow());
    assertEquals("release", taxonomy.categoryOf("ship").orElseThrow());
    assertEquals(VerbTaxonomy.CREATION, taxonomy.categoryOf("create").orElseThrow());
  }
}

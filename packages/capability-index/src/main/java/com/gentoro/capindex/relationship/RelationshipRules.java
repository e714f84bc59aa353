package com.gentoro.capindex.relationship;

import java.util.ArrayList;
import java.util.List;

/** Built-in pattern rules. */
public final class RelationshipRules {
  private static final String NAME = "([\\w][\\w-]*)";

  private RelationshipRules() {}

  public static List<RelationshipRule> defaults() {
    return List.of(
        RelationshipRule.of("uses", RelationshipKind.USES, "\\buses?\\s+" + NAME, 0.8),
        RelationshipRule.of("requires", RelationshipKind.USES, "\\brequires?\\s+" + NAME, 0.7),
        RelationshipRule.of(
            "depends-on", RelationshipKind.USES, "\\bdepends?\\s+on\\s+" + NAME, 0.7),
        RelationshipRule.of(
            "prerequisite-for",
            RelationshipKind.PREREQUISITE_FOR,
            "\\bprerequisite\\s+for\\s+" + NAME,
            0.9),
        RelationshipRule.of("after", RelationshipKind.DEPENDS_ON, "\\bafter\\s+" + NAME, 0.6),
        RelationshipRule.of(
            "debugs", RelationshipKind.HELPS_DEBUG, "\\bdebug(?:s|ging)?\\s+" + NAME, 0.7),
        RelationshipRule.of(
            "troubleshoots",
            RelationshipKind.HELPS_DEBUG,
            "\\btroubleshoot(?:s|ing)?\\s+" + NAME,
            0.7),
        RelationshipRule.of(
            "supports", RelationshipKind.COMPLEMENTS, "\\bsupports?\\s+" + NAME, 0.8),
        RelationshipRule.of(
            "complements", RelationshipKind.COMPLEMENTS, "\\bcomplements?\\s+" + NAME, 0.8),
        RelationshipRule.of(
            "contradicts", RelationshipKind.CONTRADICTS, "\\bcontradicts?\\s+" + NAME, 0.9),
        RelationshipRule.of(
            "example-of", RelationshipKind.REFERENCES, "\\bexample\\s+of\\s+" + NAME, 0.9),
        RelationshipRule.of(
            "see-for-example",
            RelationshipKind.REFERENCES,
            "\\bsee\\s+" + NAME + "\\s+for\\s+example",
            0.7));
  }

  /** Built-in rules followed by the compiled custom rules of {@code settings}. */
  public static List<RelationshipRule> forSettings(RelationshipSettings settings) {
    List<RelationshipRule> all = new ArrayList<>(defaults());
    settings.customRules().forEach(def -> all.add(RelationshipRule.compile(def)));
    return List.copyOf(all);
  }
}

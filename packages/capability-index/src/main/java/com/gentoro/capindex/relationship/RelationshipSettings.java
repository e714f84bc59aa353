package com.gentoro.capindex.relationship;

import java.util.List;

/**
 * @param similarityThreshold combined score at or above which a scored pair becomes similar_to
 * @param minConfidence edges weaker than this are discarded
 * @param maxPerElement discovered (non-inverse) edges kept per source element, strongest first
 * @param verbConfidence weight of edges between elements sharing a trigger verb
 * @param maxElementsPerVerb verbs shared by more elements than this are too generic to link
 * @param customRules configured pattern rules, evaluated after the built-in ones
 */
public record RelationshipSettings(
    double similarityThreshold,
    double minConfidence,
    int maxPerElement,
    double verbConfidence,
    int maxElementsPerVerb,
    List<RuleDefinition> customRules) {

  public RelationshipSettings {
    customRules = customRules == null ? List.of() : List.copyOf(customRules);
  }

  public static RelationshipSettings defaults() {
    return new RelationshipSettings(0.5, 0.5, 20, 0.7, 10, List.of());
  }

  /** Configured rule before compilation. {@code target} is optional. */
  public record RuleDefinition(
      String name, RelationshipKind kind, String pattern, double confidence, String target) {}
}

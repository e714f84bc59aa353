package com.gentoro.capindex.relationship;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * Directed, typed edge. {@code inverse} is true when the edge was created as the structural
 * reciprocal of another edge rather than discovered on its own.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationshipEdge(
    String sourceId,
    String targetId,
    RelationshipKind kind,
    double weight,
    Evidence evidence,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean inverse) {

  public RelationshipEdge {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(kind, "kind");
    if (!(weight >= 0.0 && weight <= 1.0)) {
      throw new IllegalArgumentException("weight must be within [0,1], got " + weight);
    }
  }

  public static RelationshipEdge of(
      String sourceId, String targetId, RelationshipKind kind, double weight, Evidence evidence) {
    return new RelationshipEdge(sourceId, targetId, kind, weight, evidence, false);
  }

  /** The reciprocal edge: reversed endpoints, inverse kind, same weight and evidence. */
  public RelationshipEdge inverseEdge() {
    return new RelationshipEdge(targetId, sourceId, kind.inverse(), weight, evidence, true);
  }

  public RelationshipEdge withWeight(double newWeight, Evidence newEvidence) {
    return new RelationshipEdge(sourceId, targetId, kind, newWeight, newEvidence, inverse);
  }
}

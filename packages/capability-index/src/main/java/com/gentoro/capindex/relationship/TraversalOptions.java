package com.gentoro.capindex.relationship;

import java.util.EnumSet;
import java.util.Set;

/**
 * Bounds for graph traversal.
 *
 * @param kinds edge kinds to follow; empty means all
 */
public record TraversalOptions(int maxDepth, Set<RelationshipKind> kinds, double minStrength) {

  public TraversalOptions {
    if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
    kinds = kinds == null || kinds.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(kinds));
  }

  public static TraversalOptions forPaths() {
    return new TraversalOptions(5, Set.of(), 0.0);
  }

  public static TraversalOptions forNeighbourhood() {
    return new TraversalOptions(2, Set.of(), 0.0);
  }

  boolean follows(RelationshipEdge edge) {
    return edge.weight() >= minStrength && (kinds.isEmpty() || kinds.contains(edge.kind()));
  }
}

package com.gentoro.capindex.relationship;

import java.util.List;

/**
 * Walk through the relationship graph. {@code strength} is the product of the edge weights, 1.0
 * for the empty path.
 */
public record ElementPath(List<String> elementIds, List<RelationshipEdge> edges, double strength) {

  public ElementPath {
    elementIds = List.copyOf(elementIds);
    edges = List.copyOf(edges);
  }

  public int length() {
    return edges.size();
  }
}

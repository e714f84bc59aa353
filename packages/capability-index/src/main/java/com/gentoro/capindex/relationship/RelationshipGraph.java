package com.gentoro.capindex.relationship;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/** Read-only traversal over the outbound edges of an index. */
public class RelationshipGraph {
  private final Map<String, List<RelationshipEdge>> outbound;

  public RelationshipGraph(Map<String, List<RelationshipEdge>> outbound) {
    this.outbound = outbound;
  }

  public List<RelationshipEdge> outbound(String elementId) {
    return outbound.getOrDefault(elementId, List.of());
  }

  /** Shortest path by edge count (breadth first), or empty when none exists within maxDepth. */
  public Optional<ElementPath> findPath(String from, String to, TraversalOptions options) {
    if (from.equals(to)) {
      return Optional.of(new ElementPath(List.of(from), List.of(), 1.0));
    }
    Deque<ElementPath> queue = new ArrayDeque<>();
    Set<String> visited = new HashSet<>();
    queue.add(new ElementPath(List.of(from), List.of(), 1.0));
    visited.add(from);
    while (!queue.isEmpty()) {
      ElementPath current = queue.poll();
      if (current.length() >= options.maxDepth()) continue;
      String last = current.elementIds().get(current.elementIds().size() - 1);
      for (RelationshipEdge edge : outbound(last)) {
        if (!options.follows(edge) || !visited.add(edge.targetId())) continue;
        ElementPath next = extend(current, edge);
        if (edge.targetId().equals(to)) {
          return Optional.of(next);
        }
        queue.add(next);
      }
    }
    return Optional.empty();
  }

  /**
   * Elements reachable from {@code elementId} within {@code maxDepth} hops, each mapped to the first
   * (shortest) path found.
   */
  public Map<String, ElementPath> connectedElements(String elementId, TraversalOptions options) {
    Map<String, ElementPath> connected = new LinkedHashMap<>();
    Deque<ElementPath> queue = new ArrayDeque<>();
    Set<String> visited = new HashSet<>();
    visited.add(elementId);
    queue.add(new ElementPath(List.of(elementId), List.of(), 1.0));
    while (!queue.isEmpty()) {
      ElementPath current = queue.poll();
      if (current.length() >= options.maxDepth()) continue;
      String last = current.elementIds().get(current.elementIds().size() - 1);
      for (RelationshipEdge edge : outbound(last)) {
        if (!options.follows(edge) || !visited.add(edge.targetId())) continue;
        ElementPath next = extend(current, edge);
        connected.put(edge.targetId(), next);
        queue.add(next);
      }
    }
    return connected;
  }

  public RelationshipStats stats() {
    Map<String, Integer> byKind = new TreeMap<>();
    int total = 0;
    int withEdges = 0;
    for (List<RelationshipEdge> edges : outbound.values()) {
      if (!edges.isEmpty()) withEdges++;
      for (RelationshipEdge e : edges) {
        byKind.merge(e.kind().wireName(), 1, Integer::sum);
        total++;
      }
    }
    return new RelationshipStats(total, withEdges, byKind);
  }

  private static ElementPath extend(ElementPath path, RelationshipEdge edge) {
    List<String> ids = new ArrayList<>(path.elementIds());
    ids.add(edge.targetId());
    List<RelationshipEdge> edges = new ArrayList<>(path.edges());
    edges.add(edge);
    return new ElementPath(ids, edges, path.strength() * edge.weight());
  }
}

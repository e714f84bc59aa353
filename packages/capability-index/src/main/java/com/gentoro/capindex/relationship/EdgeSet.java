package com.gentoro.capindex.relationship;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Edge collection that keeps every edge paired with its inverse. Adding a forward edge inserts the
 * reciprocal in the same call, so no reader can observe one without the other. When the same
 * (source, target, kind) is added twice the stronger weight wins, on both directions.
 */
public class EdgeSet {
  public static final Comparator<RelationshipEdge> ORDER =
      Comparator.comparingDouble(RelationshipEdge::weight)
          .reversed()
          .thenComparing(e -> e.kind().wireName())
          .thenComparing(RelationshipEdge::targetId);

  private record Key(String sourceId, String targetId, RelationshipKind kind) {
    static Key of(RelationshipEdge e) {
      return new Key(e.sourceId(), e.targetId(), e.kind());
    }
  }

  private final Map<Key, RelationshipEdge> edges = new LinkedHashMap<>();
  private final Map<String, Integer> discoveredBySource = new HashMap<>();

  /**
   * Insert {@code edge} and its inverse.
   *
   * @return false for self-edges, which are never stored
   */
  public synchronized boolean add(RelationshipEdge edge) {
    if (edge.sourceId().equals(edge.targetId())) {
      return false;
    }
    RelationshipEdge forward =
        edge.inverse()
            ? new RelationshipEdge(
                edge.sourceId(), edge.targetId(), edge.kind(), edge.weight(), edge.evidence(), false)
            : edge;
    boolean isNew = !edges.containsKey(Key.of(forward)) || edges.get(Key.of(forward)).inverse();
    upsert(forward);
    upsert(forward.inverseEdge());
    if (isNew) {
      discoveredBySource.merge(forward.sourceId(), 1, Integer::sum);
    }
    return true;
  }

  private void upsert(RelationshipEdge edge) {
    Key key = Key.of(edge);
    RelationshipEdge existing = edges.get(key);
    if (existing == null) {
      edges.put(key, edge);
      return;
    }
    boolean inverse = existing.inverse() && edge.inverse();
    RelationshipEdge stronger = edge.weight() > existing.weight() ? edge : existing;
    edges.put(
        key,
        new RelationshipEdge(
            key.sourceId(),
            key.targetId(),
            key.kind(),
            stronger.weight(),
            stronger.evidence(),
            inverse));
  }

  public synchronized boolean contains(String sourceId, String targetId, RelationshipKind kind) {
    return edges.containsKey(new Key(sourceId, targetId, kind));
  }

  /** Number of edges discovered with {@code sourceId} as their source, inverses excluded. */
  public synchronized int discoveredCount(String sourceId) {
    return discoveredBySource.getOrDefault(sourceId, 0);
  }

  public synchronized int size() {
    return edges.size();
  }

  public synchronized List<RelationshipEdge> all() {
    return List.copyOf(edges.values());
  }

  /** Outbound edges grouped by source, sources sorted, edges strongest first. */
  public synchronized Map<String, List<RelationshipEdge>> bySource() {
    Map<String, List<RelationshipEdge>> out = new TreeMap<>();
    for (RelationshipEdge e : edges.values()) {
      out.computeIfAbsent(e.sourceId(), k -> new ArrayList<>()).add(e);
    }
    out.replaceAll(
        (k, list) -> {
          list.sort(ORDER);
          return List.copyOf(list);
        });
    return out;
  }
}

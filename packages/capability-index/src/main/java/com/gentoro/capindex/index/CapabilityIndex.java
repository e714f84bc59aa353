package com.gentoro.capindex.index;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.capindex.relationship.ActionTriggerMap;
import com.gentoro.capindex.relationship.RelationshipEdge;
import com.gentoro.capindex.relationship.RelationshipGraph;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Persisted result of one build. Immutable; a later build replaces it as a whole.
 *
 * <p>Elements are keyed and ordered by id so identical inputs encode to identical documents.
 */
@JsonPropertyOrder({"schemaVersion", "generatedAt", "buildStats", "actionTriggerMap", "elements"})
public record CapabilityIndex(
    int schemaVersion,
    Instant generatedAt,
    SortedMap<String, IndexedElement> elements,
    ActionTriggerMap actionTriggerMap,
    BuildStats buildStats) {

  public CapabilityIndex {
    elements =
        Collections.unmodifiableSortedMap(
            elements == null ? new TreeMap<>() : new TreeMap<>(elements));
    actionTriggerMap = actionTriggerMap == null ? ActionTriggerMap.empty() : actionTriggerMap;
  }

  public Optional<IndexedElement> element(String id) {
    return Optional.ofNullable(elements.get(id));
  }

  public List<RelationshipEdge> outboundEdges(String id) {
    IndexedElement e = elements.get(id);
    return e == null ? List.of() : e.outboundEdges();
  }

  public RelationshipGraph relationshipGraph() {
    Map<String, List<RelationshipEdge>> outbound = new LinkedHashMap<>();
    elements.forEach((id, e) -> outbound.put(id, e.outboundEdges()));
    return new RelationshipGraph(outbound);
  }
}

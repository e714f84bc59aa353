package com.gentoro.capindex.relationship;

import java.util.List;
import java.util.Map;

/** Outbound edges per element plus how many discovered edges each feed contributed. */
public record DiscoveryResult(
    Map<String, List<RelationshipEdge>> outboundEdges,
    int similarityEdges,
    int patternEdges,
    int triggerEdges,
    int totalEdges) {

  public List<RelationshipEdge> outbound(String elementId) {
    return outboundEdges.getOrDefault(elementId, List.of());
  }
}

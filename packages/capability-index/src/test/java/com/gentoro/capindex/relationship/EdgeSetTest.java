package com.gentoro.capindex.relationship;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EdgeSetTest {

  private static RelationshipEdge edge(String s, String t, RelationshipKind k, double w) {
    return RelationshipEdge.of(s, t, k, w, new PatternEvidence("test", s + "->" + t));
  }

  @Test
  void addingAnEdgeAlsoAddsItsInverse() {
    EdgeSet set = new EdgeSet();
    assertTrue(set.add(edge("a", "b", RelationshipKind.USES, 0.8)));

    assertTrue(set.contains("a", "b", RelationshipKind.USES));
    assertTrue(set.contains("b", "a", RelationshipKind.USED_BY));
    assertEquals(2, set.size());

    RelationshipEdge inverse = set.bySource().get("b").get(0);
    assertTrue(inverse.inverse());
    assertEquals(0.8, inverse.weight());
  }

  @Test
  void symmetricKindMirrorsWithSameKind() {
    EdgeSet set = new EdgeSet();
    set.add(edge("a", "b", RelationshipKind.SIMILAR_TO, 0.7));
    assertTrue(set.contains("b", "a", RelationshipKind.SIMILAR_TO));
  }

  @Test
  void selfEdgesAreRejected() {
    EdgeSet set = new EdgeSet();
    assertFalse(set.add(edge("a", "a", RelationshipKind.USES, 0.8)));
    assertEquals(0, set.size());
  }

  @Test
  void duplicateKeepsStrongerWeightOnBothDirections() {
    EdgeSet set = new EdgeSet();
    set.add(edge("a", "b", RelationshipKind.USES, 0.6));
    set.add(edge("a", "b", RelationshipKind.USES, 0.9));
    set.add(edge("a", "b", RelationshipKind.USES, 0.7));

    Map<String, List<RelationshipEdge>> bySource = set.bySource();
    assertEquals(0.9, bySource.get("a").get(0).weight());
    assertEquals(0.9, bySource.get("b").get(0).weight());
    assertEquals(2, set.size());
    assertEquals(1, set.discoveredCount("a"));
  }

  @Test
  void discoveringTheReciprocalClearsTheInverseFlag() {
    EdgeSet set = new EdgeSet();
    set.add(edge("a", "b", RelationshipKind.USES, 0.8));
    set.add(edge("b", "a", RelationshipKind.USED_BY, 0.5));

    RelationshipEdge ba = set.bySource().get("b").get(0);
    assertFalse(ba.inverse());
    assertEquals(0.8, ba.weight());
    assertEquals(1, set.discoveredCount("b"));
  }

  @Test
  void outboundEdgesAreOrderedStrongestFirst() {
    EdgeSet set = new EdgeSet();
    set.add(edge("a", "c", RelationshipKind.USES, 0.6));
    set.add(edge("a", "b", RelationshipKind.REFERENCES, 0.9));
    set.add(edge("a", "d", RelationshipKind.COMPLEMENTS, 0.6));

    List<RelationshipEdge> out = set.bySource().get("a");
    assertEquals(List.of("b", "d", "c"), out.stream().map(RelationshipEdge::targetId).toList());
  }

  @Test
  void edgeWeightMustBeAUnitValue() {
    assertThrows(
        IllegalArgumentException.class, () -> edge("a", "b", RelationshipKind.USES, 1.5));
  }
}

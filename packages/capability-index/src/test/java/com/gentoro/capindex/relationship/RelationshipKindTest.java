package com.gentoro.capindex.relationship;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RelationshipKindTest {

  @Test
  void everyKindHasAnInverseThatMapsBack() {
    for (RelationshipKind kind : RelationshipKind.values()) {
      assertNotNull(kind.inverse(), kind.name());
      assertEquals(kind, kind.inverse().inverse(), kind.name());
    }
  }

  @Test
  void directionalPairs() {
    assertEquals(RelationshipKind.USED_BY, RelationshipKind.USES.inverse());
    assertEquals(RelationshipKind.DEBUGGED_BY, RelationshipKind.HELPS_DEBUG.inverse());
    assertEquals(RelationshipKind.DEPENDS_ON, RelationshipKind.PREREQUISITE_FOR.inverse());
    assertEquals(RelationshipKind.REFERENCED_BY, RelationshipKind.REFERENCES.inverse());
    assertEquals(RelationshipKind.RESULTED_FROM, RelationshipKind.LED_TO.inverse());
    assertFalse(RelationshipKind.USES.isSymmetric());
  }

  @Test
  void symmetricKindsAreTheirOwnInverse() {
    assertTrue(RelationshipKind.SIMILAR_TO.isSymmetric());
    assertTrue(RelationshipKind.COMPLEMENTS.isSymmetric());
    assertTrue(RelationshipKind.CONTRADICTS.isSymmetric());
    assertTrue(RelationshipKind.COMMONLY_USED_WITH.isSymmetric());
  }

  @Test
  void wireNamesRoundTrip() {
    assertEquals("helps_debug", RelationshipKind.HELPS_DEBUG.wireName());
    assertEquals(RelationshipKind.HELPS_DEBUG, RelationshipKind.fromValue("helps-debug"));
    assertEquals(RelationshipKind.USED_BY, RelationshipKind.fromValue(" USED_BY "));
    assertThrows(IllegalArgumentException.class, () -> RelationshipKind.fromValue("likes"));
    assertThrows(IllegalArgumentException.class, () -> RelationshipKind.fromValue(""));
  }
}

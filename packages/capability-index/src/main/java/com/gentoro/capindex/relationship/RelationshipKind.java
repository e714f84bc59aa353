package com.gentoro.capindex.relationship;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Closed set of relationship types. Every kind has exactly one inverse; symmetric kinds are their
 * own inverse.
 */
public enum RelationshipKind {
  SIMILAR_TO,
  COMPLEMENTS,
  CONTRADICTS,
  COMMONLY_USED_WITH,
  USES,
  USED_BY,
  HELPS_DEBUG,
  DEBUGGED_BY,
  PREREQUISITE_FOR,
  DEPENDS_ON,
  REFERENCES,
  REFERENCED_BY,
  LED_TO,
  RESULTED_FROM;

  public RelationshipKind inverse() {
    return switch (this) {
      case SIMILAR_TO, COMPLEMENTS, CONTRADICTS, COMMONLY_USED_WITH -> this;
      case USES -> USED_BY;
      case USED_BY -> USES;
      case HELPS_DEBUG -> DEBUGGED_BY;
      case DEBUGGED_BY -> HELPS_DEBUG;
      case PREREQUISITE_FOR -> DEPENDS_ON;
      case DEPENDS_ON -> PREREQUISITE_FOR;
      case REFERENCES -> REFERENCED_BY;
      case REFERENCED_BY -> REFERENCES;
      case LED_TO -> RESULTED_FROM;
      case RESULTED_FROM -> LED_TO;
    };
  }

  public boolean isSymmetric() {
    return inverse() == this;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Parse a wire name; unknown values raise {@link IllegalArgumentException}. */
  @JsonCreator
  public static RelationshipKind fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("relationship kind is required");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
  }
}

package com.gentoro.capindex.element;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kinds of content element a capability index covers. */
public enum ElementType {
  PERSONA,
  SKILL,
  TEMPLATE,
  AGENT,
  MEMORY,
  ENSEMBLE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Lenient parse accepting any case and the plural directory names ("skills", "memories"). */
  @JsonCreator
  public static ElementType fromValue(String value) {
    if (value == null || value.isBlank()) return null;
    String v = value.trim().toUpperCase(Locale.ROOT);
    if (v.equals("MEMORIES")) return MEMORY;
    for (ElementType t : values()) {
      if (t.name().equals(v) || (t.name() + "S").equals(v)) return t;
    }
    return null;
  }
}

package com.gentoro.capindex.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Completeness {
  COMPLETE,
  /** Scoring stopped at the build deadline before the comparison plan was exhausted. */
  PARTIAL;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Completeness fromValue(String value) {
    return value == null ? COMPLETE : valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

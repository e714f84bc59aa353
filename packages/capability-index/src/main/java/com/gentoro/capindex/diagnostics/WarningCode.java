package com.gentoro.capindex.diagnostics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum WarningCode {
  INVALID_ELEMENT_RECORD,
  RULE_FAILURE,
  SCORING_FAILURE,
  TRIGGER_LIMIT,
  DEADLINE_EXCEEDED,
  UNKNOWN;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static WarningCode fromValue(String value) {
    if (value == null) return UNKNOWN;
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return UNKNOWN;
    }
  }
}

package com.gentoro.capindex.budget;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ComparisonStrategy {
  /** Every pair is compared. */
  FULL,
  /** A fixed number of pairs is drawn from keyword clusters and across element types. */
  SAMPLED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ComparisonStrategy fromValue(String value) {
    return value == null ? null : valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

package com.gentoro.capindex.scoring;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Which band of the scoring rules produced a combined score. */
public enum ScoreInterpretation {
  /** High overlap on low-information text: shared boilerplate, not shared meaning. */
  SUPERFICIAL,
  /** High overlap on moderately rich text. */
  HIGH_CONFIDENCE,
  /** No overlap at similar complexity. */
  DIFFERENT_DOMAIN,
  BLEND;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

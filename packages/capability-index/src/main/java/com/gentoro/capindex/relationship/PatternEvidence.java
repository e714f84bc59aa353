package com.gentoro.capindex.relationship;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Edge found by a textual rule; {@code matchedText} is the fragment the rule matched. */
@JsonIgnoreProperties(value = "source", allowGetters = true)
public record PatternEvidence(String rule, String matchedText) implements Evidence {
  public static final String SOURCE = "pattern";

  @Override
  @JsonProperty("source")
  public String source() {
    return SOURCE;
  }
}

package com.gentoro.capindex.relationship;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Edge between two elements that answer to the same action verb. */
@JsonIgnoreProperties(value = "source", allowGetters = true)
public record TriggerEvidence(String verb, String category) implements Evidence {
  public static final String SOURCE = "trigger";

  @Override
  @JsonProperty("source")
  public String source() {
    return SOURCE;
  }
}

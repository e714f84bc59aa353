package com.gentoro.capindex.relationship;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Why an edge exists. The {@code source} attribute tells the variants apart; documents written by
 * a newer engine may carry a source this build does not know, and those decode to {@link
 * OpaqueEvidence} with every attribute preserved.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "source",
    visible = true,
    defaultImpl = OpaqueEvidence.class)
@JsonSubTypes({
  @JsonSubTypes.Type(value = PatternEvidence.class, name = PatternEvidence.SOURCE),
  @JsonSubTypes.Type(value = TriggerEvidence.class, name = TriggerEvidence.SOURCE),
  @JsonSubTypes.Type(value = ScoreEvidence.class, name = ScoreEvidence.SOURCE)
})
public interface Evidence {

  String source();
}

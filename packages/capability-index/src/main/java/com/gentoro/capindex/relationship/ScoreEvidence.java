package com.gentoro.capindex.relationship;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.capindex.scoring.PairScore;

/** Score breakdown of a similarity edge. */
@JsonIgnoreProperties(value = "source", allowGetters = true)
public record ScoreEvidence(
    double jaccard, double entropyMatch, double combinedScore, String interpretation)
    implements Evidence {
  public static final String SOURCE = "score";

  public static ScoreEvidence of(PairScore score) {
    return new ScoreEvidence(
        score.jaccard(),
        score.entropyMatch(),
        score.combinedScore(),
        score.interpretation().wireName());
  }

  @Override
  @JsonProperty("source")
  public String source() {
    return SOURCE;
  }
}

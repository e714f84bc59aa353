package com.gentoro.capindex.relationship;

import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.scoring.PairScore;
import java.util.List;
import java.util.Objects;

/**
 * Everything relationship discovery needs, computed by earlier phases of the same build. The
 * trigger map is complete before discovery starts and is never re-read from anywhere else.
 */
public record DiscoveryInput(
    List<ElementRecord> records, List<PairScore> scores, ActionTriggerMap triggerMap) {

  public DiscoveryInput {
    records = List.copyOf(records);
    scores = List.copyOf(scores);
    Objects.requireNonNull(triggerMap, "triggerMap");
  }
}

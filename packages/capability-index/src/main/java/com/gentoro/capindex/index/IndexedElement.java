package com.gentoro.capindex.index;

import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.profile.SemanticProfile;
import com.gentoro.capindex.relationship.RelationshipEdge;
import java.util.List;

/** One element as stored in the index: its record, its profile and its outbound edges. */
public record IndexedElement(
    ElementRecord record, SemanticProfile profile, List<RelationshipEdge> outboundEdges) {

  public IndexedElement {
    outboundEdges = outboundEdges == null ? List.of() : List.copyOf(outboundEdges);
  }
}

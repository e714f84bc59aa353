package com.gentoro.capindex.index;

import com.gentoro.capindex.exception.CapIndexException;
import com.gentoro.capindex.profile.SemanticProfile;
import com.gentoro.capindex.relationship.ElementPath;
import com.gentoro.capindex.relationship.RelationshipEdge;
import com.gentoro.capindex.relationship.RelationshipStats;
import com.gentoro.capindex.relationship.TraversalOptions;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Query surface over the most recent good index. A failed rebuild leaves the previous index in
 * place, both here and on disk.
 */
public class CapabilityIndexService {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(CapabilityIndexService.class);

  private final IndexBuilder builder;
  private final IndexCodec codec;
  private final Path indexPath;
  private final AtomicReference<CapabilityIndex> current = new AtomicReference<>();

  public CapabilityIndexService(IndexBuilder builder, IndexCodec codec) {
    this.builder = builder;
    this.codec = codec;
    this.indexPath = builder.settings().indexPath();
  }

  /** Build a fresh index and make it current. On failure the previous index stays current. */
  public CapabilityIndex rebuild() {
    try {
      CapabilityIndex fresh = builder.build();
      current.set(fresh);
      return fresh;
    } catch (CapIndexException e) {
      log.warn(
          "Rebuild failed ({}); keeping {} index",
          e.getCode(),
          current.get() == null ? "no" : "the previous");
      throw e;
    }
  }

  /** Re-read the persisted index, replacing the in-memory one when the file exists. */
  public Optional<CapabilityIndex> reload() {
    Optional<CapabilityIndex> loaded = codec.readIfExists(indexPath);
    loaded.ifPresent(current::set);
    return loaded;
  }

  /** Current index, loading it from disk on first use. */
  public Optional<CapabilityIndex> current() {
    CapabilityIndex index = current.get();
    if (index != null) return Optional.of(index);
    return reload();
  }

  public List<RelationshipEdge> getRelationships(String elementId) {
    return current().map(i -> i.outboundEdges(elementId)).orElse(List.of());
  }

  public List<String> getByActionTrigger(String verb) {
    if (verb == null) return List.of();
    String v = verb.trim().toLowerCase(Locale.ROOT);
    return current().map(i -> i.actionTriggerMap().elementsFor(v)).orElse(List.of());
  }

  public Optional<SemanticProfile> getSemanticProfile(String elementId) {
    return current().flatMap(i -> i.element(elementId)).map(IndexedElement::profile);
  }

  public Optional<ElementPath> findPath(String from, String to, TraversalOptions options) {
    return current().flatMap(i -> i.relationshipGraph().findPath(from, to, options));
  }

  public Map<String, ElementPath> getConnectedElements(String elementId, TraversalOptions options) {
    return current()
        .map(i -> i.relationshipGraph().connectedElements(elementId, options))
        .orElse(Map.of());
  }

  public Optional<RelationshipStats> getRelationshipStats() {
    return current().map(i -> i.relationshipGraph().stats());
  }
}

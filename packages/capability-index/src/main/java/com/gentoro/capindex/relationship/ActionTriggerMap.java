package com.gentoro.capindex.relationship;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/** Immutable verb to element-id mapping. Verbs and ids are kept sorted. */
public final class ActionTriggerMap {
  private static final ActionTriggerMap EMPTY = new ActionTriggerMap(Map.of());

  private final SortedMap<String, List<String>> byVerb;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public ActionTriggerMap(Map<String, ? extends Collection<String>> byVerb) {
    SortedMap<String, List<String>> copy = new TreeMap<>();
    if (byVerb != null) {
      byVerb.forEach(
          (verb, ids) -> {
            if (ids != null && !ids.isEmpty()) {
              copy.put(verb, List.copyOf(new TreeSet<>(ids)));
            }
          });
    }
    this.byVerb = Collections.unmodifiableSortedMap(copy);
  }

  public static ActionTriggerMap empty() {
    return EMPTY;
  }

  @JsonValue
  public Map<String, List<String>> asMap() {
    return byVerb;
  }

  public List<String> elementsFor(String verb) {
    return byVerb.getOrDefault(verb, List.of());
  }

  public Set<String> verbs() {
    return byVerb.keySet();
  }

  /** Verbs under which {@code elementId} is listed, sorted. */
  public List<String> verbsFor(String elementId) {
    return byVerb.entrySet().stream()
        .filter(e -> e.getValue().contains(elementId))
        .map(Map.Entry::getKey)
        .toList();
  }

  public int size() {
    return byVerb.size();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ActionTriggerMap other && byVerb.equals(other.byVerb);
  }

  @Override
  public int hashCode() {
    return byVerb.hashCode();
  }

  @Override
  public String toString() {
    return "ActionTriggerMap" + byVerb;
  }
}

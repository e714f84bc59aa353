package com.gentoro.capindex.relationship;

import com.gentoro.capindex.element.ElementRecord;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolves a name mentioned in free text to an element id. Names and ids are compared lower-cased
 * with hyphens and underscores removed; an exact match wins over containment.
 */
public class NameResolver {
  static final int MIN_CONTAINMENT_LENGTH = 3;

  private final Map<String, String> idByName = new TreeMap<>();
  private final Set<String> ids = new HashSet<>();

  public NameResolver(List<ElementRecord> records) {
    for (ElementRecord r : records) {
      ids.add(r.id());
      idByName.putIfAbsent(normalize(r.id()), r.id());
      if (!r.name().isBlank()) {
        idByName.putIfAbsent(normalize(r.name()), r.id());
      }
    }
    idByName.remove("");
  }

  public boolean exists(String id) {
    return ids.contains(id);
  }

  public Optional<String> resolve(String mention) {
    if (mention == null) return Optional.empty();
    String n = normalize(mention);
    if (n.isEmpty()) return Optional.empty();
    String exact = idByName.get(n);
    if (exact != null) return Optional.of(exact);
    if (n.length() < MIN_CONTAINMENT_LENGTH) return Optional.empty();
    for (Map.Entry<String, String> e : idByName.entrySet()) {
      if (e.getKey().length() >= MIN_CONTAINMENT_LENGTH
          && (e.getKey().contains(n) || n.contains(e.getKey()))) {
        return Optional.of(e.getValue());
      }
    }
    return Optional.empty();
  }

  static String normalize(String s) {
    return s.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]", "");
  }
}

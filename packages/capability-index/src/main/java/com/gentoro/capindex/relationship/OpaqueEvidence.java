package com.gentoro.capindex.relationship;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Evidence whose {@code source} this build does not recognise. Attributes, including the original
 * {@code source}, are carried through decode and re-encode untouched but never interpreted.
 */
public final class OpaqueEvidence implements Evidence {
  public static final String SOURCE = "opaque";

  private final Map<String, Object> attributes = new LinkedHashMap<>();

  public OpaqueEvidence() {}

  public static OpaqueEvidence of(Map<String, ?> attributes) {
    OpaqueEvidence e = new OpaqueEvidence();
    attributes.forEach(e.attributes::put);
    return e;
  }

  @JsonAnySetter
  void set(String key, Object value) {
    attributes.put(key, value);
  }

  @JsonAnyGetter
  public Map<String, Object> attributes() {
    return Collections.unmodifiableMap(attributes);
  }

  @Override
  public String source() {
    Object s = attributes.get("source");
    return s == null ? SOURCE : s.toString();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof OpaqueEvidence other && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(attributes);
  }

  @Override
  public String toString() {
    return "OpaqueEvidence" + attributes;
  }
}

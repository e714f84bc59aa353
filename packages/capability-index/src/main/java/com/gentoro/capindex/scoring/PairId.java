package com.gentoro.capindex.scoring;

import java.util.Objects;

/**
 * Canonical, order-independent identity of an unordered element pair. {@code first} is always the
 * lexicographically smaller id; both ids are kept in full.
 */
public record PairId(String first, String second) {

  public PairId {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    if (first.compareTo(second) > 0) {
      throw new IllegalArgumentException("PairId ids must be in canonical order; use PairId.of");
    }
    if (first.equals(second)) {
      throw new IllegalArgumentException("PairId requires two distinct ids: " + first);
    }
  }

  public static PairId of(String a, String b) {
    return a.compareTo(b) <= 0 ? new PairId(a, b) : new PairId(b, a);
  }

  public boolean contains(String id) {
    return first.equals(id) || second.equals(id);
  }

  public String other(String id) {
    if (first.equals(id)) return second;
    if (second.equals(id)) return first;
    throw new IllegalArgumentException(id + " is not part of " + this);
  }

  /** Human readable key, {@code first|second}. */
  public String key() {
    return first + "|" + second;
  }

  @Override
  public String toString() {
    return key();
  }
}

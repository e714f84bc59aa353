package com.gentoro.capindex.profile;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Lexical fingerprint of one element: Shannon entropy of its term distribution and the set of
 * distinct tokens. Token sets are kept sorted so encoded indexes are stable across builds.
 */
public record SemanticProfile(
    String elementId,
    double entropy,
    Set<String> tokenSet,
    int uniqueTermCount,
    int totalTermCount,
    List<String> keyTerms) {

  public SemanticProfile {
    if (entropy < 0 || Double.isNaN(entropy)) {
      throw new IllegalArgumentException("entropy must be >= 0, got " + entropy);
    }
    tokenSet =
        tokenSet == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(tokenSet));
    keyTerms = keyTerms == null ? List.of() : List.copyOf(keyTerms);
  }

  public static SemanticProfile empty(String elementId) {
    return new SemanticProfile(elementId, 0.0, Set.of(), 0, 0, List.of());
  }
}

package com.gentoro.capindex.profile;

import com.gentoro.capindex.element.ElementRecord;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns element text into a {@link SemanticProfile}. Pure and deterministic: the same text always
 * yields the same entropy and token set, whatever thread calls it.
 *
 * <p>Tokenization lower-cases the NFKC normalized text, replaces everything but letters, digits,
 * underscores and hyphens with spaces, splits on whitespace and drops tokens shorter than {@code
 * minTokenLength}.
 */
public class LexicalProfiler {
  public static final int DEFAULT_MIN_TOKEN_LENGTH = 2;
  public static final int DEFAULT_KEY_TERMS = 10;

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s_-]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final double LN2 = Math.log(2);

  private final int minTokenLength;

  public LexicalProfiler() {
    this(DEFAULT_MIN_TOKEN_LENGTH);
  }

  public LexicalProfiler(int minTokenLength) {
    if (minTokenLength < 1) {
      throw new IllegalArgumentException("minTokenLength must be at least 1");
    }
    this.minTokenLength = minTokenLength;
  }

  public SemanticProfile profile(ElementRecord record) {
    return profile(record.id(), record.rawText());
  }

  public SemanticProfile profile(String elementId, String text) {
    List<String> tokens = tokenize(text);
    if (tokens.isEmpty()) {
      return SemanticProfile.empty(elementId);
    }
    Map<String, Integer> frequencies = frequencies(tokens);
    return new SemanticProfile(
        elementId,
        entropy(frequencies, tokens.size()),
        frequencies.keySet(),
        frequencies.size(),
        tokens.size(),
        keyTerms(frequencies, tokens.size(), DEFAULT_KEY_TERMS));
  }

  /** Shannon entropy in bits of the term frequency distribution of {@code text}. */
  public double entropy(String text) {
    List<String> tokens = tokenize(text);
    if (tokens.isEmpty()) return 0.0;
    return entropy(frequencies(tokens), tokens.size());
  }

  /** Tokens in document order, duplicates retained. */
  public List<String> tokenize(String text) {
    if (text == null || text.isBlank()) return List.of();
    String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
    String cleaned = NON_WORD.matcher(normalized).replaceAll(" ");
    List<String> out = new ArrayList<>();
    for (String token : WHITESPACE.split(cleaned.trim())) {
      if (token.length() >= minTokenLength) {
        out.add(token);
      }
    }
    return out;
  }

  /**
   * The {@code topK} terms contributing most to the entropy of {@code text}, ties broken
   * alphabetically.
   */
  public List<String> extractKeyTerms(String text, int topK) {
    List<String> tokens = tokenize(text);
    if (tokens.isEmpty() || topK <= 0) return List.of();
    return keyTerms(frequencies(tokens), tokens.size(), topK);
  }

  private static Map<String, Integer> frequencies(List<String> tokens) {
    Map<String, Integer> freq = new LinkedHashMap<>();
    for (String t : tokens) {
      freq.merge(t, 1, Integer::sum);
    }
    return freq;
  }

  private static double entropy(Map<String, Integer> frequencies, int total) {
    double h = 0.0;
    for (int count : frequencies.values()) {
      h += contribution(count, total);
    }
    // A single repeated term computes to -0.0.
    return Math.max(0.0, h);
  }

  private static double contribution(int count, int total) {
    double p = (double) count / total;
    return -p * (Math.log(p) / LN2);
  }

  private static List<String> keyTerms(Map<String, Integer> frequencies, int total, int topK) {
    Comparator<Map.Entry<String, Integer>> byContribution =
        Comparator.comparingDouble(
            (Map.Entry<String, Integer> e) -> contribution(e.getValue(), total));
    return frequencies.entrySet().stream()
        .sorted(byContribution.reversed().thenComparing(Map.Entry::getKey))
        .limit(topK)
        .map(Map.Entry::getKey)
        .toList();
  }
}

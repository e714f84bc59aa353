package com.gentoro.capindex.relationship;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Known action verbs grouped by intent, plus the heuristic that decides whether an arbitrary
 * keyword reads like a verb.
 */
public class VerbTaxonomy {
  public static final String CREATION = "creation";
  public static final String ANALYSIS = "analysis";

  private static final Map<String, List<String>> DEFAULT_CATEGORIES = new LinkedHashMap<>();

  static {
    DEFAULT_CATEGORIES.put(
        "debugging", List.of("debug", "fix", "troubleshoot", "diagnose", "solve", "resolve", "repair"));
    DEFAULT_CATEGORIES.put(
        CREATION, List.of("create", "write", "generate", "make", "build", "construct", "compose"));
    DEFAULT_CATEGORIES.put(
        "explanation",
        List.of("explain", "teach", "clarify", "describe", "simplify", "elaborate", "define"));
    DEFAULT_CATEGORIES.put(
        ANALYSIS,
        List.of("analyze", "investigate", "examine", "inspect", "review", "assess", "evaluate"));
    DEFAULT_CATEGORIES.put(
        "recall", List.of("remember", "recall", "retrieve", "find", "locate", "search", "lookup"));
    DEFAULT_CATEGORIES.put(
        "execution",
        List.of("run", "execute", "start", "launch", "activate", "trigger", "invoke"));
    DEFAULT_CATEGORIES.put(
        "testing", List.of("test", "verify", "validate", "check", "confirm", "ensure", "prove"));
    DEFAULT_CATEGORIES.put(
        "configuration",
        List.of("configure", "setup", "install", "initialize", "prepare", "arrange"));
    DEFAULT_CATEGORIES.put(
        "security",
        List.of("secure", "protect", "audit", "scan", "encrypt", "authenticate", "authorize"));
    DEFAULT_CATEGORIES.put(
        "optimization",
        List.of("optimize", "improve", "enhance", "refactor", "streamline", "accelerate"));
    DEFAULT_CATEGORIES.put(
        "documentation", List.of("document", "annotate", "comment", "record", "note", "log"));
    DEFAULT_CATEGORIES.put(
        "collaboration", List.of("share", "collaborate", "sync", "merge", "integrate", "combine"));
  }

  private static final List<String> VERB_PREFIXES =
      List.of(
          "create", "build", "make", "generate", "produce", "write", "compose",
          "analyze", "review", "examine", "investigate", "inspect", "evaluate", "assess",
          "debug", "fix", "troubleshoot", "solve", "resolve", "repair", "patch",
          "run", "execute", "start", "stop", "deploy", "configure", "install",
          "update", "modify", "change", "edit", "alter", "transform", "refactor",
          "delete", "remove", "clear", "clean", "purge", "destroy", "eliminate",
          "explain", "describe", "document", "search", "find", "check", "validate",
          "optimize", "improve", "enhance", "streamline", "accelerate",
          "test", "verify", "confirm", "assert", "ensure");

  private static final Pattern VERB_PREFIX =
      Pattern.compile("^(" + String.join("|", VERB_PREFIXES) + ")");
  private static final Pattern VERB_SUFFIX = Pattern.compile("(ify|ize|ate|en|fy)$");
  private static final Pattern NOUN_SUFFIX =
      Pattern.compile("(tion|sion|ment|ness|ance|ence|ity|ism|ship|hood|dom|ery|ing)$");

  // Inflected form to base form, tried in order.
  private static final String[][] INFLECTIONS = {
    {"ying", "y"}, {"ing", ""}, {"ing", "e"}, {"ied", "y"}, {"ies", "y"},
    {"ed", ""}, {"ed", "e"}, {"es", ""}, {"s", ""}
  };

  private final Map<String, String> categoryByVerb = new LinkedHashMap<>();

  public VerbTaxonomy() {
    this(Map.of());
  }

  /** Default taxonomy extended with {@code customVerbs} (category to verbs). */
  public VerbTaxonomy(Map<String, List<String>> customVerbs) {
    DEFAULT_CATEGORIES.forEach((cat, verbs) -> verbs.forEach(v -> categoryByVerb.put(v, cat)));
    customVerbs.forEach((cat, verbs) -> verbs.forEach(v -> categoryByVerb.putIfAbsent(v, cat)));
  }

  /** Category of {@code verb} or of its base form ("debugging" resolves like "debug"). */
  public Optional<String> categoryOf(String verb) {
    if (verb == null) return Optional.empty();
    String direct = categoryByVerb.get(verb);
    if (direct != null) return Optional.of(direct);
    for (String[] rule : INFLECTIONS) {
      if (verb.endsWith(rule[0]) && verb.length() > rule[0].length() + 1) {
        String base = verb.substring(0, verb.length() - rule[0].length()) + rule[1];
        String cat = categoryByVerb.get(base);
        if (cat == null && rule[1].isEmpty() && doubledEnding(base)) {
          // debugging -> debugg -> debug
          cat = categoryByVerb.get(base.substring(0, base.length() - 1));
        }
        if (cat != null) return Optional.of(cat);
      }
    }
    return Optional.empty();
  }

  private static boolean doubledEnding(String s) {
    int n = s.length();
    return n >= 3 && s.charAt(n - 1) == s.charAt(n - 2);
  }

  public boolean isKnownVerb(String word) {
    return categoryByVerb.containsKey(word);
  }

  /**
   * Whether a keyword should be treated as an action trigger: known verbs always are; otherwise a
   * noun suffix rules it out and a verb prefix or suffix rules it in.
   */
  public boolean looksLikeVerb(String word) {
    if (word == null || word.isEmpty()) return false;
    if (isKnownVerb(word)) return true;
    if (NOUN_SUFFIX.matcher(word).find()) return false;
    return VERB_PREFIX.matcher(word).find() || VERB_SUFFIX.matcher(word).find();
  }
}

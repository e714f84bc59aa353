package com.gentoro.capindex.relationship;

import com.gentoro.capindex.element.ElementRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual rule producing edges from one element's text. Without a fixed target, group 1 of the
 * pattern names the target element and is resolved through a {@link NameResolver}; with a fixed
 * target every match links to that element id.
 */
public record RelationshipRule(
    String name, RelationshipKind kind, Pattern pattern, double confidence, String fixedTargetId) {

  public RelationshipRule {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(pattern, "pattern");
    if (!(confidence >= 0.0 && confidence <= 1.0)) {
      throw new IllegalArgumentException("rule confidence must be within [0,1]: " + name);
    }
    if (fixedTargetId == null && pattern.matcher("").groupCount() < 1) {
      throw new IllegalArgumentException(
          "rule " + name + " needs a capture group or a fixed target");
    }
  }

  public static RelationshipRule of(
      String name, RelationshipKind kind, String regex, double confidence) {
    return new RelationshipRule(
        name, kind, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), confidence, null);
  }

  public static RelationshipRule compile(RelationshipSettings.RuleDefinition def) {
    String target = def.target() == null || def.target().isBlank() ? null : def.target().trim();
    return new RelationshipRule(
        def.name(),
        def.kind(),
        Pattern.compile(def.pattern(), Pattern.CASE_INSENSITIVE),
        def.confidence(),
        target);
  }

  /** Edges this rule finds in {@code record}'s text; self-links and unresolved names are dropped. */
  public List<RelationshipEdge> apply(ElementRecord record, NameResolver resolver) {
    List<RelationshipEdge> out = new ArrayList<>();
    Matcher m = pattern.matcher(record.rawText());
    while (m.find()) {
      Optional<String> target =
          fixedTargetId != null
              ? resolver.exists(fixedTargetId) ? Optional.of(fixedTargetId) : Optional.empty()
              : resolver.resolve(m.group(1));
      if (target.isEmpty() || target.get().equals(record.id())) continue;
      out.add(
          RelationshipEdge.of(
              record.id(), target.get(), kind, confidence, new PatternEvidence(name, m.group())));
    }
    return out;
  }
}

package com.gentoro.capindex.relationship;

import com.gentoro.capindex.diagnostics.WarningCode;
import com.gentoro.capindex.diagnostics.WarningCollector;
import com.gentoro.capindex.element.ElementRecord;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * First phase of relationship discovery: collects the action triggers of every element into an
 * {@link ActionTriggerMap}. Explicit triggers come first, then keywords that read like verbs.
 *
 * <p>A trigger is lower-cased and kept only when it matches {@code [a-z][a-z-]*} and fits {@code
 * maxLength}. An element contributes at most {@code maxPerElement} triggers.
 */
public class ActionTriggerExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(ActionTriggerExtractor.class);

  private static final Pattern VALID_TRIGGER = Pattern.compile("^[a-z][a-z-]*$");

  private final TriggerSettings settings;
  private final VerbTaxonomy taxonomy;

  public ActionTriggerExtractor(TriggerSettings settings, VerbTaxonomy taxonomy) {
    this.settings = settings;
    this.taxonomy = taxonomy;
  }

  public ActionTriggerMap extract(List<ElementRecord> records, WarningCollector warnings) {
    Map<String, Set<String>> byVerb = new TreeMap<>();
    for (ElementRecord record : records) {
      Set<String> triggers = triggersOf(record, warnings);
      if (triggers.isEmpty()) {
        warnings.add(
            WarningCode.INVALID_ELEMENT_RECORD,
            record.id(),
            "no usable action triggers; skipped by verb-trigger discovery");
        continue;
      }
      for (String t : triggers) {
        byVerb.computeIfAbsent(t, k -> new TreeSet<>()).add(record.id());
      }
    }
    log.debug("Extracted {} trigger verbs from {} elements", byVerb.size(), records.size());
    return new ActionTriggerMap(byVerb);
  }

  Set<String> triggersOf(ElementRecord record, WarningCollector warnings) {
    Set<String> out = new LinkedHashSet<>();
    boolean truncated = false;
    for (String raw : record.actionTriggers()) {
      String t = normalize(raw);
      if (t == null) continue;
      if (out.size() >= settings.maxPerElement()) {
        truncated = true;
        break;
      }
      out.add(t);
    }
    for (String raw : record.keywords()) {
      String t = normalize(raw);
      if (t == null || !taxonomy.looksLikeVerb(t) || out.contains(t)) continue;
      if (out.size() >= settings.maxPerElement()) {
        truncated = true;
        break;
      }
      out.add(t);
    }
    if (truncated) {
      warnings.add(
          WarningCode.TRIGGER_LIMIT,
          record.id(),
          "more than " + settings.maxPerElement() + " action triggers; extra triggers ignored");
    }
    return out;
  }

  String normalize(String trigger) {
    if (trigger == null) return null;
    String t = trigger.trim().toLowerCase(Locale.ROOT);
    if (t.isEmpty() || t.length() > settings.maxLength() || !VALID_TRIGGER.matcher(t).matches()) {
      return null;
    }
    return t;
  }
}

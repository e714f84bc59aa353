package com.gentoro.capindex.relationship;

import com.gentoro.capindex.diagnostics.WarningCode;
import com.gentoro.capindex.diagnostics.WarningCollector;
import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.scoring.PairScore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Second phase of relationship discovery. Candidate edges come from three feeds:
 *
 * <ul>
 *   <li>similarity: scored pairs at or above the similarity threshold
 *   <li>pattern: {@link RelationshipRule}s run over each element's text
 *   <li>verb trigger: elements listed under the same verb of the supplied {@link ActionTriggerMap}
 * </ul>
 *
 * Candidates below {@code minConfidence} are dropped; the rest are added strongest first to an
 * {@link EdgeSet}, which creates every inverse, until a source holds {@code maxPerElement}
 * discovered edges.
 *
 * <p>The discoverer only sees what it is handed in {@link DiscoveryInput}.
 */
public class RelationshipDiscoverer {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(RelationshipDiscoverer.class);

  private static final Comparator<RelationshipEdge> CANDIDATE_ORDER =
      Comparator.comparingDouble(RelationshipEdge::weight)
          .reversed()
          .thenComparing(RelationshipEdge::sourceId)
          .thenComparing(RelationshipEdge::targetId)
          .thenComparing(e -> e.kind().wireName());

  private final RelationshipSettings settings;
  private final List<RelationshipRule> rules;
  private final VerbTaxonomy taxonomy;

  public RelationshipDiscoverer(
      RelationshipSettings settings, List<RelationshipRule> rules, VerbTaxonomy taxonomy) {
    this.settings = settings;
    this.rules = List.copyOf(rules);
    this.taxonomy = taxonomy;
  }

  public DiscoveryResult discover(DiscoveryInput input, WarningCollector warnings) {
    List<RelationshipEdge> similarity = similarityCandidates(input.scores());
    List<RelationshipEdge> pattern = patternCandidates(input.records(), warnings);
    List<RelationshipEdge> trigger = triggerCandidates(input.triggerMap());

    List<RelationshipEdge> candidates = new ArrayList<>();
    candidates.addAll(similarity);
    candidates.addAll(pattern);
    candidates.addAll(trigger);
    candidates.removeIf(e -> e.weight() < settings.minConfidence());
    candidates.sort(CANDIDATE_ORDER);

    EdgeSet edges = new EdgeSet();
    int dropped = 0;
    for (RelationshipEdge candidate : candidates) {
      boolean known =
          edges.contains(candidate.sourceId(), candidate.targetId(), candidate.kind());
      if (!known && edges.discoveredCount(candidate.sourceId()) >= settings.maxPerElement()) {
        dropped++;
        continue;
      }
      edges.add(candidate);
    }
    log.debug(
        "Discovered {} edges ({} similarity, {} pattern, {} trigger candidates; {} over the"
            + " per-element limit)",
        edges.size(),
        similarity.size(),
        pattern.size(),
        trigger.size(),
        dropped);
    return new DiscoveryResult(
        edges.bySource(), similarity.size(), pattern.size(), trigger.size(), edges.size());
  }

  List<RelationshipEdge> similarityCandidates(List<PairScore> scores) {
    List<RelationshipEdge> out = new ArrayList<>();
    for (PairScore s : scores) {
      if (s.combinedScore() >= settings.similarityThreshold()) {
        out.add(
            RelationshipEdge.of(
                s.pairId().first(),
                s.pairId().second(),
                RelationshipKind.SIMILAR_TO,
                s.combinedScore(),
                ScoreEvidence.of(s)));
      }
    }
    return out;
  }

  List<RelationshipEdge> patternCandidates(List<ElementRecord> records, WarningCollector warnings) {
    NameResolver resolver = new NameResolver(records);
    List<RelationshipEdge> out = new ArrayList<>();
    for (ElementRecord record : records) {
      for (RelationshipRule rule : rules) {
        try {
          out.addAll(rule.apply(record, resolver));
        } catch (RuntimeException e) {
          warnings.add(
              WarningCode.RULE_FAILURE,
              record.id(),
              "rule '" + rule.name() + "' failed: " + e.getMessage());
        }
      }
    }
    return out;
  }

  List<RelationshipEdge> triggerCandidates(ActionTriggerMap triggerMap) {
    List<RelationshipEdge> out = new ArrayList<>();
    for (String verb : triggerMap.verbs()) {
      List<String> ids = triggerMap.elementsFor(verb);
      if (ids.size() < 2) continue;
      if (ids.size() > settings.maxElementsPerVerb()) {
        log.debug("Verb '{}' shared by {} elements; too generic to link", verb, ids.size());
        continue;
      }
      String category = taxonomy.categoryOf(verb).orElse(null);
      RelationshipKind kind =
          VerbTaxonomy.CREATION.equals(category) || VerbTaxonomy.ANALYSIS.equals(category)
              ? RelationshipKind.COMPLEMENTS
              : RelationshipKind.COMMONLY_USED_WITH;
      for (int i = 0; i < ids.size(); i++) {
        for (int j = i + 1; j < ids.size(); j++) {
          out.add(
              RelationshipEdge.of(
                  ids.get(i),
                  ids.get(j),
                  kind,
                  settings.verbConfidence(),
                  new TriggerEvidence(verb, category)));
        }
      }
    }
    return out;
  }
}

package com.gentoro.capindex.budget;

import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.scoring.PairId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups elements into buckets by shared keyword or tag and draws pairs from inside buckets.
 *
 * <p>A bucket is used when it has at least two members and no more than half of all elements
 * (larger buckets carry no signal). Buckets are visited round-robin, smallest first, each
 * contributing one not-yet-taken pair per round from a shuffled list of its member pairs. Buckets
 * larger than {@code clusterSampleLimit} are first reduced to a random subset of that size.
 */
public class KeywordBucketSampler implements ClusterPairSampler {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(KeywordBucketSampler.class);

  private final int clusterSampleLimit;

  public KeywordBucketSampler(int clusterSampleLimit) {
    this.clusterSampleLimit = clusterSampleLimit;
  }

  @Override
  public List<PairId> sample(
      List<ElementRecord> records, int budget, Set<PairId> taken, Random random) {
    List<PairId> out = new ArrayList<>();
    if (budget <= 0) return out;

    Map<String, List<String>> buckets = buckets(records);
    List<Deque<PairId>> queues = new ArrayList<>();
    buckets.entrySet().stream()
        .sorted(
            Comparator.comparingInt((Map.Entry<String, List<String>> e) -> e.getValue().size())
                .thenComparing(Map.Entry::getKey))
        .forEach(e -> queues.add(pairQueue(e.getValue(), random)));
    log.debug("{} usable keyword buckets for {} elements", queues.size(), records.size());

    while (out.size() < budget && !queues.isEmpty()) {
      for (int i = 0; i < queues.size() && out.size() < budget; ) {
        Deque<PairId> q = queues.get(i);
        PairId next = null;
        while (!q.isEmpty()) {
          PairId candidate = q.poll();
          if (taken.add(candidate)) {
            next = candidate;
            break;
          }
        }
        if (next != null) {
          out.add(next);
        }
        if (q.isEmpty()) {
          queues.remove(i);
        } else {
          i++;
        }
      }
    }
    return out;
  }

  /** Keyword or tag (lower-cased) to the sorted ids of the elements that carry it. */
  Map<String, List<String>> buckets(List<ElementRecord> records) {
    Map<String, Set<String>> raw = new TreeMap<>();
    for (ElementRecord r : records) {
      for (List<String> terms : List.of(r.keywords(), r.tags())) {
        for (String term : terms) {
          String key = term.toLowerCase(Locale.ROOT).trim();
          if (key.isEmpty()) continue;
          raw.computeIfAbsent(key, k -> new TreeSet<>()).add(r.id());
        }
      }
    }
    int maxSize = records.size() / 2;
    Map<String, List<String>> usable = new TreeMap<>();
    raw.forEach(
        (k, ids) -> {
          if (ids.size() >= 2 && ids.size() <= maxSize) {
            usable.put(k, new ArrayList<>(ids));
          }
        });
    return usable;
  }

  private Deque<PairId> pairQueue(List<String> members, Random random) {
    List<String> chosen = members;
    if (members.size() > clusterSampleLimit) {
      chosen = new ArrayList<>(members);
      Collections.shuffle(chosen, random);
      chosen = chosen.subList(0, clusterSampleLimit);
    }
    List<PairId> pairs = new ArrayList<>();
    for (int i = 0; i < chosen.size(); i++) {
      for (int j = i + 1; j < chosen.size(); j++) {
        pairs.add(PairId.of(chosen.get(i), chosen.get(j)));
      }
    }
    Collections.shuffle(pairs, random);
    return new ArrayDeque<>(pairs);
  }
}

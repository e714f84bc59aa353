package com.gentoro.capindex.budget;

import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.element.ElementType;
import com.gentoro.capindex.scoring.PairId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Draws pairs whose two elements have different types, choosing each type with probability
 * proportional to its share of the elements. Gives up after {@code budget * 20} draws so a nearly
 * exhausted pair space cannot spin.
 */
public class CrossTypePairSampler {
  static final int ATTEMPTS_PER_PAIR = 20;

  public List<PairId> sample(
      List<ElementRecord> records, int budget, Set<PairId> taken, Random random) {
    List<PairId> out = new ArrayList<>();
    if (budget <= 0) return out;

    Map<ElementType, List<String>> byType = new EnumMap<>(ElementType.class);
    for (ElementRecord r : records) {
      byType.computeIfAbsent(r.elementType(), t -> new ArrayList<>()).add(r.id());
    }
    if (byType.size() < 2) return out;

    List<List<String>> groups = new ArrayList<>(byType.values());
    int total = records.size();
    long attempts = (long) budget * ATTEMPTS_PER_PAIR;
    while (out.size() < budget && attempts-- > 0) {
      int a = pickGroup(groups, total, random);
      int b = pickGroup(groups, total, random);
      if (a == b) continue;
      List<String> ga = groups.get(a);
      List<String> gb = groups.get(b);
      PairId pair = PairId.of(ga.get(random.nextInt(ga.size())), gb.get(random.nextInt(gb.size())));
      if (taken.add(pair)) {
        out.add(pair);
      }
    }
    return out;
  }

  private static int pickGroup(List<List<String>> groups, int total, Random random) {
    int r = random.nextInt(total);
    for (int i = 0; i < groups.size(); i++) {
      r -= groups.get(i).size();
      if (r < 0) return i;
    }
    return groups.size() - 1;
  }
}

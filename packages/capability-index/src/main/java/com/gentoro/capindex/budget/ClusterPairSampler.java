package com.gentoro.capindex.budget;

import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.scoring.PairId;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Picks pairs of elements likely to be related. Implementations must add every returned pair to
 * {@code taken}, never return a pair already in it, and return at most {@code budget} pairs.
 */
public interface ClusterPairSampler {

  List<PairId> sample(List<ElementRecord> records, int budget, Set<PairId> taken, Random random);
}

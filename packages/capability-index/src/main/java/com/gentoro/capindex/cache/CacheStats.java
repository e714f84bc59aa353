package com.gentoro.capindex.cache;

/** Point-in-time counters of a {@link ScoreCache}. */
public record CacheStats(
    long hits, long misses, long evictions, long invalidations, int size, int capacity) {

  /** Counters accumulated since {@code earlier} was taken. */
  public CacheStats since(CacheStats earlier) {
    return new CacheStats(
        hits - earlier.hits,
        misses - earlier.misses,
        evictions - earlier.evictions,
        invalidations - earlier.invalidations,
        size,
        capacity);
  }
}

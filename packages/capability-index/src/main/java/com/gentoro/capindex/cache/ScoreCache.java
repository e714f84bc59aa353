package com.gentoro.capindex.cache;

import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.scoring.PairId;
import com.gentoro.capindex.scoring.PairScore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, strictly least-recently-used memo of pair scores. Owned by whoever builds it and passed
 * explicitly to the scorer; there is no shared instance.
 *
 * <p>Entries are keyed by the full {@link PairId}. The whole cache is dropped when {@link
 * #beginBuild(String)} sees a content fingerprint that differs from the previous build, so a stale
 * score can never survive an element edit.
 */
public class ScoreCache {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(ScoreCache.class);

  public static final int DEFAULT_CAPACITY = 1000;

  private final int capacity;
  private final LinkedHashMap<PairId, PairScore> entries;
  private String fingerprint;
  private long hits;
  private long misses;
  private long evictions;
  private long invalidations;

  public ScoreCache() {
    this(DEFAULT_CAPACITY);
  }

  public ScoreCache(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, got " + capacity);
    }
    this.capacity = capacity;
    this.entries =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<PairId, PairScore> eldest) {
            if (size() > ScoreCache.this.capacity) {
              evictions++;
              return true;
            }
            return false;
          }
        };
  }

  public synchronized Optional<PairScore> get(PairId id) {
    PairScore score = entries.get(id);
    if (score == null) {
      misses++;
      return Optional.empty();
    }
    hits++;
    return Optional.of(score);
  }

  public synchronized void put(PairScore score) {
    entries.put(Objects.requireNonNull(score.pairId(), "pairId"), score);
  }

  /**
   * Mark the start of a build over elements with the given content fingerprint.
   *
   * @return true when the cache was cleared because content changed
   */
  public synchronized boolean beginBuild(String contentFingerprint) {
    if (Objects.equals(fingerprint, contentFingerprint)) {
      return false;
    }
    boolean hadEntries = !entries.isEmpty();
    entries.clear();
    fingerprint = contentFingerprint;
    if (hadEntries) {
      invalidations++;
      log.debug("Element content changed; score cache cleared");
    }
    return hadEntries;
  }

  public synchronized void clear() {
    entries.clear();
    fingerprint = null;
  }

  public synchronized int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }

  public synchronized CacheStats stats() {
    return new CacheStats(hits, misses, evictions, invalidations, entries.size(), capacity);
  }

  /** Order independent SHA-256 over the content hashes of {@code records}. */
  public static String contentFingerprint(Collection<ElementRecord> records) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      records.stream()
          .map(ElementRecord::contentHash)
          .sorted()
          .forEach(h -> md.update(h.getBytes(StandardCharsets.US_ASCII)));
      return HexFormat.of().formatHex(md.digest());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}

package com.gentoro.capindex.index;

import com.gentoro.capindex.budget.BuildBudget;
import com.gentoro.capindex.budget.ComparisonPlan;
import com.gentoro.capindex.cache.CacheStats;
import com.gentoro.capindex.cache.ScoreCache;
import com.gentoro.capindex.diagnostics.WarningCode;
import com.gentoro.capindex.diagnostics.WarningCollector;
import com.gentoro.capindex.element.ElementRecord;
import com.gentoro.capindex.element.ElementSource;
import com.gentoro.capindex.exception.CapIndexException;
import com.gentoro.capindex.exception.ExceptionUtil;
import com.gentoro.capindex.exception.IndexBuildException;
import com.gentoro.capindex.exception.StateException;
import com.gentoro.capindex.lease.IndexLeaseManager;
import com.gentoro.capindex.lease.Lease;
import com.gentoro.capindex.profile.SemanticProfile;
import com.gentoro.capindex.relationship.ActionTriggerMap;
import com.gentoro.capindex.relationship.DiscoveryInput;
import com.gentoro.capindex.relationship.DiscoveryResult;
import com.gentoro.capindex.scoring.PairId;
import com.gentoro.capindex.scoring.PairScore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one build at a time: lease, profile, plan, score, discover, persist.
 *
 * <p>State moves {@code IDLE -> ACQUIRING_LEASE -> PROFILING -> PLANNING -> SCORING ->
 * DISCOVERING_RELATIONSHIPS -> PERSISTING -> IDLE}. Any failure, a JVM error included, moves to
 * {@code FAILED} and then back to {@code IDLE}; the lease is always released before the failure
 * reaches the caller. Errors propagate unwrapped. A lease timeout is reported to the caller as is,
 * never retried here.
 *
 * <p>Each stage receives the previous stage's output as an argument. The action trigger map in
 * particular is complete before relationship discovery starts.
 */
public class IndexBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(IndexBuilder.class);

  private final ElementSource source;
  private final BuildPipeline pipeline;
  private final IndexLeaseManager leases;
  private final IndexCodec codec;
  private final BuildSettings settings;
  private final Clock clock;
  private final AtomicReference<BuildState> state = new AtomicReference<>(BuildState.IDLE);
  private final AtomicLong tick = new AtomicLong();
  private final List<BuildStateListener> listeners = new CopyOnWriteArrayList<>();

  public IndexBuilder(
      ElementSource source,
      BuildPipeline pipeline,
      IndexLeaseManager leases,
      IndexCodec codec,
      BuildSettings settings,
      Clock clock) {
    this.source = source;
    this.pipeline = pipeline;
    this.leases = leases;
    this.codec = codec;
    this.settings = settings;
    this.clock = clock;
  }

  public BuildState state() {
    return state.get();
  }

  public BuildSettings settings() {
    return settings;
  }

  public void addListener(BuildStateListener listener) {
    listeners.add(listener);
  }

  /** Build with the configured deadline. */
  public CapabilityIndex build() {
    return build(settings.deadline());
  }

  /**
   * Build, persist and return a fresh index.
   *
   * @param deadline time allowed for scoring; zero or negative means unlimited
   */
  public CapabilityIndex build(Duration deadline) {
    if (!state.compareAndSet(BuildState.IDLE, BuildState.ACQUIRING_LEASE)) {
      throw new StateException("A build is already running (state " + state.get() + ")");
    }
    notifyListeners(BuildState.IDLE, BuildState.ACQUIRING_LEASE);
    long buildTick = tick.incrementAndGet();
    long started = System.nanoTime();
    log.info("Index build #{} starting for {}", buildTick, settings.indexPath());

    try (Lease lease =
        leases.acquire(settings.indexPath(), settings.leaseWait(), settings.acquireMode())) {
      CapabilityIndex index = runPipeline(lease, buildTick, started, deadline);
      transition(BuildState.PERSISTING);
      codec.write(index, settings.indexPath());
      transition(BuildState.IDLE);
      log.info(
          "Index build #{} finished: {} elements, {} edges, {} comparisons ({}) in {} ms",
          buildTick,
          index.buildStats().elementCount(),
          index.buildStats().edgeCount(),
          index.buildStats().comparisonsMade(),
          index.buildStats().completeness().wireName(),
          index.buildStats().durationMs());
      return index;
    } catch (RuntimeException | Error e) {
      transition(BuildState.FAILED);
      log.error(
          "Index build #{} failed: {} at {}",
          buildTick,
          e.getMessage(),
          ExceptionUtil.formatCompactStackTrace(e, 5));
      transition(BuildState.IDLE);
      if (e instanceof Error error) {
        throw error;
      }
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          t ->
              new IndexBuildException(
                  "Index build failed: " + t.getMessage(),
                  Map.of("indexPath", String.valueOf(settings.indexPath())),
                  t));
    }
  }

  private CapabilityIndex runPipeline(
      Lease lease, long buildTick, long started, Duration deadline) {
    WarningCollector warnings = new WarningCollector();

    transition(BuildState.PROFILING);
    List<ElementRecord> records = acceptedRecords(source.listElements(), warnings);
    ScoreCache cache = pipeline.cache();
    cache.beginBuild(ScoreCache.contentFingerprint(records));
    CacheStats cacheBefore = cache.stats();
    Map<String, SemanticProfile> profiles = new LinkedHashMap<>();
    for (ElementRecord r : records) {
      profiles.put(r.id(), pipeline.profiler().profile(r));
    }
    log.debug("Profiled {} elements", profiles.size());

    transition(BuildState.PLANNING);
    BuildBudget budget = pipeline.budgetPlanner().plan(records.size());
    ComparisonPlan plan = pipeline.comparisonPlanner().plan(records, budget);

    transition(BuildState.SCORING);
    long deadlineNanos =
        deadline == null || deadline.isZero() || deadline.isNegative()
            ? Long.MAX_VALUE
            : started + deadline.toNanos();
    ScoringOutcome scoring = score(plan, profiles, buildTick, deadlineNanos, lease, warnings);
    CacheStats cacheDelta = cache.stats().since(cacheBefore);

    transition(BuildState.DISCOVERING_RELATIONSHIPS);
    ActionTriggerMap triggerMap = pipeline.triggerExtractor().extract(records, warnings);
    DiscoveryResult discovery =
        pipeline
            .discoverer()
            .discover(new DiscoveryInput(records, scoring.scores(), triggerMap), warnings);

    Map<String, IndexedElement> elements = new TreeMap<>();
    for (ElementRecord r : records) {
      elements.put(
          r.id(), new IndexedElement(r, profiles.get(r.id()), discovery.outbound(r.id())));
    }
    BuildStats stats =
        new BuildStats(
            budget.strategy(),
            records.size(),
            plan.size(),
            scoring.scores().size(),
            scoring.clusterScored(),
            scoring.crossTypeScored(),
            cacheDelta.hits(),
            cacheDelta.misses(),
            discovery.totalEdges(),
            Duration.ofNanos(System.nanoTime() - started).toMillis(),
            scoring.complete() ? Completeness.COMPLETE : Completeness.PARTIAL,
            budget.budgetLimited(),
            lease.reclaimedFromToken().isPresent(),
            warnings.snapshot());
    return new CapabilityIndex(
        IndexCodec.CURRENT_SCHEMA_VERSION,
        Instant.now(clock),
        new TreeMap<>(elements),
        triggerMap,
        stats);
  }

  /** Drop records without id or type and repeated ids, each with a warning. */
  List<ElementRecord> acceptedRecords(List<ElementRecord> input, WarningCollector warnings) {
    List<ElementRecord> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (ElementRecord r : input) {
      if (r == null) continue;
      if (r.id() == null || r.id().isBlank()) {
        warnings.add(WarningCode.INVALID_ELEMENT_RECORD, null, "element without id skipped");
      } else if (r.elementType() == null) {
        warnings.add(
            WarningCode.INVALID_ELEMENT_RECORD, r.id(), "missing or unknown element type");
      } else if (!seen.add(r.id())) {
        warnings.add(WarningCode.INVALID_ELEMENT_RECORD, r.id(), "duplicate element id");
      } else {
        out.add(r);
      }
    }
    return out;
  }

  private record ScoringOutcome(
      List<PairScore> scores, int clusterScored, int crossTypeScored, boolean complete) {}

  /**
   * Score the plan in fixed-size chunks on a worker pool. Every comparison checks the deadline
   * first; once it passes, remaining pairs are skipped and the outcome is incomplete.
   */
  private ScoringOutcome score(
      ComparisonPlan plan,
      Map<String, SemanticProfile> profiles,
      long buildTick,
      long deadlineNanos,
      Lease lease,
      WarningCollector warnings) {
    List<PairId> pairs = plan.pairs();
    if (pairs.isEmpty()) {
      return new ScoringOutcome(List.of(), 0, 0, true);
    }
    int chunkSize = settings.scoringChunkSize();
    AtomicInteger skipped = new AtomicInteger();
    ExecutorService executor =
        Executors.newFixedThreadPool(settings.workerThreads(), new ScoringThreadFactory());
    try {
      List<Future<List<PairScore>>> futures = new ArrayList<>();
      for (int from = 0; from < pairs.size(); from += chunkSize) {
        List<PairId> chunk = pairs.subList(from, Math.min(pairs.size(), from + chunkSize));
        futures.add(
            executor.submit(
                () -> scoreChunk(chunk, profiles, buildTick, deadlineNanos, skipped, warnings)));
      }

      long heartbeatEvery = Math.max(1L, lease.timeoutMs() / 3) * 1_000_000L;
      long lastHeartbeat = System.nanoTime();
      List<PairScore> scores = new ArrayList<>(pairs.size());
      int cluster = 0;
      int crossType = 0;
      int index = 0;
      for (Future<List<PairScore>> f : futures) {
        List<PairScore> chunkScores = f.get();
        for (PairScore s : chunkScores) {
          if (s != null) {
            scores.add(s);
            if (index < plan.clusterPairs()) cluster++;
            else if (index < plan.clusterPairs() + plan.crossTypePairs()) crossType++;
          }
          index++;
        }
        if (System.nanoTime() - lastHeartbeat > heartbeatEvery) {
          lease.heartbeat();
          lastHeartbeat = System.nanoTime();
        }
      }
      boolean complete = skipped.get() == 0;
      if (!complete) {
        warnings.add(
            WarningCode.DEADLINE_EXCEEDED,
            null,
            "build deadline reached after %d of %d comparisons"
                .formatted(scores.size(), pairs.size()));
      }
      return new ScoringOutcome(scores, cluster, crossType, complete);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StateException("Interrupted while scoring", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof CapIndexException ce) throw ce;
      throw new IndexBuildException(
          "Scoring failed: " + cause.getMessage(), Map.of("phase", "scoring"), cause);
    } finally {
      executor.shutdownNow();
    }
  }

  /** Scores for {@code chunk}, positionally aligned; null where a pair was skipped. */
  private List<PairScore> scoreChunk(
      List<PairId> chunk,
      Map<String, SemanticProfile> profiles,
      long buildTick,
      long deadlineNanos,
      AtomicInteger skipped,
      WarningCollector warnings) {
    List<PairScore> out = new ArrayList<>(chunk.size());
    for (PairId pair : chunk) {
      if (System.nanoTime() > deadlineNanos) {
        skipped.incrementAndGet();
        out.add(null);
        continue;
      }
      try {
        out.add(
            pipeline
                .scorer()
                .score(profiles.get(pair.first()), profiles.get(pair.second()), buildTick));
      } catch (RuntimeException e) {
        warnings.add(
            WarningCode.SCORING_FAILURE, pair.first(), "pair " + pair + ": " + e.getMessage());
        out.add(null);
      }
    }
    return out;
  }

  private void transition(BuildState to) {
    BuildState from = state.getAndSet(to);
    if (from != to) {
      log.debug("Build state {} -> {}", from, to);
      notifyListeners(from, to);
    }
  }

  private void notifyListeners(BuildState from, BuildState to) {
    for (BuildStateListener l : listeners) {
      try {
        l.onTransition(from, to);
      } catch (RuntimeException e) {
        log.warn("Build state listener failed on {} -> {}", from, to, e);
      }
    }
  }

  private static final class ScoringThreadFactory implements ThreadFactory {
    private static final AtomicInteger SEQ = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "capindex-scoring-" + SEQ.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}

package com.gentoro.capindex.lease;

import com.gentoro.capindex.exception.IoException;
import com.gentoro.capindex.exception.LockTimeoutException;
import com.gentoro.capindex.exception.StateException;
import com.gentoro.capindex.utility.FileUtility;
import com.gentoro.capindex.utility.JacksonUtility;
import java.io.IOException;
import java.net.InetAddress;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Advisory, cross-process lease on an index file, kept in a sidecar {@code <index>.lock} file.
 *
 * <p>The lock file is created with {@code CREATE_NEW}, so at most one contender wins. It holds a
 * {@link LeaseRecord} naming the owner by a random token. A record whose heartbeat is older than
 * its own timeout is stale: the next contender atomically replaces it with its own record. A lock
 * file that cannot be parsed (for instance while its owner is still writing it) is judged by its
 * modification time.
 *
 * <p>Creating the lock file is the only unguarded write. Every delete or rewrite of an existing
 * lock file (reclaim, heartbeat, release) runs while holding an OS file lock on the
 * {@code <index>.lock.guard} sibling and re-reads the lock file first, so nobody removes or
 * overwrites a lock they did not inspect. The guard file is never deleted.
 *
 * <p>Lease timestamps come from the injected {@link Clock}; wait deadlines use elapsed real time.
 */
public class IndexLeaseManager {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(IndexLeaseManager.class);

  public static final long DEFAULT_LEASE_TIMEOUT_MS = 60_000L;
  public static final long DEFAULT_POLL_INTERVAL_MS = 50L;

  // FileChannel.lock is per process; threads of this JVM queue here first.
  private static final ConcurrentMap<Path, ReentrantLock> LOCAL_GUARDS = new ConcurrentHashMap<>();

  private final Clock clock;
  private final long leaseTimeoutMs;
  private final long pollIntervalMs;
  private final String host;

  public IndexLeaseManager() {
    this(Clock.systemUTC(), DEFAULT_LEASE_TIMEOUT_MS, DEFAULT_POLL_INTERVAL_MS);
  }

  public IndexLeaseManager(Clock clock, long leaseTimeoutMs, long pollIntervalMs) {
    if (leaseTimeoutMs <= 0) throw new IllegalArgumentException("leaseTimeoutMs must be > 0");
    this.clock = clock;
    this.leaseTimeoutMs = leaseTimeoutMs;
    this.pollIntervalMs = Math.max(1L, pollIntervalMs);
    this.host = hostName();
  }

  public static Path lockPathFor(Path resourcePath) {
    return resourcePath.resolveSibling(resourcePath.getFileName() + ".lock");
  }

  public static Path guardPathFor(Path resourcePath) {
    Path lock = lockPathFor(resourcePath);
    return lock.resolveSibling(lock.getFileName() + ".guard");
  }

  public long leaseTimeoutMs() {
    return leaseTimeoutMs;
  }

  /**
   * Acquire the lease on {@code resourcePath}.
   *
   * @param wait how long to wait for a live holder in {@link AcquireMode#WAIT}
   * @throws LockTimeoutException when a live holder keeps the lease
   */
  public Lease acquire(Path resourcePath, Duration wait, AcquireMode mode) {
    Path lockPath = lockPathFor(resourcePath);
    String token = UUID.randomUUID().toString();
    long started = System.nanoTime();
    long deadline = started + wait.toNanos();
    String lastHolder = null;

    try {
      Path parent = lockPath.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
    } catch (IOException e) {
      throw new IoException("Cannot create directory for " + lockPath, e);
    }

    while (true) {
      Optional<Lease> created = tryCreate(resourcePath, lockPath, token);
      if (created.isPresent()) {
        log.debug("Acquired lease on {} ({})", resourcePath, token);
        return created.get();
      }

      Holder holder = readHolder(lockPath);
      if (holder == null) {
        continue;
      }
      lastHolder = holder.token();
      if (holder.isStale(clock.instant(), leaseTimeoutMs)) {
        Optional<Lease> taken = reclaim(resourcePath, lockPath, token, holder);
        if (taken.isPresent()) {
          log.info(
              "StaleLeaseReclaimed: lease on {} held by {} had no heartbeat since {}",
              resourcePath,
              taken.get().reclaimedFromToken().orElse("unknown"),
              holder.heartbeatAt());
          return taken.get();
        }
      }

      long now = System.nanoTime();
      if (mode == AcquireMode.FAIL_FAST || now >= deadline) {
        throw new LockTimeoutException(
            resourcePath, Duration.ofNanos(now - started).toMillis(), lastHolder);
      }
      sleep(Math.min(pollIntervalMs, Math.max(1L, Duration.ofNanos(deadline - now).toMillis())));
    }
  }

  /** Refresh the heartbeat of a lease this process still owns. */
  public void heartbeat(Lease lease) {
    if (lease.isReleased()) {
      throw new StateException("Lease already released: " + lease);
    }
    withGuard(
        lease.lockPath(),
        () -> {
          LeaseRecord current = readRecord(lease.lockPath()).orElse(null);
          if (current == null || !lease.ownerToken().equals(current.ownerToken())) {
            throw new StateException("Lease on " + lease.resourcePath() + " is no longer owned");
          }
          try {
            FileUtility.writeAtomically(
                lease.lockPath(), encode(current.withHeartbeat(clock.instant())));
          } catch (IOException e) {
            throw new IoException("Failed to refresh lease heartbeat on " + lease.lockPath(), e);
          }
          return null;
        });
  }

  /**
   * Release the lease. Only deletes the lock file when it still carries this lease's token, so a
   * holder whose lease was reclaimed cannot remove its successor's lock. Idempotent.
   */
  public void release(Lease lease) {
    if (!lease.markReleased()) {
      return;
    }
    withGuard(
        lease.lockPath(),
        () -> {
          Optional<LeaseRecord> current = readRecord(lease.lockPath());
          if (current.isEmpty()) {
            log.debug("Lock file {} already gone on release", lease.lockPath());
          } else if (!lease.ownerToken().equals(current.get().ownerToken())) {
            log.warn(
                "Lease on {} was taken over by {}; leaving its lock in place",
                lease.resourcePath(),
                current.get().ownerToken());
          } else {
            FileUtility.deleteQuietly(lease.lockPath());
            log.debug("Released lease on {} ({})", lease.resourcePath(), lease.ownerToken());
          }
          return null;
        });
  }

  /** Current holder of the lease on {@code resourcePath}, when the lock file is readable. */
  public Optional<LeaseRecord> inspect(Path resourcePath) {
    return readRecord(lockPathFor(resourcePath));
  }

  private Optional<Lease> tryCreate(Path resourcePath, Path lockPath, String token) {
    LeaseRecord record = newRecord(token);
    byte[] bytes = encode(record);
    try (FileChannel ch =
        FileChannel.open(lockPath, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
      ByteBuffer buf = ByteBuffer.wrap(bytes);
      while (buf.hasRemaining()) {
        ch.write(buf);
      }
      ch.force(true);
    } catch (FileAlreadyExistsException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new IoException("Failed to create lock file " + lockPath, e);
    }
    return Optional.of(
        new Lease(this, resourcePath, lockPath, token, record.acquiredAt(), leaseTimeoutMs, null));
  }

  private LeaseRecord newRecord(String token) {
    Instant now = clock.instant();
    return new LeaseRecord(token, now, now, leaseTimeoutMs, host);
  }

  private static byte[] encode(LeaseRecord record) {
    try {
      return JacksonUtility.getJsonMapper().writeValueAsBytes(record);
    } catch (IOException e) {
      throw new IoException("Failed to encode lease record", e);
    }
  }

  /**
   * Replace the stale lock file with ours in one atomic rename, so the lock never disappears and no
   * plain {@code CREATE_NEW} can slip in. Gives up when the lock file is no longer the stale one
   * inspected: another contender got there first.
   */
  private Optional<Lease> reclaim(
      Path resourcePath, Path lockPath, String token, Holder inspected) {
    return withGuard(
        lockPath,
        () -> {
          Holder current = readHolder(lockPath);
          if (current == null
              || !current.sameAs(inspected)
              || !current.isStale(clock.instant(), leaseTimeoutMs)) {
            log.debug("Lock {} changed since it was inspected; not reclaiming", lockPath);
            return Optional.empty();
          }
          LeaseRecord record = newRecord(token);
          try {
            FileUtility.writeAtomically(lockPath, encode(record));
          } catch (IOException e) {
            throw new IoException("Failed to reclaim stale lock " + lockPath, e);
          }
          String reclaimedFrom = inspected.token() == null ? "unknown" : inspected.token();
          return Optional.of(
              new Lease(
                  this,
                  resourcePath,
                  lockPath,
                  token,
                  record.acquiredAt(),
                  leaseTimeoutMs,
                  reclaimedFrom));
        });
  }

  /** Run {@code action} while holding the guard lock that serializes changes to {@code lockPath}. */
  private static <T> T withGuard(Path lockPath, Supplier<T> action) {
    Path guard = lockPath.resolveSibling(lockPath.getFileName() + ".guard");
    ReentrantLock local =
        LOCAL_GUARDS.computeIfAbsent(
            guard.toAbsolutePath().normalize(), p -> new ReentrantLock());
    local.lock();
    try (FileChannel ch =
            FileChannel.open(guard, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock ignored = ch.lock()) {
      return action.get();
    } catch (IOException e) {
      throw new IoException("Failed to lock " + guard, e);
    } finally {
      local.unlock();
    }
  }

  private Optional<LeaseRecord> readRecord(Path lockPath) {
    try {
      byte[] bytes = Files.readAllBytes(lockPath);
      LeaseRecord r = JacksonUtility.getJsonMapper().readValue(bytes, LeaseRecord.class);
      if (r == null || r.ownerToken() == null || r.heartbeatAt() == null) {
        return Optional.empty();
      }
      return Optional.of(r);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      log.debug("Unreadable lock file {}: {}", lockPath, e.getMessage());
      return Optional.empty();
    }
  }

  /** Lock file snapshot; null when the file vanished. */
  private Holder readHolder(Path lockPath) {
    Optional<LeaseRecord> record = readRecord(lockPath);
    if (record.isPresent()) {
      return new Holder(record.get(), null);
    }
    try {
      return new Holder(null, Files.getLastModifiedTime(lockPath).toInstant());
    } catch (NoSuchFileException e) {
      return null;
    } catch (IOException e) {
      throw new IoException("Failed to inspect lock file " + lockPath, e);
    }
  }

  /** Either a parsed record or, for an unreadable lock file, its modification time. */
  private record Holder(LeaseRecord record, Instant modifiedAt) {
    String token() {
      return record == null ? null : record.ownerToken();
    }

    Instant heartbeatAt() {
      return record == null ? modifiedAt : record.heartbeatAt();
    }

    boolean isStale(Instant now, long fallbackTimeoutMs) {
      if (record != null && record.timeoutMs() > 0) {
        return record.isStale(now);
      }
      return heartbeatAt().plusMillis(fallbackTimeoutMs).isBefore(now);
    }

    boolean sameAs(Holder other) {
      return Objects.equals(token(), other.token()) && heartbeatAt().equals(other.heartbeatAt());
    }
  }

  private static void sleep(long ms) {
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StateException("Interrupted while waiting for index lease", e);
    }
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (IOException e) {
      return "unknown";
    }
  }
}

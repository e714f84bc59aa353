package com.gentoro.capindex.lease;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive right to rewrite one index file, identified by a random owner token. Closing the lease
 * releases it; releasing twice is harmless.
 */
public final class Lease implements AutoCloseable {
  private final IndexLeaseManager manager;
  private final Path resourcePath;
  private final Path lockPath;
  private final String ownerToken;
  private final Instant acquiredAt;
  private final long timeoutMs;
  private final String reclaimedFromToken;
  private final AtomicBoolean released = new AtomicBoolean(false);

  Lease(
      IndexLeaseManager manager,
      Path resourcePath,
      Path lockPath,
      String ownerToken,
      Instant acquiredAt,
      long timeoutMs,
      String reclaimedFromToken) {
    this.manager = manager;
    this.resourcePath = resourcePath;
    this.lockPath = lockPath;
    this.ownerToken = ownerToken;
    this.acquiredAt = acquiredAt;
    this.timeoutMs = timeoutMs;
    this.reclaimedFromToken = reclaimedFromToken;
  }

  public Path resourcePath() {
    return resourcePath;
  }

  public Path lockPath() {
    return lockPath;
  }

  public String ownerToken() {
    return ownerToken;
  }

  public Instant acquiredAt() {
    return acquiredAt;
  }

  public long timeoutMs() {
    return timeoutMs;
  }

  /** Token of the stale holder this lease replaced, if any. */
  public Optional<String> reclaimedFromToken() {
    return Optional.ofNullable(reclaimedFromToken);
  }

  public boolean isReleased() {
    return released.get();
  }

  public void heartbeat() {
    manager.heartbeat(this);
  }

  boolean markReleased() {
    return released.compareAndSet(false, true);
  }

  @Override
  public void close() {
    manager.release(this);
  }

  @Override
  public String toString() {
    return "Lease{" + resourcePath + ", token=" + ownerToken + '}';
  }
}

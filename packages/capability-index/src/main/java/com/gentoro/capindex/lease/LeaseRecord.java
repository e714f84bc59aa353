package com.gentoro.capindex.lease;

import java.time.Instant;

/** Content of the sidecar lock file. */
public record LeaseRecord(
    String ownerToken, Instant acquiredAt, Instant heartbeatAt, long timeoutMs, String host) {

  /** Stale once the last heartbeat is older than the holder's own timeout. */
  public boolean isStale(Instant now) {
    return heartbeatAt.plusMillis(timeoutMs).isBefore(now);
  }

  LeaseRecord withHeartbeat(Instant at) {
    return new LeaseRecord(ownerToken, acquiredAt, at, timeoutMs, host);
  }
}

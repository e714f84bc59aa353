package com.gentoro.capindex.index;

import com.gentoro.capindex.lease.AcquireMode;
import java.nio.file.Path;
import java.time.Duration;

/**
 * @param leaseWait how long a build waits for another holder of the index lease
 * @param deadline per-build time limit for scoring; {@link Duration#ZERO} means none
 */
public record BuildSettings(
    Path indexPath,
    Duration leaseWait,
    AcquireMode acquireMode,
    Duration deadline,
    int workerThreads,
    int scoringChunkSize) {

  public BuildSettings {
    if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be >= 1");
    if (scoringChunkSize < 1) throw new IllegalArgumentException("scoringChunkSize must be >= 1");
    deadline = deadline == null ? Duration.ZERO : deadline;
  }

  public static BuildSettings defaults(Path indexPath) {
    return new BuildSettings(
        indexPath, Duration.ofSeconds(30), AcquireMode.WAIT, Duration.ZERO, 4, 64);
  }

  public BuildSettings withAcquireMode(AcquireMode mode) {
    return new BuildSettings(indexPath, leaseWait, mode, deadline, workerThreads, scoringChunkSize);
  }
}

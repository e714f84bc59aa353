package com.gentoro.capindex.exception;

import java.nio.file.Path;
import java.util.Map;

/**
 * The index lease could not be acquired within the allotted time. The holder is alive, so the
 * caller may retry later.
 */
public class LockTimeoutException extends CapIndexException {
  private final Path resourcePath;

  public LockTimeoutException(Path resourcePath, long waitedMs, String holderToken) {
    super(
        CapIndexErrorCode.LOCK_TIMEOUT,
        "Timed out after %d ms waiting for lease on %s".formatted(waitedMs, resourcePath),
        Map.of(
            "resource", String.valueOf(resourcePath),
            "waitedMs", waitedMs,
            "holder", holderToken == null ? "unknown" : holderToken));
    this.resourcePath = resourcePath;
  }

  public Path getResourcePath() {
    return resourcePath;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}

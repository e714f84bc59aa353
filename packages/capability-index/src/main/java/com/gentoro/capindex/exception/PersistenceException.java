package com.gentoro.capindex.exception;

import java.nio.file.Path;
import java.util.Map;

/** Writing the index to its destination failed; the previous file is left untouched. */
public class PersistenceException extends CapIndexException {
  public PersistenceException(Path path, String message, Throwable cause) {
    super(
        CapIndexErrorCode.PERSISTENCE_ERROR,
        message,
        Map.of("path", String.valueOf(path)),
        cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}

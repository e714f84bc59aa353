package com.gentoro.capindex.exception;

import java.time.Instant;
import java.util.Map;

/** Lightweight DTO to expose structured error information to logs or CLI output. */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final CapIndexErrorCode code;
  public final boolean retryable;
  public final Map<String, Object> context;
  public final Instant timestamp;

  public ErrorDetails(
      String type,
      String message,
      CapIndexErrorCode code,
      boolean retryable,
      Map<String, Object> context,
      Instant timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.retryable = retryable;
    this.context = context;
    this.timestamp = timestamp;
  }
}

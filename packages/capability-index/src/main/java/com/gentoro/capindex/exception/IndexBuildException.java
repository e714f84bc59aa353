package com.gentoro.capindex.exception;

import java.util.Map;

/** A build failed in one of its phases for a reason not covered by a more specific exception. */
public class IndexBuildException extends CapIndexException {
  public IndexBuildException(String message, Map<String, ?> context, Throwable cause) {
    super(CapIndexErrorCode.BUILD_FAILED, message, context, cause);
  }
}

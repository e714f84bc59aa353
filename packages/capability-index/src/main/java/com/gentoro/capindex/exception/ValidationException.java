package com.gentoro.capindex.exception;

/** Input supplied by a caller does not satisfy a documented precondition. */
public class ValidationException extends CapIndexException {
  public ValidationException(String message) {
    super(CapIndexErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(CapIndexErrorCode.INVALID_ARGUMENT, message, cause);
  }
}

package com.gentoro.capindex.exception;

/** Operation invoked while a component is in a state that does not allow it. */
public class StateException extends CapIndexException {
  public StateException(String message) {
    super(CapIndexErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(CapIndexErrorCode.FAILED_PRECONDITION, message, cause);
  }
}

package com.gentoro.capindex.exception;

/** Wraps low level I/O failures that are not specific to index persistence. */
public class IoException extends CapIndexException {
  public IoException(String message) {
    super(CapIndexErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(CapIndexErrorCode.IO_ERROR, message, cause);
  }
}

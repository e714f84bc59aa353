package com.gentoro.capindex.exception;

/** The persisted index document is not parseable or lacks required structure. */
public class IndexDecodeException extends CapIndexException {
  public IndexDecodeException(String message) {
    super(CapIndexErrorCode.INDEX_DECODE_ERROR, message);
  }

  public IndexDecodeException(String message, Throwable cause) {
    super(CapIndexErrorCode.INDEX_DECODE_ERROR, message, cause);
  }
}

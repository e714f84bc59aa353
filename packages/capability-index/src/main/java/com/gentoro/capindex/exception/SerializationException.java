package com.gentoro.capindex.exception;

/** JSON/YAML (de)serialization failure outside of index decoding. */
public class SerializationException extends CapIndexException {
  public SerializationException(String message) {
    super(CapIndexErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(CapIndexErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}

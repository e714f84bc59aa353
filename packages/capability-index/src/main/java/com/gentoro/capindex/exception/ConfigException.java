package com.gentoro.capindex.exception;

/** Configuration value missing, malformed or outside its allowed range. */
public class ConfigException extends CapIndexException {
  public ConfigException(String message) {
    super(CapIndexErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(CapIndexErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}

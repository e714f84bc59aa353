package com.gentoro.capindex.exception;

import java.util.Map;

/** The persisted index declares a schema version this build cannot read or must not replace. */
public class SchemaVersionMismatchException extends CapIndexException {
  private final int foundVersion;
  private final int supportedVersion;

  public SchemaVersionMismatchException(int foundVersion, int supportedVersion, String message) {
    super(
        CapIndexErrorCode.SCHEMA_VERSION_MISMATCH,
        message,
        Map.of("foundVersion", foundVersion, "supportedVersion", supportedVersion));
    this.foundVersion = foundVersion;
    this.supportedVersion = supportedVersion;
  }

  public int getFoundVersion() {
    return foundVersion;
  }

  public int getSupportedVersion() {
    return supportedVersion;
  }
}

package com.gentoro.capindex.exception;

/**
 * Canonical error codes for the capability index engine. Codes are stable and safe to surface in
 * logs and to callers that branch on the failure origin.
 */
public enum CapIndexErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Index lifecycle
  LOCK_TIMEOUT,
  PERSISTENCE_ERROR,
  SCHEMA_VERSION_MISMATCH,
  INDEX_DECODE_ERROR,
  BUILD_FAILED,
}

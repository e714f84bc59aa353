package com.gentoro.capindex.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Non-fatal problem observed during a build. {@code elementId} is null for build-wide issues. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BuildWarning(WarningCode code, String elementId, String message) {

  public static BuildWarning of(WarningCode code, String elementId, String message) {
    return new BuildWarning(code, elementId, message);
  }
}

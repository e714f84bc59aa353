package com.gentoro.capindex.diagnostics;

import java.util.ArrayList;
import java.util.List;

/** Thread-safe sink for build warnings; every warning is also logged at WARN. */
public class WarningCollector {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(WarningCollector.class);

  private final List<BuildWarning> warnings = new ArrayList<>();

  public void add(WarningCode code, String elementId, String message) {
    add(BuildWarning.of(code, elementId, message));
  }

  public synchronized void add(BuildWarning warning) {
    log.warn(
        "{}{}: {}",
        warning.code().wireName(),
        warning.elementId() == null ? "" : " [" + warning.elementId() + "]",
        warning.message());
    warnings.add(warning);
  }

  public synchronized List<BuildWarning> snapshot() {
    return List.copyOf(warnings);
  }

  public synchronized boolean contains(WarningCode code) {
    return warnings.stream().anyMatch(w -> w.code() == code);
  }

  public synchronized int size() {
    return warnings.size();
  }
}

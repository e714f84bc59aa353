package com.gentoro.capindex;

import com.gentoro.capindex.exception.ErrorDetails;
import com.gentoro.capindex.exception.ExceptionUtil;

public class CapIndexApp {

  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(CapIndexApp.class);

  public static void main(String[] args) {
    int exitCode;
    try {
      CapIndex app = new CapIndex(args);
      app.initialize();
      exitCode = app.run(System.out);
    } catch (Exception e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.error("Command failed [{}]: {}", details.code, details.message);
      log.debug("Failure detail:\n{}", ExceptionUtil.formatCompactStackTrace(e));
      exitCode = details.retryable ? 75 : 1;
    }
    System.exit(exitCode);
  }
}

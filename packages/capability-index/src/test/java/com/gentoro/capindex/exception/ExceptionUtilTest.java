package com.gentoro.capindex.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void errorDetailsKeepCodeContextAndRetryability() {
    LockTimeoutException e = new LockTimeoutException(Paths.get("index.yaml"), 250, "owner-1");
    ErrorDetails details = ExceptionUtil.toErrorDetails(e);

    assertEquals("LockTimeoutException", details.type);
    assertEquals(CapIndexErrorCode.LOCK_TIMEOUT, details.code);
    assertTrue(details.retryable);
    assertEquals("owner-1", details.context.get("holder"));
    assertEquals(250L, details.context.get("waitedMs"));
    assertNotNull(details.timestamp);
  }

  @Test
  void foreignExceptionsMapToUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());
    assertEquals(CapIndexErrorCode.UNKNOWN, details.code);
    assertEquals("", details.message);
    assertFalse(details.retryable);
  }

  @Test
  void rethrowIfUncheckedWrapsOnlyForeignExceptions() {
    ConfigException own = new ConfigException("bad");
    assertSame(own, ExceptionUtil.rethrowIfUnchecked(own, t -> new StateException("wrapped", t)));

    RuntimeException foreign = new RuntimeException("boom");
    CapIndexException wrapped =
        ExceptionUtil.rethrowIfUnchecked(foreign, t -> new StateException("wrapped", t));
    assertInstanceOf(StateException.class, wrapped);
    assertSame(foreign, wrapped.getCause());
  }

  @Test
  void compactStackTraceIsBounded() {
    Exception e = new Exception("x");
    String all = ExceptionUtil.formatCompactStackTrace(e, 0);
    String two = ExceptionUtil.formatCompactStackTrace(e, 2);
    assertEquals(1, two.split(" > ").length - 1);
    assertTrue(all.length() >= two.length());
    assertTrue(two.startsWith(ExceptionUtilTest.class.getName()));
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }

  @Test
  void contextIsImmutableAndShownInToString() {
    IndexBuildException e =
        new IndexBuildException(
            "failed", java.util.Map.of("indexPath", "a.yaml"), new RuntimeException());
    assertThrows(UnsupportedOperationException.class, () -> e.getContext().put("k", "v"));
    assertTrue(e.toString().contains("indexPath=a.yaml"));
    assertTrue(e.toString().contains("cause=RuntimeException"));
    assertEquals(CapIndexErrorCode.BUILD_FAILED, e.getCode());
  }
}

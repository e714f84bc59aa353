package com.gentoro.capindex.lease;

import java.util.Locale;

public enum AcquireMode {
  /** Poll until the lease frees up, goes stale, or the wait timeout passes. */
  WAIT,
  /** Give up immediately when a live lease is held by someone else. */
  FAIL_FAST;

  public static AcquireMode fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
  }
}

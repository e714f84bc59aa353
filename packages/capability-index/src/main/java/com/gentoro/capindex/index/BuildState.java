package com.gentoro.capindex.index;

public enum BuildState {
  IDLE,
  ACQUIRING_LEASE,
  PROFILING,
  PLANNING,
  SCORING,
  DISCOVERING_RELATIONSHIPS,
  PERSISTING,
  FAILED
}

package com.gentoro.capindex.index;

/** Observer of builder state transitions, called on the building thread. */
@FunctionalInterface
public interface BuildStateListener {

  void onTransition(BuildState from, BuildState to);
}

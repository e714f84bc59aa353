package com.gentoro.capindex.relationship;

/** Limits applied while extracting action triggers from element records. */
public record TriggerSettings(int maxPerElement, int maxLength) {

  public static TriggerSettings defaults() {
    return new TriggerSettings(50, 50);
  }
}

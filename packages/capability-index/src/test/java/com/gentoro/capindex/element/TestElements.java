package com.gentoro.capindex.element;

import java.util.ArrayList;
import java.util.List;

/** Element fixtures shared by tests. */
public final class TestElements {
  private static final ElementType[] TYPES = {
    ElementType.PERSONA, ElementType.SKILL, ElementType.TEMPLATE, ElementType.AGENT
  };

  private TestElements() {}

  public static ElementRecord skill(String id, String description, String... keywords) {
    return ElementRecord.of(id, ElementType.SKILL, id, description, List.of(keywords), null, null);
  }

  public static ElementRecord element(
      String id, ElementType type, String description, List<String> triggers) {
    return ElementRecord.of(id, type, id, description, null, null, triggers);
  }

  /**
   * {@code count} elements cycling through four types, keyworded {@code topic-(i % 20)} and {@code
   * area-(i % 7)}.
   */
  public static List<ElementRecord> corpus(int count) {
    List<ElementRecord> out = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      out.add(
          ElementRecord.of(
              String.format("el-%03d", i),
              TYPES[i % TYPES.length],
              "Element " + i,
              "Handles topic " + (i % 20) + " in area " + (i % 7),
              List.of("topic-" + (i % 20), "area-" + (i % 7)),
              null,
              null));
    }
    return out;
  }
}

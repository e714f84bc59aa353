package com.gentoro.capindex.element;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Element source backed by a mutable in-memory list. */
public class InMemoryElementSource implements ElementSource {
  private final List<ElementRecord> records = new CopyOnWriteArrayList<>();

  public InMemoryElementSource() {}

  public InMemoryElementSource(List<ElementRecord> initial) {
    records.addAll(initial);
  }

  public void add(ElementRecord record) {
    records.add(record);
  }

  public void replaceAll(List<ElementRecord> replacement) {
    records.clear();
    records.addAll(replacement);
  }

  @Override
  public List<ElementRecord> listElements() {
    return List.copyOf(new ArrayList<>(records));
  }
}

package com.gentoro.capindex.element;

import java.util.List;

/**
 * Collaborator that enumerates the element records a build should index. Implementations own
 * storage, parsing and sanitization; the engine never writes through this interface.
 */
public interface ElementSource {

  List<ElementRecord> listElements();
}

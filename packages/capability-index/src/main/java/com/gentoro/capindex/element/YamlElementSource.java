package com.gentoro.capindex.element;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.capindex.exception.IoException;
import com.gentoro.capindex.exception.SerializationException;
import com.gentoro.capindex.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads element records from a YAML file, either a top level sequence or a mapping with an {@code
 * elements} sequence. The file is re-read on every call.
 */
public class YamlElementSource implements ElementSource {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(YamlElementSource.class);

  private final Path file;

  public YamlElementSource(Path file) {
    this.file = file;
  }

  @Override
  public List<ElementRecord> listElements() {
    if (!Files.isRegularFile(file)) {
      throw new IoException("Element file not found: " + file);
    }
    try {
      JsonNode root = JacksonUtility.getYamlMapper().readTree(file.toFile());
      JsonNode list = root != null && root.isObject() ? root.get("elements") : root;
      if (list == null || list.isNull() || list.isMissingNode()) {
        log.warn("Element file {} contains no elements", file);
        return List.of();
      }
      if (!list.isArray()) {
        throw new SerializationException("Expected a sequence of elements in " + file);
      }
      List<ElementRecord> records =
          JacksonUtility.getYamlMapper()
              .convertValue(list, new TypeReference<List<ElementRecord>>() {});
      log.debug("Loaded {} element records from {}", records.size(), file);
      return records;
    } catch (IOException | IllegalArgumentException e) {
      throw new SerializationException("Failed to read element records from " + file, e);
    }
  }
}

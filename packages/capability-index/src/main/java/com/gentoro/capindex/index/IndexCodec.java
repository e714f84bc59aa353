package com.gentoro.capindex.index;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.capindex.exception.IndexDecodeException;
import com.gentoro.capindex.exception.PersistenceException;
import com.gentoro.capindex.exception.SchemaVersionMismatchException;
import com.gentoro.capindex.exception.SerializationException;
import com.gentoro.capindex.utility.FileUtility;
import com.gentoro.capindex.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes {@link CapabilityIndex} documents as YAML.
 *
 * <p>Decoding accepts the current schema and upgrades version 1 documents; anything else is
 * rejected with {@link SchemaVersionMismatchException} and left on disk. Fields the model does not
 * know fail the decode instead of being dropped; unknown evidence is the one place where foreign
 * attributes are kept, through {@link com.gentoro.capindex.relationship.OpaqueEvidence}. Writes go through a
 * temporary sibling and an atomic rename, and never replace a document with a newer schema.
 */
public class IndexCodec {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(IndexCodec.class);

  public static final int CURRENT_SCHEMA_VERSION = 2;
  public static final int OLDEST_SUPPORTED_SCHEMA_VERSION = 1;

  private final ObjectMapper mapper;

  public IndexCodec() {
    this(
        JacksonUtility.getYamlMapper()
            .copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true));
  }

  IndexCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public byte[] encode(CapabilityIndex index) {
    try {
      return mapper.writeValueAsBytes(index);
    } catch (IOException e) {
      throw new SerializationException("Failed to encode capability index", e);
    }
  }

  public CapabilityIndex decode(byte[] bytes) {
    ObjectNode root = parseRoot(bytes);
    int version = schemaVersionOf(root);
    if (version > CURRENT_SCHEMA_VERSION || version < OLDEST_SUPPORTED_SCHEMA_VERSION) {
      throw new SchemaVersionMismatchException(
          version,
          CURRENT_SCHEMA_VERSION,
          "Index schema version %d is not supported (supported: %d..%d)"
              .formatted(version, OLDEST_SUPPORTED_SCHEMA_VERSION, CURRENT_SCHEMA_VERSION));
    }
    if (version < CURRENT_SCHEMA_VERSION) {
      root = IndexSchemaUpgrader.upgrade(root, version);
    }
    try {
      CapabilityIndex index = mapper.treeToValue(root, CapabilityIndex.class);
      if (index.generatedAt() == null) {
        throw new IndexDecodeException("Index document has no generatedAt");
      }
      return index;
    } catch (IOException | IllegalArgumentException e) {
      throw new IndexDecodeException("Malformed capability index: " + e.getMessage(), e);
    }
  }

  public CapabilityIndex read(Path path) {
    try {
      return decode(Files.readAllBytes(path));
    } catch (NoSuchFileException e) {
      throw new IndexDecodeException("Index file not found: " + path, e);
    } catch (IOException e) {
      throw new IndexDecodeException("Failed to read index file " + path, e);
    }
  }

  public Optional<CapabilityIndex> readIfExists(Path path) {
    if (!Files.exists(path)) return Optional.empty();
    return Optional.of(read(path));
  }

  /**
   * Atomically replace the document at {@code path}.
   *
   * @throws SchemaVersionMismatchException when the existing document has a newer schema
   * @throws PersistenceException when the bytes cannot be written; the old file is left intact
   */
  public void write(CapabilityIndex index, Path path) {
    existingVersion(path)
        .filter(v -> v > index.schemaVersion())
        .ifPresent(
            v -> {
              throw new SchemaVersionMismatchException(
                  v,
                  index.schemaVersion(),
                  "Refusing to replace index schema %d at %s with older schema %d"
                      .formatted(v, path, index.schemaVersion()));
            });
    byte[] bytes = encode(index);
    try {
      FileUtility.writeAtomically(path, bytes);
    } catch (IOException e) {
      throw new PersistenceException(path, "Failed to persist capability index to " + path, e);
    }
    log.debug("Wrote capability index ({} bytes) to {}", bytes.length, path);
  }

  /** Schema version of the document currently at {@code path}, when it can be determined. */
  Optional<Integer> existingVersion(Path path) {
    if (!Files.exists(path)) return Optional.empty();
    try {
      return Optional.of(schemaVersionOf(parseRoot(Files.readAllBytes(path))));
    } catch (IndexDecodeException | IOException e) {
      log.warn("Existing index at {} is unreadable and will be replaced: {}", path, e.getMessage());
      return Optional.empty();
    }
  }

  private ObjectNode parseRoot(byte[] bytes) {
    JsonNode root;
    try {
      root = mapper.readTree(bytes);
    } catch (IOException e) {
      throw new IndexDecodeException("Index document is not valid YAML", e);
    }
    if (!(root instanceof ObjectNode obj)) {
      throw new IndexDecodeException("Index document must be a mapping");
    }
    return obj;
  }

  private static int schemaVersionOf(ObjectNode root) {
    JsonNode v = root.get("schemaVersion");
    if (v == null || !v.canConvertToInt() || !v.isNumber()) {
      throw new IndexDecodeException("Index document has no numeric schemaVersion");
    }
    return v.asInt();
  }
}

package com.gentoro.capindex.element;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Sanitized, read-only view of one content element as handed over by the storage layer.
 *
 * <p>When {@code rawText} is blank it is derived from the other textual fields so every record has
 * something to profile.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ElementRecord(
    String id,
    ElementType elementType,
    String name,
    String description,
    List<String> keywords,
    List<String> tags,
    List<String> actionTriggers,
    String rawText) {

  public ElementRecord {
    keywords = sanitize(keywords);
    tags = sanitize(tags);
    actionTriggers = sanitize(actionTriggers);
    name = name == null ? "" : name;
    description = description == null ? "" : description;
    if (rawText == null || rawText.isBlank()) {
      rawText =
          Stream.of(
                  Stream.of(name, description),
                  keywords.stream(),
                  tags.stream(),
                  actionTriggers.stream())
              .flatMap(s -> s)
              .filter(s -> !s.isBlank())
              .collect(Collectors.joining(" "));
    }
  }

  /** Convenience factory for records without explicit raw text. */
  public static ElementRecord of(
      String id,
      ElementType type,
      String name,
      String description,
      List<String> keywords,
      List<String> tags,
      List<String> actionTriggers) {
    return new ElementRecord(id, type, name, description, keywords, tags, actionTriggers, null);
  }

  /** Hex SHA-256 over every field that influences profiles, scores and triggers. */
  @JsonIgnore
  public String contentHash() {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      feed(md, id);
      feed(md, elementType == null ? "" : elementType.wireName());
      feed(md, rawText);
      feed(md, String.join(",", keywords));
      feed(md, String.join(",", tags));
      feed(md, String.join(",", actionTriggers));
      return HexFormat.of().formatHex(md.digest());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static void feed(MessageDigest md, String value) {
    md.update(Objects.toString(value, "").getBytes(StandardCharsets.UTF_8));
    md.update((byte) 0);
  }

  private static List<String> sanitize(List<String> values) {
    if (values == null) return List.of();
    return values.stream().filter(Objects::nonNull).map(String::trim).toList();
  }
}

package com.gentoro.capindex.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;

/**
 * Rewrites older index documents, in tree form, into the current layout.
 *
 * <p>Version 1 stored the edge kind as {@code type} and its weight as {@code strength}, and had no
 * completeness marker.
 */
final class IndexSchemaUpgrader {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(IndexSchemaUpgrader.class);

  private IndexSchemaUpgrader() {}

  static ObjectNode upgrade(ObjectNode root, int fromVersion) {
    int version = fromVersion;
    if (version == 1) {
      upgradeV1(root);
      version = 2;
    }
    root.put("schemaVersion", version);
    log.debug("Upgraded index document from schema {} to {}", fromVersion, version);
    return root;
  }

  private static void upgradeV1(ObjectNode root) {
    JsonNode elements = root.get("elements");
    if (elements != null && elements.isObject()) {
      Iterator<JsonNode> it = elements.elements();
      while (it.hasNext()) {
        JsonNode element = it.next();
        JsonNode edges = element.get("outboundEdges");
        if (edges == null || !edges.isArray()) continue;
        for (JsonNode edge : edges) {
          if (!(edge instanceof ObjectNode e)) continue;
          rename(e, "strength", "weight");
          rename(e, "type", "kind");
        }
      }
    }
    JsonNode stats = root.get("buildStats");
    if (stats instanceof ObjectNode s && !s.has("completeness")) {
      s.put("completeness", Completeness.COMPLETE.wireName());
    }
  }

  private static void rename(ObjectNode node, String from, String to) {
    if (node.has(from) && !node.has(to)) {
      node.set(to, node.remove(from));
    }
  }
}

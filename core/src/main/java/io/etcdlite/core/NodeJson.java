// file: core/src/main/java/io/etcdlite/core/NodeJson.java
package io.etcdlite.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders store nodes into the etcd v2 style response documents, and reads
 * leaf documents back.
 *
 * Layout:
 *   { "action": "...", "node": { "key", "modifiedIndex", "createdIndex", "value"? } }
 *   { "action": "get", "node": { "dir": true, "modifiedIndex": 1, "createdIndex": 1, "nodes"?: [...] } }
 */
public final class NodeJson {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private NodeJson() {
        // utility
    }

    /** An empty document, used as the body of failed requests. */
    public static ObjectNode empty() {
        return FACTORY.objectNode();
    }

    /** Leaf node fields. The value is omitted for tombstones. */
    public static ObjectNode node(Node node) {
        ObjectNode json = FACTORY.objectNode();
        json.put("key", node.key());
        json.put("modifiedIndex", node.modifiedIndex());
        json.put("createdIndex", node.createdIndex());
        if (!node.deleted()) {
            json.put("value", node.value());
        }
        return json;
    }

    /** Top-level document for a single-entry action. */
    public static ObjectNode entry(Node node, String action) {
        ObjectNode json = FACTORY.objectNode();
        json.put("action", action);
        json.set("node", node(node));
        return json;
    }

    /** Top-level document for a directory listing. */
    public static ObjectNode directory(List<Node> nodes, String action) {
        ObjectNode dir = FACTORY.objectNode();
        dir.put("dir", true);
        dir.put("modifiedIndex", 1);
        dir.put("createdIndex", 1);
        if (!nodes.isEmpty()) {
            ArrayNode children = dir.putArray("nodes");
            for (Node n : nodes) {
                children.add(node(n));
            }
        }
        ObjectNode json = FACTORY.objectNode();
        json.put("action", action);
        json.set("node", dir);
        return json;
    }

    /**
     * Parse a leaf node document. A document without "value" is read back as a
     * tombstone, since that is the only case the renderer drops it.
     */
    public static Node parseNode(JsonNode json) {
        if (json == null || !json.isObject() || !json.hasNonNull("key")) {
            throw new IllegalArgumentException("not a leaf node document: " + json);
        }
        boolean hasValue = json.has("value");
        return new Node(
                json.get("key").asText(),
                hasValue ? json.get("value").asText() : null,
                json.path("createdIndex").asLong(),
                json.path("modifiedIndex").asLong(),
                null,
                !hasValue
        );
    }

    /** Parse the children of a directory document; empty when it has none. */
    public static List<Node> parseChildren(JsonNode dir) {
        List<Node> out = new ArrayList<>();
        JsonNode children = dir.path("nodes");
        for (JsonNode child : children) {
            out.add(parseNode(child));
        }
        return out;
    }
}

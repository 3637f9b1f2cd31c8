package com.indexsync.testing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.indexsync.serde.JsonMappers;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Builds Debezium-style change event bodies for tests.
 */
public final class ChangeEvents {

    private static final ObjectMapper MAPPER = JsonMappers.create();
    public static final long TS_MS = 1_743_465_600_000L;

    private ChangeEvents() {
    }

    public static byte[] create(Map<String, Object> row) {
        return envelope("c", null, row, TS_MS);
    }

    public static byte[] update(Map<String, Object> row) {
        return envelope("u", null, row, TS_MS);
    }

    public static byte[] delete(Map<String, Object> row) {
        return envelope("d", row, null, TS_MS);
    }

    /** A wrapped event {@code {"payload": {...}}} with the given fields. */
    public static byte[] envelope(String op, Map<String, Object> before, Map<String, Object> after, Long tsMs) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.set("before", MAPPER.valueToTree(before));
        payload.set("after", MAPPER.valueToTree(after));
        if (op != null) {
            payload.put("op", op);
        }
        ObjectNode source = payload.putObject("source");
        source.put("connector", "postgresql");
        source.put("db", "digital_discovery");
        source.put("schema", "public");
        source.put("table", "categories");
        if (tsMs != null) {
            source.put("ts_ms", tsMs);
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.set("payload", payload);
        return bytes(root);
    }

    public static byte[] json(String raw) {
        return raw.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] bytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}

/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connector.postgresql;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.syncbase.transport.RealtimeChange;

/**
 * Parses the JSON payloads published by the notification trigger function:
 *
 * <pre>
 * {"type": "UPDATE", "schema": "public", "table": "foo", "commit_timestamp": "2024-05-01T10:00:00.123+00:00",
 *  "record": {...}, "old_record": {...}}
 * </pre>
 *
 * Changes too large for a notification carry {@code "truncated": true} and row images holding only the key column.
 */
public final class NotificationPayloads {

    static final String TYPE = "type";
    static final String SCHEMA = "schema";
    static final String TABLE = "table";
    static final String COMMIT_TIMESTAMP = "commit_timestamp";
    static final String RECORD = "record";
    static final String OLD_RECORD = "old_record";
    static final String TRUNCATED = "truncated";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private NotificationPayloads() {
    }

    /**
     * @param payload the notification payload
     * @return the published change; never null
     * @throws IllegalArgumentException if the payload is not a JSON object
     */
    public static RealtimeChange parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("Empty notification payload");
        }
        final JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Notification payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Notification payload is not a JSON object");
        }
        return new RealtimeChange(
                text(root, TYPE),
                text(root, SCHEMA),
                text(root, TABLE),
                row(root, RECORD),
                row(root, OLD_RECORD),
                text(root, COMMIT_TIMESTAMP),
                root.path(TRUNCATED).asBoolean(false));
    }

    private static String text(JsonNode root, String field) {
        final JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Map<String, Object> row(JsonNode root, String field) {
        final JsonNode node = root.get(field);
        if (node == null || !node.isObject()) {
            return null;
        }
        return MAPPER.convertValue(node, ROW_TYPE);
    }
}

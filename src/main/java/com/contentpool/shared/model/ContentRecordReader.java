package com.contentpool.shared.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes a JSON batch of {@code {"vector": [...], "payload": {...}}} objects
 * as produced by the upstream pipeline. Malformed vectors decode to
 * {@code null} so that the pool can reject the record on insert instead of
 * failing the whole batch here.
 */
public final class ContentRecordReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ContentRecordReader() {}

    public static List<ContentRecord> read(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid content batch JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Content batch must be a JSON array");
        }
        var records = new ArrayList<ContentRecord>(root.size());
        for (var node : root) {
            records.add(new ContentRecord(vector(node.path("vector")), payload(node.path("payload"))));
        }
        return records;
    }

    private static float[] vector(JsonNode arr) {
        if (!arr.isArray()) return null;
        var vec = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) {
            var element = arr.get(i);
            if (!element.isNumber()) return null;
            vec[i] = (float) element.asDouble();
        }
        return vec;
    }

    private static Map<String, String> payload(JsonNode obj) {
        var payload = new LinkedHashMap<String, String>();
        if (!obj.isObject()) return payload;
        obj.fields().forEachRemaining(e -> {
            var value = e.getValue();
            if (value.isNull()) {
                payload.put(e.getKey(), "");
            } else if (value.isContainerNode()) {
                payload.put(e.getKey(), value.toString());
            } else {
                payload.put(e.getKey(), value.asText());
            }
        });
        return payload;
    }
}

package com.contentpool.shared.model;

import java.util.Map;

/**
 * One ingestion record. {@code vector} may be null when the upstream data
 * was malformed; such records are rejected at insert time.
 */
public record ContentRecord(
    float[] vector,
    Map<String, String> payload
) {
    public ContentRecord {
        if (payload == null) payload = Map.of();
    }
}

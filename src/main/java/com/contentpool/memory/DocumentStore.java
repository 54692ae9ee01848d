package com.contentpool.memory;

import com.contentpool.shared.model.ContentRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Owns every inserted document. Ids start at 1, increase by one per accepted
 * record and are never reused. Not thread-safe.
 */
class DocumentStore {

    record StoredDocument(int id, float[] vector, Map<String, String> payload) {}

    private final int vectorSize;
    private final Map<Integer, StoredDocument> documents = new LinkedHashMap<>();
    private int lastId = 0;

    DocumentStore(int vectorSize) {
        this.vectorSize = vectorSize;
    }

    void validate(ContentRecord record) {
        var vec = record.vector();
        if (vec == null) {
            throw new InvalidDocumentException("missing or non-numeric vector");
        }
        if (vec.length != vectorSize) {
            throw new InvalidDocumentException(
                    "vector has dimension " + vec.length + ", expected " + vectorSize);
        }
        if (!VectorMath.isFinite(vec)) {
            throw new InvalidDocumentException("vector contains NaN or infinite components");
        }
    }

    /** Stores a record that already passed {@link #validate}. */
    StoredDocument add(ContentRecord record) {
        var payload = new LinkedHashMap<String, String>(record.payload());
        var doc = new StoredDocument(++lastId, VectorMath.normalize(record.vector()),
                Collections.unmodifiableMap(payload));
        documents.put(doc.id(), doc);
        return doc;
    }

    StoredDocument get(int id) {
        return documents.get(id);
    }

    Iterable<StoredDocument> all() {
        return documents.values();
    }

    Set<Integer> ids() {
        return Set.copyOf(documents.keySet());
    }

    int size() {
        return documents.size();
    }

    int vectorSize() {
        return vectorSize;
    }
}

package com.contentpool.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Brute-force cosine scan over every stored document. Stored vectors are
 * already unit length, so a dot product with the normalized query is the
 * cosine similarity.
 */
class VectorSearcher {

    private final DocumentStore store;

    VectorSearcher(DocumentStore store) {
        this.store = store;
    }

    List<VectorHit> search(float[] queryVector, int limit, Set<Integer> excludeIds) {
        if (queryVector == null || queryVector.length == 0 || limit <= 0) return List.of();
        if (queryVector.length != store.vectorSize()) {
            throw new DimensionMismatchException(store.vectorSize(), queryVector.length);
        }
        if (!VectorMath.isFinite(queryVector)) {
            throw new IllegalArgumentException("query vector contains NaN or infinite components");
        }
        var query = VectorMath.normalize(queryVector);

        var scored = new ArrayList<ScoredId>(store.size());
        for (var doc : store.all()) {
            if (excludeIds.contains(doc.id())) continue;
            scored.add(new ScoredId(doc.id(), VectorMath.dot(query, doc.vector())));
        }
        scored.sort(ScoredId.RANKING);

        var hits = new ArrayList<VectorHit>(Math.min(limit, scored.size()));
        for (var s : scored.subList(0, Math.min(limit, scored.size()))) {
            hits.add(new VectorHit(s.id(), s.score(), store.get(s.id()).payload()));
        }
        return hits;
    }
}

package com.contentpool.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reciprocal Rank Fusion of a vector ranking and a BM25 ranking. Both lists
 * are over-fetched by {@code fetchMultiplier} with the same exclusions, then
 * every id found in either list scores {@code sum(1 / (k + rank))}.
 */
class HybridSearcher {

    static final int DEFAULT_RRF_K = 60;
    static final int DEFAULT_FETCH_MULTIPLIER = 5;

    private final VectorSearcher vectorSearcher;
    private final KeywordSearcher keywordSearcher;
    private final DocumentStore store;
    private final int fetchMultiplier;

    HybridSearcher(VectorSearcher vectorSearcher, KeywordSearcher keywordSearcher,
                   DocumentStore store, int fetchMultiplier) {
        this.vectorSearcher = vectorSearcher;
        this.keywordSearcher = keywordSearcher;
        this.store = store;
        this.fetchMultiplier = fetchMultiplier;
    }

    List<HybridHit> search(float[] queryVector, String queryText, int limit, int rrfK,
                           Set<Integer> excludeIds) {
        if (limit <= 0) return List.of();
        int candidates = (int) Math.min(Integer.MAX_VALUE, (long) limit * fetchMultiplier);

        var vectorRanks = new LinkedHashMap<Integer, Integer>();
        var bm25Ranks = new LinkedHashMap<Integer, Integer>();

        // Vector search
        int rank = 1;
        for (var hit : vectorSearcher.search(queryVector, candidates, excludeIds)) {
            vectorRanks.put(hit.id(), rank++);
        }

        // BM25 keyword search
        for (var hit : keywordSearcher.search(queryText, candidates, excludeIds)) {
            bm25Ranks.put(hit.id(), hit.rank());
        }

        // RRF fusion
        Map<Integer, Double> fused = new HashMap<>();
        vectorRanks.forEach((id, r) -> fused.merge(id, 1.0 / (rrfK + r), Double::sum));
        bm25Ranks.forEach((id, r) -> fused.merge(id, 1.0 / (rrfK + r), Double::sum));
        if (fused.isEmpty()) return List.of();

        var scored = new ArrayList<ScoredId>(fused.size());
        fused.forEach((id, score) -> scored.add(new ScoredId(id, score)));
        scored.sort(ScoredId.RANKING);

        var hits = new ArrayList<HybridHit>(Math.min(limit, scored.size()));
        for (var s : scored.subList(0, Math.min(limit, scored.size()))) {
            hits.add(new HybridHit(s.id(), s.score(), store.get(s.id()).payload()));
        }
        return hits;
    }
}

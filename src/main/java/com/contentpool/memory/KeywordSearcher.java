package com.contentpool.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Set;

/**
 * Okapi BM25 over the {@link InvertedIndex}. Excluded documents are skipped
 * while scoring, before the result is cut to {@code limit}.
 */
class KeywordSearcher {

    private final DocumentStore store;
    private final InvertedIndex index;
    private final Tokenizer tokenizer;
    private final double k1;
    private final double b;

    KeywordSearcher(DocumentStore store, InvertedIndex index, Tokenizer tokenizer, double k1, double b) {
        this.store = store;
        this.index = index;
        this.tokenizer = tokenizer;
        this.k1 = k1;
        this.b = b;
    }

    List<KeywordHit> search(String queryText, int limit, Set<Integer> excludeIds) {
        if (limit <= 0 || index.totalDocs() == 0 || index.avgDocLength() == 0) return List.of();
        var queryTokens = tokenizer.tokenize(queryText);
        if (queryTokens.isEmpty()) return List.of();

        var scores = new HashMap<Integer, Double>();
        // repeated query terms are scored once per occurrence
        for (var token : queryTokens) {
            if (!index.contains(token)) continue;
            double idf = idf(token);
            for (int docId : index.postings(token)) {
                if (excludeIds.contains(docId)) continue;
                scores.merge(docId, idf * termWeight(docId, token), Double::sum);
            }
        }

        var ranked = new ArrayList<ScoredId>(scores.size());
        scores.forEach((id, score) -> ranked.add(new ScoredId(id, score)));
        ranked.sort(ScoredId.RANKING);

        int n = Math.min(limit, ranked.size());
        var hits = new ArrayList<KeywordHit>(n);
        for (int i = 0; i < n; i++) {
            var s = ranked.get(i);
            hits.add(new KeywordHit(s.id(), s.score(), i + 1, store.get(s.id()).payload()));
        }
        return hits;
    }

    double idf(String term) {
        int n = index.totalDocs();
        int df = index.documentFrequency(term);
        return Math.log((n - df + 0.5) / (df + 0.5) + 1.0);
    }

    private double termWeight(int docId, String term) {
        int tf = index.termFrequency(docId, term);
        double lengthNorm = 1 - b + b * index.docLength(docId) / index.avgDocLength();
        return tf * (k1 + 1) / (tf + k1 * lengthNorm);
    }
}

package com.contentpool.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Term statistics for BM25. Maintained additively: there is no removal path,
 * so postings, document frequencies and lengths only ever grow.
 */
class InvertedIndex {

    private final Map<String, List<Integer>> postings = new HashMap<>();
    private final Map<String, Integer> documentFrequencies = new HashMap<>();
    private final Map<Integer, Map<String, Integer>> termFrequencies = new HashMap<>();
    private final Map<Integer, Integer> docLengths = new HashMap<>();

    private int totalDocs = 0;
    private double avgDocLength = 0.0;

    void add(int docId, List<String> tokens) {
        docLengths.put(docId, tokens.size());
        var tf = new HashMap<String, Integer>();
        for (var token : tokens) {
            tf.merge(token, 1, Integer::sum);
        }
        termFrequencies.put(docId, tf);
        for (var token : new LinkedHashSet<>(tokens)) {
            documentFrequencies.merge(token, 1, Integer::sum);
            postings.computeIfAbsent(token, k -> new ArrayList<>()).add(docId);
        }
    }

    /** Recomputes corpus statistics over every indexed document. */
    void refreshStatistics() {
        totalDocs = docLengths.size();
        if (totalDocs == 0) {
            avgDocLength = 0.0;
            return;
        }
        long sum = 0;
        for (int len : docLengths.values()) {
            sum += len;
        }
        avgDocLength = (double) sum / totalDocs;
    }

    List<Integer> postings(String term) {
        return postings.getOrDefault(term, List.of());
    }

    boolean contains(String term) {
        return postings.containsKey(term);
    }

    int documentFrequency(String term) {
        return documentFrequencies.getOrDefault(term, 0);
    }

    int termFrequency(int docId, String term) {
        var tf = termFrequencies.get(docId);
        return tf == null ? 0 : tf.getOrDefault(term, 0);
    }

    int docLength(int docId) {
        return docLengths.getOrDefault(docId, 0);
    }

    int totalDocs() { return totalDocs; }

    double avgDocLength() { return avgDocLength; }

    int vocabularySize() { return postings.size(); }
}

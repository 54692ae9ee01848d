package com.contentpool.memory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InvertedIndexTest {

    private final InvertedIndex index = new InvertedIndex();

    @Test
    void countsTermOccurrencesAndDistinctDocuments() {
        index.add(1, List.of("python", "finance", "python"));
        index.add(2, List.of("python", "robot"));

        assertEquals(2, index.termFrequency(1, "python"));
        assertEquals(1, index.termFrequency(1, "finance"));
        assertEquals(0, index.termFrequency(2, "finance"));
        assertEquals(2, index.documentFrequency("python"));
        assertEquals(1, index.documentFrequency("finance"));
        assertEquals(List.of(1, 2), index.postings("python"));
    }

    @Test
    void docLengthCountsDuplicates() {
        index.add(1, List.of("a", "a", "b"));
        assertEquals(3, index.docLength(1));
    }

    @Test
    void documentFrequencyMatchesPostingsAndTermFrequencies() {
        index.add(1, List.of("a", "b", "a"));
        index.add(2, List.of("b", "c"));
        index.add(3, List.of("a", "c", "c"));

        for (var term : List.of("a", "b", "c")) {
            var postings = index.postings(term);
            assertEquals(postings.size(), postings.stream().distinct().count());
            assertEquals(index.documentFrequency(term), postings.size());
            long withTf = List.of(1, 2, 3).stream().filter(id -> index.termFrequency(id, term) > 0).count();
            assertEquals(withTf, index.documentFrequency(term));
        }
    }

    @Test
    void statisticsOnlyChangeOnRefresh() {
        index.add(1, List.of("a", "b"));
        assertEquals(0, index.totalDocs());

        index.refreshStatistics();
        assertEquals(1, index.totalDocs());
        assertEquals(2.0, index.avgDocLength());

        index.add(2, List.of("a", "b", "c", "d"));
        index.add(3, List.of());
        index.refreshStatistics();
        assertEquals(3, index.totalDocs());
        assertEquals(2.0, index.avgDocLength());
    }

    @Test
    void emptyIndexHasZeroStatistics() {
        index.refreshStatistics();
        assertEquals(0, index.totalDocs());
        assertEquals(0.0, index.avgDocLength());
        assertFalse(index.contains("anything"));
        assertTrue(index.postings("anything").isEmpty());
    }
}

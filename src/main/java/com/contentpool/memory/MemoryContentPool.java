package com.contentpool.memory;

import com.contentpool.observability.PoolMetrics;
import com.contentpool.shared.config.ContentPoolConfig;
import com.contentpool.shared.model.ContentRecord;
import com.contentpool.shared.model.InsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory hybrid search engine: brute-force cosine search over normalized
 * vectors, BM25 over an inverted index built from configured payload fields,
 * and Reciprocal Rank Fusion of the two.
 * <p>
 * The pool is append-only. Documents get increasing integer ids on insert and
 * can never be updated or removed. One read/write lock guards all state, so a
 * batch insert becomes visible to searches all at once.
 */
public class MemoryContentPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MemoryContentPool.class);

    private final ContentPoolConfig config;
    private final Tokenizer tokenizer;
    private final PoolMetrics metrics;

    private final DocumentStore store;
    private final InvertedIndex index = new InvertedIndex();
    private final VectorSearcher vectorSearcher;
    private final KeywordSearcher keywordSearcher;
    private final HybridSearcher hybridSearcher;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public MemoryContentPool(int vectorSize, List<String> textFields, Tokenizer tokenizer) {
        this(ContentPoolConfig.of(vectorSize, textFields), tokenizer, null);
    }

    public MemoryContentPool(int vectorSize, List<String> textFields, double bm25K1, double bm25B,
                             Tokenizer tokenizer) {
        this(new ContentPoolConfig(vectorSize, textFields, bm25K1, bm25B,
                HybridSearcher.DEFAULT_RRF_K, HybridSearcher.DEFAULT_FETCH_MULTIPLIER, null),
                tokenizer, null);
    }

    /**
     * @param metrics optional, may be null
     */
    public MemoryContentPool(ContentPoolConfig config, Tokenizer tokenizer, PoolMetrics metrics) {
        if (tokenizer == null) throw new IllegalArgumentException("tokenizer must not be null");
        this.config = config;
        this.tokenizer = tokenizer;
        this.metrics = metrics;
        this.store = new DocumentStore(config.vectorSize());
        this.vectorSearcher = new VectorSearcher(store);
        this.keywordSearcher = new KeywordSearcher(store, index, tokenizer, config.bm25K1(), config.bm25B());
        this.hybridSearcher = new HybridSearcher(vectorSearcher, keywordSearcher, store, config.fetchMultiplier());
    }

    public static MemoryContentPool fromConfig(ContentPoolConfig config) {
        return fromConfig(config, null);
    }

    public static MemoryContentPool fromConfig(ContentPoolConfig config, PoolMetrics metrics) {
        return new MemoryContentPool(config, config.createTokenizer(), metrics);
    }

    /**
     * Inserts a batch. Malformed records are skipped and reported; the rest of
     * the batch is stored. Every record is validated and tokenized before any
     * of them is stored, so a tokenizer failure leaves the pool untouched.
     * Corpus statistics are recomputed once, after the whole batch.
     */
    public InsertResult insert(List<ContentRecord> records) {
        if (records == null || records.isEmpty()) return InsertResult.empty();

        var pending = new ArrayList<PendingDocument>(records.size());
        var rejections = new ArrayList<String>();
        for (int i = 0; i < records.size(); i++) {
            var record = records.get(i);
            try {
                if (record == null) throw new InvalidDocumentException("record is null");
                store.validate(record);
                pending.add(new PendingDocument(record, tokenizer.tokenize(indexableText(record.payload()))));
            } catch (InvalidDocumentException e) {
                log.warn("Rejected record {} of batch: {}", i, e.getMessage());
                rejections.add("record " + i + ": " + e.getMessage());
            }
        }

        int total;
        lock.writeLock().lock();
        try {
            for (var p : pending) {
                var doc = store.add(p.record());
                index.add(doc.id(), p.tokens());
            }
            index.refreshStatistics();
            total = store.size();
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Inserted batch: {} accepted, {} rejected, {} total documents",
                pending.size(), rejections.size(), total);
        if (metrics != null) {
            metrics.documentsAccepted().increment(pending.size());
            metrics.documentsRejected().increment(rejections.size());
        }
        return new InsertResult(pending.size(), rejections.size(), List.copyOf(rejections));
    }

    public List<VectorHit> searchVector(float[] queryVector, int limit) {
        return searchVector(queryVector, limit, Set.of());
    }

    /**
     * @throws DimensionMismatchException if the query length differs from the configured vector size
     */
    public List<VectorHit> searchVector(float[] queryVector, int limit, Set<Integer> excludeIds) {
        return timed("vector", () -> read(() ->
                vectorSearcher.search(queryVector, limit, orEmpty(excludeIds))));
    }

    public List<KeywordHit> searchKeyword(String queryText, int limit) {
        return searchKeyword(queryText, limit, Set.of());
    }

    public List<KeywordHit> searchKeyword(String queryText, int limit, Set<Integer> excludeIds) {
        return timed("keyword", () -> read(() ->
                keywordSearcher.search(queryText, limit, orEmpty(excludeIds))));
    }

    public List<HybridHit> searchHybrid(float[] queryVector, String queryText, int limit) {
        return searchHybrid(queryVector, queryText, limit, config.rrfK(), Set.of());
    }

    public List<HybridHit> searchHybrid(float[] queryVector, String queryText, int limit,
                                        Set<Integer> excludeIds) {
        return searchHybrid(queryVector, queryText, limit, config.rrfK(), excludeIds);
    }

    /**
     * @throws DimensionMismatchException if the query length differs from the configured vector size
     */
    public List<HybridHit> searchHybrid(float[] queryVector, String queryText, int limit, int rrfK,
                                        Set<Integer> excludeIds) {
        if (rrfK < 0) throw new IllegalArgumentException("rrfK must be >= 0: " + rrfK);
        return timed("hybrid", () -> read(() -> {
            var hits = hybridSearcher.search(queryVector, queryText, limit, rrfK, orEmpty(excludeIds));
            log.debug("Hybrid search returned {} of limit {}", hits.size(), limit);
            return hits;
        }));
    }

    public Set<Integer> getAllIds() {
        return read(store::ids);
    }

    public int size() {
        return read(store::size);
    }

    public IndexStats stats() {
        return read(() -> new IndexStats(index.totalDocs(), index.avgDocLength(), index.vocabularySize()));
    }

    public int documentFrequency(String term) {
        return read(() -> index.documentFrequency(term));
    }

    public int termFrequency(int id, String term) {
        return read(() -> index.termFrequency(id, term));
    }

    public ContentPoolConfig config() {
        return config;
    }

    @Override
    public void close() {
        tokenizer.close();
    }

    private record PendingDocument(ContentRecord record, List<String> tokens) {}

    private String indexableText(Map<String, String> payload) {
        var text = new StringJoiner(" ");
        for (var field : config.textFields()) {
            var value = payload.get(field);
            text.add(value == null ? "" : value);
        }
        return text.toString();
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T timed(String mode, Supplier<T> action) {
        if (metrics == null) return action.get();
        return metrics.searchLatency(mode).record(action);
    }

    private static Set<Integer> orEmpty(Set<Integer> ids) {
        return ids == null ? Set.of() : ids;
    }
}

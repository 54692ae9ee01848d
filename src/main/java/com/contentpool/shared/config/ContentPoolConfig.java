package com.contentpool.shared.config;

import com.contentpool.memory.LuceneAnalyzerTokenizer;
import com.contentpool.memory.WhitespaceTokenizer;
import com.contentpool.memory.Tokenizer;

import java.util.List;

public record ContentPoolConfig(
    int vectorSize,
    List<String> textFields,
    double bm25K1,
    double bm25B,
    int rrfK,
    int fetchMultiplier,
    String tokenizer
) {
    public ContentPoolConfig {
        if (vectorSize <= 0) {
            throw new IllegalArgumentException("vector-size must be positive: " + vectorSize);
        }
        if (textFields == null) {
            throw new IllegalArgumentException("text-fields must not be null");
        }
        for (var field : textFields) {
            if (field == null) throw new IllegalArgumentException("text-fields must not contain null: " + textFields);
        }
        if (bm25K1 < 0) {
            throw new IllegalArgumentException("bm25 k1 must be >= 0: " + bm25K1);
        }
        if (bm25B < 0 || bm25B > 1) {
            throw new IllegalArgumentException("bm25 b must be within [0, 1]: " + bm25B);
        }
        if (rrfK < 0) {
            throw new IllegalArgumentException("rrf-k must be >= 0: " + rrfK);
        }
        if (fetchMultiplier < 1) {
            throw new IllegalArgumentException("fetch-multiplier must be >= 1: " + fetchMultiplier);
        }
        textFields = List.copyOf(textFields);
        if (tokenizer == null) tokenizer = "smartcn";
    }

    public static ContentPoolConfig defaults() {
        return new ContentPoolConfig(1024, List.of("title", "content"), 1.5, 0.75, 60, 5, "smartcn");
    }

    public static ContentPoolConfig of(int vectorSize, List<String> textFields) {
        var d = defaults();
        return new ContentPoolConfig(vectorSize, textFields, d.bm25K1(), d.bm25B(),
                d.rrfK(), d.fetchMultiplier(), d.tokenizer());
    }

    public Tokenizer createTokenizer() {
        return switch (tokenizer) {
            case "smartcn" -> LuceneAnalyzerTokenizer.smartChinese();
            case "standard" -> LuceneAnalyzerTokenizer.standard();
            case "whitespace" -> new WhitespaceTokenizer();
            default -> throw new IllegalArgumentException("Unknown tokenizer: " + tokenizer);
        };
    }
}

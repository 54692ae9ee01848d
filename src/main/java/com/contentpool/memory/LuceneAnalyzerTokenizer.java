package com.contentpool.memory;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.cn.smart.SmartChineseAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs text through a Lucene {@link Analyzer} and collects the emitted terms.
 * The analyzer is owned by this tokenizer and closed with it.
 */
public class LuceneAnalyzerTokenizer implements Tokenizer {

    private static final String FIELD = "content";

    private final Analyzer analyzer;

    public LuceneAnalyzerTokenizer(Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    // 中英文混排，按词典切分中文
    public static LuceneAnalyzerTokenizer smartChinese() {
        return new LuceneAnalyzerTokenizer(new SmartChineseAnalyzer());
    }

    public static LuceneAnalyzerTokenizer standard() {
        return new LuceneAnalyzerTokenizer(new StandardAnalyzer());
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        var tokens = new ArrayList<String>();
        try (var stream = analyzer.tokenStream(FIELD, text)) {
            var term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to analyze text", e);
        }
        return tokens;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}

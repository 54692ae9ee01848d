package com.contentpool.shared.config;

import com.contentpool.memory.LuceneAnalyzerTokenizer;
import com.contentpool.memory.WhitespaceTokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWhenFileMissing() {
        var cfg = ConfigLoader.load(tempDir.resolve("absent.yaml"));
        assertEquals(ContentPoolConfig.defaults().textFields(), cfg.textFields());
        assertEquals(1.5, cfg.bm25K1());
        assertEquals(0.75, cfg.bm25B());
        assertEquals(60, cfg.rrfK());
        assertEquals(5, cfg.fetchMultiplier());
    }

    @Test
    void defaultsWhenFileEmpty() throws IOException {
        var cfg = writeAndLoad("");
        assertEquals(60, cfg.rrfK());
        assertEquals(List.of("title", "content"), cfg.textFields());
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            pool:
              vector-size: 8
              text-fields: [title, summary, content]
            bm25:
              k1: 1.2
              b: 0.5
            hybrid:
              rrf-k: 30
              fetch-multiplier: 3
            tokenizer: whitespace
            """;
        var cfg = writeAndLoad(yaml);
        assertEquals(List.of("title", "summary", "content"), cfg.textFields());
        assertEquals(1.2, cfg.bm25K1());
        assertEquals(0.5, cfg.bm25B());
        assertEquals(30, cfg.rrfK());
        assertEquals(3, cfg.fetchMultiplier());
        assertThat(cfg.createTokenizer()).isInstanceOf(WhitespaceTokenizer.class);
    }

    @Test
    void partialConfigFallsBackToDefaults() throws IOException {
        var yaml = """
            bm25:
              k1: 2
            """;
        var cfg = writeAndLoad(yaml);
        assertEquals(2.0, cfg.bm25K1());
        // others should be defaults
        assertEquals(0.75, cfg.bm25B());
        assertEquals(5, cfg.fetchMultiplier());
    }

    @Test
    void invalidValuesAreRejected() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> writeAndLoad("bm25:\n  b: 1.5\n"));
        assertThrows(IllegalArgumentException.class, () -> writeAndLoad("hybrid:\n  fetch-multiplier: 0\n"));
        assertThrows(IllegalArgumentException.class, () -> writeAndLoad("pool:\n  vector-size: 0\n"));
    }

    @Test
    void nullTextFieldIsRejected() {
        var fields = Arrays.asList("title", null);
        var ex = assertThrows(IllegalArgumentException.class,
                () -> new ContentPoolConfig(4, fields, 1.5, 0.75, 60, 5, "whitespace"));
        assertThat(ex.getMessage()).contains("text-fields");
        assertThrows(IllegalArgumentException.class, () -> ContentPoolConfig.of(4, fields));
    }

    @Test
    void tokenizerNamesMapToImplementations() {
        var base = ContentPoolConfig.of(4, List.of("content"));
        try (var t = base.createTokenizer()) {
            assertThat(t).isInstanceOf(LuceneAnalyzerTokenizer.class);
        }
        var unknown = new ContentPoolConfig(4, List.of(), 1.5, 0.75, 60, 5, "nope");
        assertThrows(IllegalArgumentException.class, unknown::createTokenizer);
    }

    private ContentPoolConfig writeAndLoad(String yaml) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file);
    }
}

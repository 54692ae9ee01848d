package com.contentpool.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".contentpool", "config.yaml"
    );

    public static ContentPoolConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static ContentPoolConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var defaults = ContentPoolConfig.defaults();
        var pool = (Map<String, Object>) raw.getOrDefault("pool", Map.of());
        var bm25 = (Map<String, Object>) raw.getOrDefault("bm25", Map.of());
        var hybrid = (Map<String, Object>) raw.getOrDefault("hybrid", Map.of());

        var textFields = pool.containsKey("text-fields")
                ? ((List<?>) pool.get("text-fields")).stream().map(String::valueOf).toList()
                : defaults.textFields();

        return new ContentPoolConfig(
            Integer.parseInt(envOrDefault("CONTENTPOOL_VECTOR_SIZE",
                String.valueOf(pool.getOrDefault("vector-size", defaults.vectorSize())))),
            textFields,
            Double.parseDouble(String.valueOf(bm25.getOrDefault("k1", defaults.bm25K1()))),
            Double.parseDouble(String.valueOf(bm25.getOrDefault("b", defaults.bm25B()))),
            Integer.parseInt(String.valueOf(hybrid.getOrDefault("rrf-k", defaults.rrfK()))),
            Integer.parseInt(String.valueOf(hybrid.getOrDefault("fetch-multiplier", defaults.fetchMultiplier()))),
            envOrDefault("CONTENTPOOL_TOKENIZER",
                String.valueOf(raw.getOrDefault("tokenizer", defaults.tokenizer())))
        );
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}

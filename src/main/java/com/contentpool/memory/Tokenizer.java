package com.contentpool.memory;

import java.util.List;

/**
 * Splits text into an ordered sequence of terms. The same instance must be
 * used for ingestion and for keyword queries, otherwise query terms will not
 * line up with the indexed ones.
 */
public interface Tokenizer extends AutoCloseable {

    List<String> tokenize(String text);

    @Override
    default void close() {}
}

package com.contentpool.memory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WhitespaceTokenizerTest {

    private final WhitespaceTokenizer tokenizer = new WhitespaceTokenizer();

    @Test
    void lowercasesAndSplitsOnPunctuation() {
        assertEquals(List.of("python", "and", "finance", "2024"),
                tokenizer.tokenize("Python, and FINANCE (2024)!"));
    }

    @Test
    void keepsDuplicatesInOrder() {
        assertEquals(List.of("a", "b", "a"), tokenizer.tokenize("a b a"));
    }

    @Test
    void blankOrNullTextYieldsNoTokens() {
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("   ").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("!!! ---").isEmpty());
    }
}

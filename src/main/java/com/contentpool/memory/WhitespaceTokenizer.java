package com.contentpool.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class WhitespaceTokenizer implements Tokenizer {

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        var tokens = new ArrayList<String>();
        for (var token : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) tokens.add(token);
        }
        return tokens;
    }
}

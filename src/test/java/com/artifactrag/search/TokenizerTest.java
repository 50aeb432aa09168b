package com.artifactrag.search;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TokenizerTest {

    @Test
    void lowercasesAndSplitsOnNonWordCharacters() {
        assertEquals(List.of("hello", "world", "42", "snake_case"), Tokenizer.tokenize("Hello, WORLD! 42 snake_case"));
    }

    @Test
    void keepsUnicodeLetters() {
        assertEquals(List.of("café", "über", "naïve"), Tokenizer.tokenize("Café Über-naïve"));
    }

    @Test
    void blankInputHasNoTokens() {
        assertEquals(List.of(), Tokenizer.tokenize("  ... "));
        assertEquals(List.of(), Tokenizer.tokenize(null));
    }
}

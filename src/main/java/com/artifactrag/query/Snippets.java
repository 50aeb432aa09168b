package com.artifactrag.query;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.artifactrag.search.Tokenizer;

final class Snippets {
    static final int WINDOW = 200;

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private Snippets() {
    }

    /** Query tokens that also occur in {@code text}, sorted and without duplicates. */
    static List<String> matchedTerms(List<String> queryTokens, String text) {
        Set<String> chunkTokens = Set.copyOf(Tokenizer.tokenize(text));
        Set<String> matched = new TreeSet<>();
        for (String token : queryTokens) {
            if (chunkTokens.contains(token)) {
                matched.add(token);
            }
        }
        return List.copyOf(matched);
    }

    /** About {@link #WINDOW} characters around the first matched word, marked with "..." where cut. */
    static String around(String text, Set<String> terms) {
        if (text.isEmpty()) {
            return "";
        }
        int hit = 0;
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            if (terms.contains(matcher.group().toLowerCase(Locale.ROOT))) {
                hit = matcher.start();
                break;
            }
        }
        int start = Math.max(0, hit - WINDOW / 4);
        int end = Math.min(text.length(), start + WINDOW);
        start = Math.max(0, Math.min(start, end - WINDOW));
        String snippet = text.substring(start, end).replaceAll("\\s+", " ").strip();
        if (start > 0) {
            snippet = "..." + snippet;
        }
        if (end < text.length()) {
            snippet = snippet + "...";
        }
        return snippet;
    }
}

package com.artifactrag.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Accumulates postings chunk by chunk during a build. */
public final class LexicalIndexBuilder {
    private final double k1;
    private final double b;
    private final List<String> chunkIds = new ArrayList<>();
    private int[] chunkLengths = new int[64];
    private final Map<String, Accumulator> postings = new TreeMap<>();
    private long totalLength;

    public LexicalIndexBuilder(double k1, double b) {
        this.k1 = k1;
        this.b = b;
    }

    public void add(String chunkId, String text) {
        List<String> tokens = Tokenizer.tokenize(text);
        int ordinal = chunkIds.size();
        chunkIds.add(chunkId);
        if (ordinal == chunkLengths.length) {
            chunkLengths = Arrays.copyOf(chunkLengths, ordinal * 2);
        }
        chunkLengths[ordinal] = tokens.size();
        totalLength += tokens.size();

        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String token : tokens) {
            frequencies.merge(token, 1, Integer::sum);
        }
        frequencies.forEach((token, tf) -> postings.computeIfAbsent(token, unused -> new Accumulator()).add(ordinal, tf));
    }

    public int size() {
        return chunkIds.size();
    }

    public LexicalIndex build() {
        int count = chunkIds.size();
        double avgLength = count == 0 ? 0.0 : (double) totalLength / count;
        Map<String, Postings> built = new TreeMap<>();
        postings.forEach((token, accumulator) -> built.put(token, accumulator.toPostings()));
        return new LexicalIndex(k1, b, List.copyOf(chunkIds), Arrays.copyOf(chunkLengths, count), avgLength, built);
    }

    private static final class Accumulator {
        private int[] chunks = new int[4];
        private int[] frequencies = new int[4];
        private int size;

        void add(int ordinal, int tf) {
            if (size == chunks.length) {
                chunks = Arrays.copyOf(chunks, size * 2);
                frequencies = Arrays.copyOf(frequencies, size * 2);
            }
            chunks[size] = ordinal;
            frequencies[size] = tf;
            size++;
        }

        Postings toPostings() {
            return new Postings(Arrays.copyOf(chunks, size), Arrays.copyOf(frequencies, size));
        }
    }
}

package com.artifactrag.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.artifactrag.build.ChunkSpan;

/**
 * Word-window chunking. Each span covers up to {@code chunkSize} whitespace-delimited words and the
 * next one starts {@code overlap} words before the previous end. Spans run from the first character
 * of their first word to the last character of their last word, so they are exact slices of the
 * text they were computed from.
 */
public class FixedSizeChunker {
    private static final Pattern WORD = Pattern.compile("\\S+");

    private final int chunkSize;
    private final int overlap;

    public FixedSizeChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, was " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, chunkSize), was " + overlap);
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<ChunkSpan> chunk(String normalizedText) {
        List<int[]> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(normalizedText);
        while (matcher.find()) {
            words.add(new int[] { matcher.start(), matcher.end() });
        }

        List<ChunkSpan> spans = new ArrayList<>();
        int start = 0;
        while (start < words.size()) {
            int endExclusive = Math.min(words.size(), start + chunkSize);
            spans.add(new ChunkSpan(words.get(start)[0], words.get(endExclusive - 1)[1]));
            if (endExclusive == words.size()) {
                break;
            }
            start = Math.max(endExclusive - overlap, start + 1);
        }
        return spans;
    }
}

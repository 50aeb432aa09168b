package com.artifactrag.search;

import java.util.Comparator;

public record ScoredChunk(String chunkId, double score) {
    /** Best first: higher score, then ascending chunk id. */
    public static final Comparator<ScoredChunk> RANKING = Comparator.comparingDouble(ScoredChunk::score).reversed()
            .thenComparing(ScoredChunk::chunkId);
}

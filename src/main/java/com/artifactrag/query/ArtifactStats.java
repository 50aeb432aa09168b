package com.artifactrag.query;

import java.util.Map;

public record ArtifactStats(
        String schemaVersion,
        int totalDocs,
        int totalChunks,
        int activeChunks,
        int vocabularySize,
        double avgChunkLength,
        Map<String, Long> fileSizes,
        long coldStartMillis) {

    public ArtifactStats {
        fileSizes = Map.copyOf(fileSizes);
    }

    public long totalBytes() {
        return fileSizes.values().stream().mapToLong(Long::longValue).sum();
    }
}

package com.artifactrag.build;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

public record BuildReport(
        Path destination,
        List<String> docIds,
        List<String> chunkIds,
        int activeChunks,
        Map<String, String> checksums,
        Duration elapsed) {

    public BuildReport {
        docIds = List.copyOf(docIds);
        chunkIds = List.copyOf(chunkIds);
        checksums = Map.copyOf(checksums);
    }

    public int totalDocs() {
        return docIds.size();
    }

    public int totalChunks() {
        return chunkIds.size();
    }
}

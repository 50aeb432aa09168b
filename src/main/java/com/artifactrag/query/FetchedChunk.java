package com.artifactrag.query;

import com.artifactrag.store.ChunkRecord;

public record FetchedChunk(ChunkRecord record, String text, String sourcePath, String title) {
    public String chunkId() {
        return record.chunkId();
    }
}

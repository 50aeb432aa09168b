package com.artifactrag.query;

import java.util.Objects;

import com.artifactrag.store.ChunkFetchException;

/**
 * Outcome for one id of a batched fetch: either a chunk or the reason it could not be served.
 */
public record FetchResult(String chunkId, FetchedChunk chunk, ChunkFetchException.Reason failure, String message) {
    public static FetchResult success(FetchedChunk chunk) {
        return new FetchResult(chunk.chunkId(), chunk, null, null);
    }

    public static FetchResult failure(ChunkFetchException error) {
        Objects.requireNonNull(error, "error");
        return new FetchResult(error.chunkId(), null, error.reason(), error.getMessage());
    }

    public boolean isSuccess() {
        return chunk != null;
    }
}

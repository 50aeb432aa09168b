package com.artifactrag.store;

import java.io.IOException;

/** Failure to fetch a single chunk. Batched fetches report it per id instead of throwing. */
public class ChunkFetchException extends IOException {
    public enum Reason {
        UNKNOWN_CHUNK_ID,
        TOMBSTONED,
        DECOMPRESSION_FAILURE,
        CHECKSUM_MISMATCH,
        READ_FAILURE
    }

    private final String chunkId;
    private final Reason reason;

    public ChunkFetchException(String chunkId, Reason reason, String message) {
        super(message);
        this.chunkId = chunkId;
        this.reason = reason;
    }

    public ChunkFetchException(String chunkId, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.chunkId = chunkId;
        this.reason = reason;
    }

    public String chunkId() {
        return chunkId;
    }

    public Reason reason() {
        return reason;
    }
}

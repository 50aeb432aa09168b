package com.artifactrag.build;

/**
 * Half-open character range {@code [start, end)} of a document's normalized text. An inactive span
 * is stored as a tombstone: written to the chunk store, never indexed or served.
 */
public record ChunkSpan(int start, int end, boolean active) {
    public ChunkSpan(int start, int end) {
        this(start, end, true);
    }
}

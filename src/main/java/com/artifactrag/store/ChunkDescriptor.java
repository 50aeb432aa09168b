package com.artifactrag.store;

/** Everything the writer needs about a chunk besides its text and placement in the data file. */
public record ChunkDescriptor(
        String chunkId,
        String docUid,
        String docId,
        int offsetStart,
        int offsetEnd,
        int chunkIndex,
        Integer pageStart,
        Integer pageEnd,
        boolean active) {
}

package com.artifactrag.store;

/**
 * One fixed-shape entry of {@code chunks.idx}. {@code storeOffset}/{@code length} cover the whole
 * block in {@code chunks.bin}; {@code checksum} is the CRC32 of the uncompressed UTF-8 text.
 * Character offsets are half-open into the owning document's normalized text.
 */
public record ChunkRecord(
        String chunkId,
        String docUid,
        String docId,
        long storeOffset,
        int length,
        int checksum,
        int offsetStart,
        int offsetEnd,
        int chunkIndex,
        Integer pageStart,
        Integer pageEnd,
        boolean active) {

    public long storeEnd() {
        return storeOffset + length;
    }

    public boolean hasPageRange() {
        return pageStart != null && pageEnd != null;
    }
}

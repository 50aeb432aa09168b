package com.artifactrag.store;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import com.artifactrag.core.ArtifactFiles;

/**
 * Append-only writer for {@code chunks.bin} and {@code chunks.idx}. Used only while building into a
 * staging directory; both files are created fresh and never rewritten in place.
 */
public final class ChunkStoreWriter implements Closeable {
    private final DataOutputStream data;
    private final DataOutputStream index;
    private final int compressionLevel;
    private final Set<String> writtenIds = new HashSet<>();
    private long dataPosition;
    private boolean closed;

    private ChunkStoreWriter(DataOutputStream data, DataOutputStream index, int compressionLevel) {
        this.data = data;
        this.index = index;
        this.compressionLevel = compressionLevel;
    }

    public static ChunkStoreWriter create(Path directory, int compressionLevel) throws IOException {
        if (compressionLevel < 0 || compressionLevel > 9) {
            throw new IllegalArgumentException("compression level must be in [0, 9], was " + compressionLevel);
        }
        Files.createDirectories(directory);
        DataOutputStream data = open(directory.resolve(ArtifactFiles.CHUNKS_BIN));
        DataOutputStream index;
        try {
            index = open(directory.resolve(ArtifactFiles.CHUNKS_IDX));
        } catch (IOException e) {
            data.close();
            throw e;
        }
        ChunkStoreWriter writer = new ChunkStoreWriter(data, index, compressionLevel);
        ChunkStoreFormat.writeHeader(data, ChunkStoreFormat.DATA_MAGIC);
        ChunkStoreFormat.writeHeader(index, ChunkStoreFormat.INDEX_MAGIC);
        writer.dataPosition = ChunkStoreFormat.HEADER_SIZE;
        return writer;
    }

    /**
     * Compresses {@code text} into a new block at the end of the data file and appends the matching
     * index record. Records come back in strictly increasing store-offset order.
     */
    public ChunkRecord append(ChunkDescriptor chunk, String text) throws IOException {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(text, "text");
        if (closed) {
            throw new IllegalStateException("writer is closed");
        }
        if (!writtenIds.add(chunk.chunkId())) {
            throw new IllegalArgumentException("duplicate chunk id " + chunk.chunkId());
        }

        byte[] payload = text.getBytes(StandardCharsets.UTF_8);
        byte[] compressed = ChunkStoreFormat.compress(payload, compressionLevel);
        int checksum = ChunkStoreFormat.crc32(payload);

        long storeOffset = dataPosition;
        data.write(ChunkStoreFormat.idBytes(chunk.chunkId()));
        data.writeInt(compressed.length);
        data.write(compressed);
        data.writeInt(checksum);
        int length = ChunkStoreFormat.BLOCK_OVERHEAD + compressed.length;
        dataPosition += length;

        ChunkRecord record = new ChunkRecord(
                chunk.chunkId(),
                chunk.docUid(),
                chunk.docId(),
                storeOffset,
                length,
                checksum,
                chunk.offsetStart(),
                chunk.offsetEnd(),
                chunk.chunkIndex(),
                chunk.pageStart(),
                chunk.pageEnd(),
                chunk.active());
        ChunkStoreFormat.writeRecord(index, record);
        return record;
    }

    public long dataSize() {
        return dataPosition;
    }

    public int recordCount() {
        return writtenIds.size();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            data.close();
        } finally {
            index.close();
        }
    }

    private static DataOutputStream open(Path path) throws IOException {
        return new DataOutputStream(new BufferedOutputStream(
                Files.newOutputStream(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)));
    }
}

package com.artifactrag.store;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.artifactrag.core.ArtifactFiles;
import com.artifactrag.manifest.ArtifactException;

/**
 * Read side of the chunk store. The whole index is held in memory keyed by chunk id; the data file
 * is only read through positional reads, so concurrent fetches need no locking.
 */
public final class ChunkStoreReader implements Closeable {
    private final Map<String, ChunkRecord> records;
    private final FileChannel dataChannel;
    private final long dataSize;
    private final String dataHeaderProblem;

    private ChunkStoreReader(Map<String, ChunkRecord> records, FileChannel dataChannel, long dataSize, String dataHeaderProblem) {
        this.records = records;
        this.dataChannel = dataChannel;
        this.dataSize = dataSize;
        this.dataHeaderProblem = dataHeaderProblem;
    }

    /**
     * Opens the store. A damaged {@code chunks.bin} header does not fail the open: blocks carry their
     * own id and checksum, so it is reported through {@link #dataHeaderProblem()} and left to the
     * caller's validation mode.
     */
    public static ChunkStoreReader open(Path directory) throws IOException {
        Map<String, ChunkRecord> records = loadIndex(directory.resolve(ArtifactFiles.CHUNKS_IDX));
        Path dataFile = directory.resolve(ArtifactFiles.CHUNKS_BIN);
        FileChannel channel;
        try {
            channel = FileChannel.open(dataFile, StandardOpenOption.READ);
        } catch (NoSuchFileException e) {
            throw new ArtifactException(ArtifactException.Reason.NOT_FOUND, "missing " + dataFile, e);
        }
        try {
            long size = channel.size();
            String problem;
            if (size < ChunkStoreFormat.HEADER_SIZE) {
                problem = "truncated header of " + size + " bytes";
            } else {
                ByteBuffer header = ByteBuffer.allocate(ChunkStoreFormat.HEADER_SIZE);
                readFully(channel, header, 0);
                header.flip();
                problem = ChunkStoreFormat.checkHeader(header, ChunkStoreFormat.DATA_MAGIC);
            }
            return new ChunkStoreReader(records, channel, size, problem == null ? null : dataFile.getFileName() + ": " + problem);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "unreadable " + dataFile.getFileName(), e);
        }
    }

    public Optional<ChunkRecord> record(String chunkId) {
        return Optional.ofNullable(records.get(chunkId));
    }

    /** All records, tombstoned ones included, in store order. */
    public Collection<ChunkRecord> records() {
        return records.values();
    }

    public boolean isActive(String chunkId) {
        ChunkRecord record = records.get(chunkId);
        return record != null && record.active();
    }

    public long dataSize() {
        return dataSize;
    }

    /** Why the data file header failed to parse, if it did. */
    public Optional<String> dataHeaderProblem() {
        return Optional.ofNullable(dataHeaderProblem);
    }

    /**
     * Reads and decompresses one chunk.
     *
     * @param verifyChecksum compare the CRC32 of the decompressed text with the block and index values
     */
    public String fetch(String chunkId, boolean verifyChecksum) throws ChunkFetchException {
        ChunkRecord record = records.get(chunkId);
        if (record == null) {
            throw new ChunkFetchException(chunkId, ChunkFetchException.Reason.UNKNOWN_CHUNK_ID, "unknown chunk id " + chunkId);
        }
        if (!record.active()) {
            throw new ChunkFetchException(chunkId, ChunkFetchException.Reason.TOMBSTONED, "chunk " + chunkId + " is tombstoned");
        }
        return new String(readPayload(record, verifyChecksum), StandardCharsets.UTF_8);
    }

    /** Reads the block behind {@code record} regardless of its active flag. */
    public byte[] readPayload(ChunkRecord record, boolean verifyChecksum) throws ChunkFetchException {
        String chunkId = record.chunkId();
        if (record.length() < ChunkStoreFormat.BLOCK_OVERHEAD
                || record.storeOffset() < ChunkStoreFormat.HEADER_SIZE
                || record.storeEnd() > dataSize) {
            throw new ChunkFetchException(chunkId, ChunkFetchException.Reason.DECOMPRESSION_FAILURE,
                    "block [" + record.storeOffset() + ", " + record.storeEnd() + ") outside data file of " + dataSize + " bytes");
        }

        ByteBuffer block = ByteBuffer.allocate(record.length());
        try {
            readFully(dataChannel, block, record.storeOffset());
        } catch (IOException e) {
            throw new ChunkFetchException(chunkId, ChunkFetchException.Reason.READ_FAILURE, "failed to read block for " + chunkId, e);
        }
        block.flip();

        byte[] idBytes = new byte[ChunkStoreFormat.ID_BYTES];
        block.get(idBytes);
        int compressedLength = block.getInt();
        if (!Arrays.equals(idBytes, chunkId.getBytes(StandardCharsets.US_ASCII))
                || compressedLength != record.length() - ChunkStoreFormat.BLOCK_OVERHEAD) {
            throw new ChunkFetchException(chunkId, ChunkFetchException.Reason.DECOMPRESSION_FAILURE,
                    "block header at offset " + record.storeOffset() + " does not belong to " + chunkId);
        }
        byte[] compressed = new byte[compressedLength];
        block.get(compressed);
        int blockChecksum = block.getInt();

        byte[] payload;
        try {
            payload = ChunkStoreFormat.decompress(compressed);
        } catch (IOException e) {
            throw new ChunkFetchException(chunkId, ChunkFetchException.Reason.DECOMPRESSION_FAILURE,
                    "cannot decompress chunk " + chunkId, e);
        }
        if (verifyChecksum) {
            int actual = ChunkStoreFormat.crc32(payload);
            if (actual != record.checksum() || actual != blockChecksum) {
                throw new ChunkFetchException(chunkId, ChunkFetchException.Reason.CHECKSUM_MISMATCH,
                        String.format("checksum mismatch for %s: index=%08x block=%08x actual=%08x",
                                chunkId, record.checksum(), blockChecksum, actual));
            }
        }
        return payload;
    }

    @Override
    public void close() throws IOException {
        dataChannel.close();
    }

    private static Map<String, ChunkRecord> loadIndex(Path indexFile) throws ArtifactException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(indexFile);
        } catch (NoSuchFileException e) {
            throw new ArtifactException(ArtifactException.Reason.NOT_FOUND, "missing " + indexFile, e);
        } catch (IOException e) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "unreadable " + indexFile, e);
        }

        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        String problem = ChunkStoreFormat.checkHeader(buffer, ChunkStoreFormat.INDEX_MAGIC);
        if (problem != null) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, indexFile.getFileName() + ": " + problem);
        }
        if (buffer.remaining() % ChunkStoreFormat.RECORD_SIZE != 0) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT,
                    indexFile.getFileName() + ": trailing partial record of " + (buffer.remaining() % ChunkStoreFormat.RECORD_SIZE) + " bytes");
        }

        Map<String, ChunkRecord> records = new LinkedHashMap<>();
        long previousOffset = -1;
        while (buffer.hasRemaining()) {
            ChunkRecord record;
            try {
                record = ChunkStoreFormat.readRecord(buffer);
            } catch (IllegalArgumentException e) {
                throw new ArtifactException(ArtifactException.Reason.CORRUPT,
                        indexFile.getFileName() + ": record " + records.size() + ": " + e.getMessage(), e);
            }
            if (record.storeOffset() <= previousOffset) {
                throw new ArtifactException(ArtifactException.Reason.CORRUPT,
                        indexFile.getFileName() + ": store offsets not strictly increasing at " + record.chunkId());
            }
            if (records.putIfAbsent(record.chunkId(), record) != null) {
                throw new ArtifactException(ArtifactException.Reason.CORRUPT,
                        indexFile.getFileName() + ": duplicate chunk id " + record.chunkId());
            }
            previousOffset = record.storeOffset();
        }
        return Collections.unmodifiableMap(records);
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position + buffer.position());
            if (read < 0) {
                throw new EOFException("unexpected end of file at " + (position + buffer.position()));
            }
        }
    }
}

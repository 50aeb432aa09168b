package com.artifactrag.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.artifactrag.core.ArtifactFiles;
import com.artifactrag.core.ArtifactIds;
import com.artifactrag.core.Hashing;
import com.artifactrag.manifest.ArtifactException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkStoreTest {

    private static final String DOC_UID = ArtifactIds.docUid("store/doc.txt");
    private static final String DOC_ID = ArtifactIds.docId(DOC_UID, Hashing.sha256Hex("whatever"));

    @TempDir
    Path tempDir;

    @Test
    void fetchReturnsTheAppendedTextForActiveChunks() throws IOException {
        List<ChunkRecord> written = writeStore(List.of("first chunk", "second chunk with ünïcödé", "third"), List.of(true, true, true));

        try (ChunkStoreReader reader = ChunkStoreReader.open(tempDir)) {
            assertEquals(3, reader.records().size());
            assertEquals("first chunk", reader.fetch(written.get(0).chunkId(), true));
            assertEquals("second chunk with ünïcödé", reader.fetch(written.get(1).chunkId(), true));
            assertEquals("third", reader.fetch(written.get(2).chunkId(), false));
            assertEquals(written.get(1), reader.record(written.get(1).chunkId()).orElseThrow());
            assertEquals(reader.dataSize(), written.get(2).storeEnd());
        }
    }

    @Test
    void appendedRecordsHaveStrictlyIncreasingOffsets() throws IOException {
        List<ChunkRecord> written = writeStore(List.of("a", "bb", "ccc"), List.of(true, true, true));

        assertEquals(ChunkStoreFormat.HEADER_SIZE, written.get(0).storeOffset());
        for (int i = 1; i < written.size(); i++) {
            assertEquals(written.get(i - 1).storeEnd(), written.get(i).storeOffset());
        }
    }

    @Test
    void tombstonedChunkKeepsItsBytesButCannotBeFetched() throws IOException {
        List<ChunkRecord> written = writeStore(List.of("live", "retired"), List.of(true, false));

        try (ChunkStoreReader reader = ChunkStoreReader.open(tempDir)) {
            String retired = written.get(1).chunkId();
            assertFalse(reader.isActive(retired));
            ChunkFetchException error = assertThrows(ChunkFetchException.class, () -> reader.fetch(retired, true));
            assertEquals(ChunkFetchException.Reason.TOMBSTONED, error.reason());
            assertEquals("retired", new String(reader.readPayload(written.get(1), true), StandardCharsets.UTF_8));
        }
    }

    @Test
    void unknownIdIsReported() throws IOException {
        writeStore(List.of("only"), List.of(true));

        try (ChunkStoreReader reader = ChunkStoreReader.open(tempDir)) {
            ChunkFetchException error = assertThrows(ChunkFetchException.class, () -> reader.fetch("0000000000000000", false));
            assertEquals(ChunkFetchException.Reason.UNKNOWN_CHUNK_ID, error.reason());
            assertEquals("0000000000000000", error.chunkId());
        }
    }

    @Test
    void corruptedCrcIsOnlyDetectedWhenVerifying() throws IOException {
        List<ChunkRecord> written = writeStore(List.of("payload under test"), List.of(true));
        ChunkRecord record = written.get(0);
        flipByte(tempDir.resolve(ArtifactFiles.CHUNKS_BIN), record.storeEnd() - 1);

        try (ChunkStoreReader reader = ChunkStoreReader.open(tempDir)) {
            assertEquals("payload under test", reader.fetch(record.chunkId(), false));
            ChunkFetchException error = assertThrows(ChunkFetchException.class, () -> reader.fetch(record.chunkId(), true));
            assertEquals(ChunkFetchException.Reason.CHECKSUM_MISMATCH, error.reason());
        }
    }

    @Test
    void blockHeaderNotMatchingTheRecordIsRejected() throws IOException {
        List<ChunkRecord> written = writeStore(List.of("payload"), List.of(true));
        ChunkRecord record = written.get(0);
        flipByte(tempDir.resolve(ArtifactFiles.CHUNKS_BIN), record.storeOffset() + ChunkStoreFormat.ID_BYTES);

        try (ChunkStoreReader reader = ChunkStoreReader.open(tempDir)) {
            ChunkFetchException error = assertThrows(ChunkFetchException.class, () -> reader.fetch(record.chunkId(), false));
            assertEquals(ChunkFetchException.Reason.DECOMPRESSION_FAILURE, error.reason());
        }
    }

    @Test
    void trailingPartialIndexRecordIsCorrupt() throws IOException {
        writeStore(List.of("payload"), List.of(true));
        Files.write(tempDir.resolve(ArtifactFiles.CHUNKS_IDX), new byte[] { 1, 2, 3 }, StandardOpenOption.APPEND);

        ArtifactException error = assertThrows(ArtifactException.class, () -> ChunkStoreReader.open(tempDir));
        assertEquals(ArtifactException.Reason.CORRUPT, error.reason());
    }

    @Test
    void badDataMagicIsReportedWhileBlocksStayReadable() throws IOException {
        List<ChunkRecord> written = writeStore(List.of("payload"), List.of(true));
        flipByte(tempDir.resolve(ArtifactFiles.CHUNKS_BIN), 0);

        try (ChunkStoreReader reader = ChunkStoreReader.open(tempDir)) {
            assertTrue(reader.dataHeaderProblem().orElseThrow().contains("magic"));
            assertEquals("payload", reader.fetch(written.get(0).chunkId(), true));
        }
    }

    @Test
    void cleanStoreHasNoHeaderProblem() throws IOException {
        writeStore(List.of("payload"), List.of(true));

        try (ChunkStoreReader reader = ChunkStoreReader.open(tempDir)) {
            assertTrue(reader.dataHeaderProblem().isEmpty());
        }
    }

    @Test
    void badIndexMagicIsCorrupt() throws IOException {
        writeStore(List.of("payload"), List.of(true));
        flipByte(tempDir.resolve(ArtifactFiles.CHUNKS_IDX), 0);

        ArtifactException error = assertThrows(ArtifactException.class, () -> ChunkStoreReader.open(tempDir));
        assertEquals(ArtifactException.Reason.CORRUPT, error.reason());
    }

    @Test
    void missingDataFileIsNotFound() throws IOException {
        writeStore(List.of("payload"), List.of(true));
        Files.delete(tempDir.resolve(ArtifactFiles.CHUNKS_BIN));

        ArtifactException error = assertThrows(ArtifactException.class, () -> ChunkStoreReader.open(tempDir));
        assertEquals(ArtifactException.Reason.NOT_FOUND, error.reason());
    }

    @Test
    void writerRejectsDuplicateIds() throws IOException {
        try (ChunkStoreWriter writer = ChunkStoreWriter.create(tempDir, 6)) {
            ChunkDescriptor descriptor = descriptor("same text", 0, true);
            writer.append(descriptor, "same text");
            assertThrows(IllegalArgumentException.class, () -> writer.append(descriptor, "same text"));
        }
    }

    @Test
    void pageRangeSurvivesTheIndex() throws IOException {
        ChunkDescriptor withPages = new ChunkDescriptor(
                ArtifactIds.chunkId(DOC_UID, 0, 5, "paged"), DOC_UID, DOC_ID, 0, 5, 0, 2, 3, true);
        ChunkDescriptor withoutPages = descriptor("plain", 1, true);
        try (ChunkStoreWriter writer = ChunkStoreWriter.create(tempDir, 0)) {
            writer.append(withPages, "paged");
            writer.append(withoutPages, "plain");
        }

        try (ChunkStoreReader reader = ChunkStoreReader.open(tempDir)) {
            ChunkRecord paged = reader.record(withPages.chunkId()).orElseThrow();
            assertTrue(paged.hasPageRange());
            assertEquals(2, paged.pageStart());
            assertEquals(3, paged.pageEnd());
            assertNull(reader.record(withoutPages.chunkId()).orElseThrow().pageStart());
        }
    }

    private List<ChunkRecord> writeStore(List<String> texts, List<Boolean> active) throws IOException {
        List<ChunkRecord> written = new ArrayList<>();
        try (ChunkStoreWriter writer = ChunkStoreWriter.create(tempDir, 6)) {
            for (int i = 0; i < texts.size(); i++) {
                written.add(writer.append(descriptor(texts.get(i), i, active.get(i)), texts.get(i)));
            }
        }
        return written;
    }

    private static ChunkDescriptor descriptor(String text, int index, boolean active) {
        int start = index * 100;
        int end = start + text.length();
        return new ChunkDescriptor(ArtifactIds.chunkId(DOC_UID, start, end, text), DOC_UID, DOC_ID, start, end, index, null, null, active);
    }

    static void flipByte(Path file, long position) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        bytes[(int) position] ^= 0x5A;
        Files.write(file, bytes);
    }
}

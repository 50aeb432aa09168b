package com.artifactrag.store;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutput;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

import com.artifactrag.core.ArtifactIds;

/**
 * Binary layout shared by the chunk store writer and reader. All integers are big-endian.
 *
 * <pre>
 * chunks.bin  = header block*
 * header      = magic:int version:int
 * block       = chunk_id:16 ascii, compressed_len:int, compressed bytes (zlib), crc32:int
 *
 * chunks.idx  = header record*
 * record      = chunk_id:16 doc_uid:16 doc_id:16 store_offset:long length:int checksum:int
 *               offset_start:long offset_end:long chunk_index:int page_start:int page_end:int
 *               is_active:byte
 * </pre>
 *
 * A page bound of {@code -1} means "no page".
 */
public final class ChunkStoreFormat {
    public static final int DATA_MAGIC = 0x5242494E; // "RBIN"
    public static final int INDEX_MAGIC = 0x52494458; // "RIDX"
    public static final int FORMAT_VERSION = 1;
    public static final int HEADER_SIZE = 8;

    public static final int ID_BYTES = ArtifactIds.ID_LENGTH;
    public static final int BLOCK_OVERHEAD = ID_BYTES + Integer.BYTES + Integer.BYTES;
    public static final int RECORD_SIZE = 3 * ID_BYTES
            + Long.BYTES + Integer.BYTES + Integer.BYTES
            + Long.BYTES + Long.BYTES
            + Integer.BYTES + Integer.BYTES + Integer.BYTES
            + 1;

    private static final int NO_PAGE = -1;

    private ChunkStoreFormat() {
    }

    public static void writeHeader(DataOutput out, int magic) throws IOException {
        out.writeInt(magic);
        out.writeInt(FORMAT_VERSION);
    }

    /** Returns a description of what is wrong with the header, or {@code null} when it is valid. */
    static String checkHeader(ByteBuffer header, int expectedMagic) {
        if (header.remaining() < HEADER_SIZE) {
            return "file shorter than header";
        }
        int magic = header.getInt();
        int version = header.getInt();
        if (magic != expectedMagic) {
            return String.format("bad magic 0x%08X", magic);
        }
        if (version != FORMAT_VERSION) {
            return "unsupported format version " + version;
        }
        return null;
    }

    public static void writeRecord(DataOutput out, ChunkRecord record) throws IOException {
        out.write(idBytes(record.chunkId()));
        out.write(idBytes(record.docUid()));
        out.write(idBytes(record.docId()));
        out.writeLong(record.storeOffset());
        out.writeInt(record.length());
        out.writeInt(record.checksum());
        out.writeLong(record.offsetStart());
        out.writeLong(record.offsetEnd());
        out.writeInt(record.chunkIndex());
        out.writeInt(record.pageStart() == null ? NO_PAGE : record.pageStart());
        out.writeInt(record.pageEnd() == null ? NO_PAGE : record.pageEnd());
        out.writeByte(record.active() ? 1 : 0);
    }

    static ChunkRecord readRecord(ByteBuffer buffer) {
        String chunkId = readId(buffer);
        String docUid = readId(buffer);
        String docId = readId(buffer);
        long storeOffset = buffer.getLong();
        int length = buffer.getInt();
        int checksum = buffer.getInt();
        long offsetStart = buffer.getLong();
        long offsetEnd = buffer.getLong();
        int chunkIndex = buffer.getInt();
        int pageStart = buffer.getInt();
        int pageEnd = buffer.getInt();
        byte active = buffer.get();
        if (offsetStart < 0 || offsetEnd < offsetStart || offsetEnd > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("invalid character offsets [" + offsetStart + ", " + offsetEnd + ") for " + chunkId);
        }
        if (active != 0 && active != 1) {
            throw new IllegalArgumentException("invalid active flag " + active + " for " + chunkId);
        }
        return new ChunkRecord(
                chunkId,
                docUid,
                docId,
                storeOffset,
                length,
                checksum,
                (int) offsetStart,
                (int) offsetEnd,
                chunkIndex,
                pageStart == NO_PAGE ? null : pageStart,
                pageEnd == NO_PAGE ? null : pageEnd,
                active == 1);
    }

    static byte[] idBytes(String id) {
        if (!ArtifactIds.isValidId(id)) {
            throw new IllegalArgumentException("not a " + ID_BYTES + "-character hex id: " + id);
        }
        return id.getBytes(StandardCharsets.US_ASCII);
    }

    static String readId(ByteBuffer buffer) {
        byte[] bytes = new byte[ID_BYTES];
        buffer.get(bytes);
        String id = new String(bytes, StandardCharsets.US_ASCII);
        if (!ArtifactIds.isValidId(id)) {
            throw new IllegalArgumentException("malformed id bytes");
        }
        return id;
    }

    static byte[] compress(byte[] payload, int level) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, payload.length / 2));
        Deflater deflater = new Deflater(level);
        try (DeflaterOutputStream deflating = new DeflaterOutputStream(out, deflater)) {
            deflating.write(payload);
        } finally {
            deflater.end();
        }
        return out.toByteArray();
    }

    static byte[] decompress(byte[] compressed) throws IOException {
        try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }

    static int crc32(byte[] payload) {
        CRC32 crc = new CRC32();
        crc.update(payload);
        return (int) crc.getValue();
    }
}

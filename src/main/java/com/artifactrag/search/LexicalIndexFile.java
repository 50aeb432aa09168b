package com.artifactrag.search;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.artifactrag.core.ArtifactIds;
import com.artifactrag.manifest.ArtifactException;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON persistence of a {@link LexicalIndex}. The field set is fixed and versioned; loading maps
 * plain values only and validates every structural property before an index is handed out.
 */
public class LexicalIndexFile {
    public static final int FORMAT_VERSION = 1;

    private static final double AVG_TOLERANCE = 1e-9;

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public void write(Path path, LexicalIndex index) throws IOException {
        Map<String, PostingsDocument> postings = new TreeMap<>();
        index.postings().forEach((token, list) ->
                postings.put(token, new PostingsDocument(list.docFreq(), list.chunks(), list.termFrequencies())));
        IndexDocument document = new IndexDocument(
                FORMAT_VERSION,
                index.k1(),
                index.b(),
                index.chunkIds(),
                index.chunkLengths(),
                index.avgChunkLength(),
                postings);
        mapper.writeValue(path.toFile(), document);
    }

    public LexicalIndex read(Path path) throws ArtifactException {
        if (!Files.isRegularFile(path)) {
            throw new ArtifactException(ArtifactException.Reason.NOT_FOUND, "missing " + path);
        }
        IndexDocument document;
        try {
            document = mapper.readValue(path.toFile(), IndexDocument.class);
        } catch (IOException e) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "unreadable lexical index " + path.getFileName(), e);
        }
        try {
            return toIndex(document);
        } catch (IllegalArgumentException e) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "lexical index " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static LexicalIndex toIndex(IndexDocument document) {
        if (document.formatVersion() != FORMAT_VERSION) {
            throw new IllegalArgumentException("unsupported format_version " + document.formatVersion());
        }
        if (document.chunkIds() == null || document.chunkLengths() == null || document.postings() == null) {
            throw new IllegalArgumentException("missing chunk_ids, chunk_lengths or postings");
        }
        List<String> chunkIds = new ArrayList<>(document.chunkIds());
        int[] lengths = document.chunkLengths();
        int n = chunkIds.size();
        if (lengths.length != n) {
            throw new IllegalArgumentException("chunk_lengths has " + lengths.length + " entries for " + n + " chunks");
        }
        long total = 0;
        for (int i = 0; i < n; i++) {
            if (!ArtifactIds.isValidId(chunkIds.get(i))) {
                throw new IllegalArgumentException("malformed chunk id at position " + i);
            }
            if (lengths[i] < 0) {
                throw new IllegalArgumentException("negative chunk length at position " + i);
            }
            total += lengths[i];
        }
        double expectedAvg = n == 0 ? 0.0 : (double) total / n;
        if (Math.abs(expectedAvg - document.avgChunkLength()) > AVG_TOLERANCE * Math.max(1.0, expectedAvg)) {
            throw new IllegalArgumentException("avg_chunk_length " + document.avgChunkLength() + " does not match chunk lengths (" + expectedAvg + ")");
        }

        Map<String, Postings> postings = new TreeMap<>();
        for (Map.Entry<String, PostingsDocument> entry : document.postings().entrySet()) {
            PostingsDocument list = entry.getValue();
            String token = entry.getKey();
            if (list == null || list.chunks() == null || list.tf() == null) {
                throw new IllegalArgumentException("incomplete postings for '" + token + "'");
            }
            int[] chunks = list.chunks();
            int[] tf = list.tf();
            if (chunks.length != tf.length || chunks.length != list.docFreq() || chunks.length == 0) {
                throw new IllegalArgumentException("inconsistent postings sizes for '" + token + "'");
            }
            for (int i = 0; i < chunks.length; i++) {
                if (chunks[i] < 0 || chunks[i] >= n || (i > 0 && chunks[i] <= chunks[i - 1])) {
                    throw new IllegalArgumentException("postings for '" + token + "' not strictly increasing within [0, " + n + ")");
                }
                if (tf[i] <= 0 || tf[i] > lengths[chunks[i]]) {
                    throw new IllegalArgumentException("invalid term frequency for '" + token + "'");
                }
            }
            postings.put(token, new Postings(chunks, tf));
        }
        return new LexicalIndex(document.k1(), document.b(), List.copyOf(chunkIds), lengths, document.avgChunkLength(), postings);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonPropertyOrder({ "format_version", "k1", "b", "chunk_ids", "chunk_lengths", "avg_chunk_length", "postings" })
    record IndexDocument(
            int formatVersion,
            double k1,
            double b,
            List<String> chunkIds,
            int[] chunkLengths,
            double avgChunkLength,
            Map<String, PostingsDocument> postings) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonPropertyOrder({ "doc_freq", "chunks", "tf" })
    record PostingsDocument(int docFreq, int[] chunks, int[] tf) {
    }
}

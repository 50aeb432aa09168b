package com.artifactrag.query;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.artifactrag.core.ArtifactFiles;
import com.artifactrag.manifest.ArtifactException;
import com.artifactrag.manifest.ArtifactValidator;
import com.artifactrag.manifest.Manifest;
import com.artifactrag.manifest.ManifestStore;
import com.artifactrag.manifest.ValidationMode;
import com.artifactrag.manifest.ValidationReport;
import com.artifactrag.search.LexicalIndex;
import com.artifactrag.search.LexicalIndexFile;
import com.artifactrag.search.ScoredChunk;
import com.artifactrag.search.Tokenizer;
import com.artifactrag.store.ChunkFetchException;
import com.artifactrag.store.ChunkRecord;
import com.artifactrag.store.ChunkStoreReader;
import com.artifactrag.store.DocumentMetadataStore;
import com.artifactrag.store.DocumentRecord;

/**
 * An opened artifact. Owns the loaded lexical index, the chunk-store index and the open data file
 * until {@link #close()}; nothing is shared between handles.
 *
 * <p>{@link #retrieveIds} works purely on memory. Fetches use positional reads. Both may be called
 * from any number of threads until the handle is closed.
 */
public final class Artifact implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Artifact.class);

    private final Path directory;
    private final ValidationReport validation;
    private final LexicalIndex index;
    private final ChunkStoreReader store;
    private final Map<String, DocumentRecord> documents;
    private final long coldStartMillis;
    private final ContextAssembler contextAssembler = new ContextAssembler();
    private volatile boolean closed;

    private Artifact(Path directory, ValidationReport validation, LexicalIndex index, ChunkStoreReader store,
            Map<String, DocumentRecord> documents, long coldStartMillis) {
        this.directory = directory;
        this.validation = validation;
        this.index = index;
        this.store = store;
        this.documents = documents;
        this.coldStartMillis = coldStartMillis;
    }

    /**
     * Loads and validates the artifact at {@code directory}. Either a fully usable handle comes back
     * or nothing does.
     */
    public static Artifact open(Path directory, ValidationMode mode) throws ArtifactException {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(mode, "mode");
        long started = System.nanoTime();
        ArtifactValidator validator = new ArtifactValidator();
        List<String> warnings = new ArrayList<>();

        validator.checkRequiredFiles(directory);
        Manifest manifest = new ManifestStore().read(directory.resolve(ArtifactFiles.MANIFEST));
        validator.checkSchema(manifest, mode, warnings);
        if (mode == ValidationMode.STRICT) {
            validator.verifyFileChecksums(directory, manifest);
        }
        LexicalIndex index = new LexicalIndexFile().read(directory.resolve(ArtifactFiles.LEXICAL_INDEX));
        List<DocumentRecord> documentList = readDocuments(directory.resolve(ArtifactFiles.DOCS_META));

        ChunkStoreReader store;
        try {
            store = ChunkStoreReader.open(directory);
        } catch (ArtifactException e) {
            throw e;
        } catch (IOException e) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "cannot open chunk store in " + directory, e);
        }

        try {
            validator.checkDataHeader(store, mode, warnings);
            Manifest effective = validator.checkConsistency(manifest, index, store, documentList, warnings);
            if (mode == ValidationMode.STRICT) {
                validator.verifyChunkBlocks(store);
            }
            Map<String, DocumentRecord> documents = new LinkedHashMap<>();
            documentList.forEach(document -> documents.put(document.docUid(), document));

            long coldStart = (System.nanoTime() - started) / 1_000_000L;
            ValidationReport report = new ValidationReport(mode, effective, warnings, mode == ValidationMode.STRICT);
            log.info("Opened artifact {} ({} mode): {} documents, {} chunks, {} indexed, cold start {} ms",
                    directory, mode, documents.size(), store.records().size(), index.chunkCount(), coldStart);
            return new Artifact(directory, report, index, store, documents, coldStart);
        } catch (ArtifactException | RuntimeException e) {
            try {
                store.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    /**
     * Ranks active chunks for {@code query}: at most {@code k} results, scores non-increasing, ties by
     * ascending chunk id.
     *
     * @throws com.artifactrag.search.QueryException if the index is empty or the query has no tokens
     */
    public List<ScoredChunk> retrieveIds(String query, int k) {
        ensureOpen();
        return index.search(query, k, store::isActive);
    }

    /** {@link #retrieveIds} followed by {@link #fetchChunks} on the ranked ids. */
    public List<RetrievalResult> retrieve(String query, int k) {
        List<ScoredChunk> ranked = retrieveIds(query, k);
        List<FetchResult> fetched = fetchChunks(ranked.stream().map(ScoredChunk::chunkId).toList());
        List<String> queryTokens = Tokenizer.tokenize(query);

        List<RetrievalResult> results = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            ScoredChunk scored = ranked.get(i);
            FetchResult fetch = fetched.get(i);
            List<String> matched = List.of();
            String snippet = "";
            if (fetch.isSuccess()) {
                String text = fetch.chunk().text();
                matched = Snippets.matchedTerms(queryTokens, text);
                snippet = Snippets.around(text, new HashSet<>(matched));
            }
            results.add(new RetrievalResult(i + 1, scored.chunkId(), scored.score(), fetch, matched, snippet));
        }
        return results;
    }

    /**
     * Fetches each id independently, preserving input order. A failing id yields a failed
     * {@link FetchResult} and does not affect the others.
     */
    public List<FetchResult> fetchChunks(List<String> chunkIds) {
        Objects.requireNonNull(chunkIds, "chunkIds");
        ensureOpen();
        boolean verify = validation.checksumsVerified();
        List<FetchResult> results = new ArrayList<>(chunkIds.size());
        for (String chunkId : chunkIds) {
            try {
                String text = store.fetch(chunkId, verify);
                ChunkRecord record = store.record(chunkId).orElseThrow();
                DocumentRecord document = documents.get(record.docUid());
                results.add(FetchResult.success(new FetchedChunk(record, text, document.sourcePath(), document.title())));
            } catch (ChunkFetchException e) {
                log.debug("Fetch of {} failed: {}", chunkId, e.getMessage());
                results.add(FetchResult.failure(e));
            }
        }
        return results;
    }

    public AssembledContext context(String query, int k) {
        return contextAssembler.assemble(query, retrieve(query, k));
    }

    public Manifest manifest() {
        return validation.manifest();
    }

    public ValidationReport validation() {
        return validation;
    }

    public List<String> warnings() {
        return validation.warnings();
    }

    public ArtifactStats stats() {
        ensureOpen();
        Map<String, Long> sizes = new TreeMap<>();
        for (String name : ArtifactFiles.REQUIRED) {
            try {
                sizes.put(name, Files.size(directory.resolve(name)));
            } catch (IOException e) {
                log.warn("Cannot stat {}: {}", name, e.getMessage());
            }
        }
        int active = (int) store.records().stream().filter(ChunkRecord::active).count();
        return new ArtifactStats(
                manifest().schemaVersion(),
                documents.size(),
                store.records().size(),
                active,
                index.vocabularySize(),
                index.avgChunkLength(),
                sizes,
                coldStartMillis);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        store.close();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("artifact " + directory + " is closed");
        }
    }

    private static List<DocumentRecord> readDocuments(Path path) throws ArtifactException {
        try {
            return new DocumentMetadataStore().read(path);
        } catch (IOException e) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "unreadable " + path.getFileName(), e);
        }
    }
}

package com.artifactrag.manifest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.artifactrag.core.ArtifactFiles;
import com.artifactrag.core.Hashing;
import com.artifactrag.runtime.BuildConfig;
import com.artifactrag.search.LexicalIndex;
import com.artifactrag.store.ChunkFetchException;
import com.artifactrag.store.ChunkRecord;
import com.artifactrag.store.ChunkStoreReader;
import com.artifactrag.store.DocumentRecord;

/**
 * Integrity checks run while opening an artifact. Each check either passes, appends a warning, or
 * throws an {@link ArtifactException}; none of them leaves partial state behind.
 */
public class ArtifactValidator {
    private static final Logger log = LoggerFactory.getLogger(ArtifactValidator.class);

    private static final SchemaVersion CURRENT = SchemaVersion.parse(BuildConfig.CURRENT_SCHEMA_VERSION);
    private static final int OLDEST_LEGACY_MAJOR = 1;

    public void checkRequiredFiles(Path directory) throws ArtifactException {
        if (!Files.isDirectory(directory)) {
            throw new ArtifactException(ArtifactException.Reason.NOT_FOUND, "no artifact directory at " + directory);
        }
        for (String name : ArtifactFiles.REQUIRED) {
            if (!Files.isRegularFile(directory.resolve(name))) {
                throw new ArtifactException(ArtifactException.Reason.NOT_FOUND, "missing required file " + name + " in " + directory);
            }
        }
    }

    /**
     * Gates on the manifest's schema version. In legacy mode an absent {@code build_config} stays
     * null here; {@link #checkConsistency} fills it once the lexical index is loaded.
     */
    public void checkSchema(Manifest manifest, ValidationMode mode, List<String> warnings) throws ArtifactException {
        SchemaVersion version;
        try {
            version = SchemaVersion.parse(manifest.schemaVersion());
        } catch (IllegalArgumentException e) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, e.getMessage(), e);
        }

        if (version.major() == CURRENT.major()) {
            if (version.minor() != CURRENT.minor()) {
                warn(warnings, "schema version " + version + " differs from supported " + CURRENT + "; reading as " + CURRENT);
            }
        } else if (mode == ValidationMode.LEGACY && version.major() >= OLDEST_LEGACY_MAJOR && version.major() < CURRENT.major()) {
            warn(warnings, "reading legacy schema " + version + " with defaults for absent fields");
            return;
        } else {
            throw new ArtifactException(ArtifactException.Reason.SCHEMA_INCOMPATIBLE,
                    "schema version " + version + " is not readable in " + mode + " mode (supported " + CURRENT.major() + ".x)");
        }

        if (manifest.buildConfig() == null) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "manifest has no build_config");
        }
        if (manifest.totalDocs() == null || manifest.totalChunks() == null) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "manifest has no document or chunk counts");
        }
    }

    /** Recomputes every checksummed file's SHA-256 and compares it with the manifest. */
    public void verifyFileChecksums(Path directory, Manifest manifest) throws ArtifactException {
        Map<String, String> recorded = manifest.checksums();
        if (recorded == null || recorded.isEmpty()) {
            throw new ArtifactException(ArtifactException.Reason.CHECKSUM_MISMATCH, "manifest records no checksums");
        }
        for (String name : ArtifactFiles.CHECKSUMMED) {
            String expected = recorded.get(name);
            if (expected == null) {
                throw new ArtifactException(ArtifactException.Reason.CHECKSUM_MISMATCH, "manifest records no checksum for " + name);
            }
            String actual;
            try {
                actual = Hashing.sha256Hex(directory.resolve(name));
            } catch (IOException e) {
                throw new ArtifactException(ArtifactException.Reason.NOT_FOUND, "cannot read " + name, e);
            }
            if (!expected.equalsIgnoreCase(actual)) {
                throw new ArtifactException(ArtifactException.Reason.CHECKSUM_MISMATCH,
                        name + " has sha256 " + actual + " but manifest records " + expected);
            }
        }
    }

    /**
     * A damaged {@code chunks.bin} header is fatal in strict mode. Otherwise it is a warning and each
     * block still proves itself on fetch.
     */
    public void checkDataHeader(ChunkStoreReader store, ValidationMode mode, List<String> warnings) throws ArtifactException {
        String problem = store.dataHeaderProblem().orElse(null);
        if (problem == null) {
            return;
        }
        if (mode == ValidationMode.STRICT) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, problem);
        }
        warn(warnings, problem + "; fetches rely on per-block checks");
    }

    /**
     * Cross-checks the manifest against the loaded indexes and returns the effective manifest. A
     * legacy manifest comes back with its build config and counts filled in.
     */
    public Manifest checkConsistency(Manifest manifest, LexicalIndex index, ChunkStoreReader store,
            List<DocumentRecord> documents, List<String> warnings) throws ArtifactException {
        Manifest effective = manifest;
        if (isLegacySchema(manifest)) {
            // Older schemas may omit the BM25 parameters; the index is authoritative for them.
            BuildConfig filled = effective.buildConfig() == null ? new BuildConfig() : effective.buildConfig().copy();
            if (effective.buildConfig() != null
                    && (Double.compare(filled.getBm25K1(), index.k1()) != 0 || Double.compare(filled.getBm25B(), index.b()) != 0)) {
                warn(warnings, String.format("legacy manifest BM25 parameters k1=%s b=%s replaced by lexical index k1=%s b=%s",
                        filled.getBm25K1(), filled.getBm25B(), index.k1(), index.b()));
            }
            filled.setBm25K1(index.k1());
            filled.setBm25B(index.b());
            filled.setSchemaVersion(manifest.schemaVersion());
            effective = effective.withBuildConfig(filled);
        } else if (Double.compare(effective.buildConfig().getBm25K1(), index.k1()) != 0
                || Double.compare(effective.buildConfig().getBm25B(), index.b()) != 0) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, String.format(
                    "manifest BM25 parameters k1=%s b=%s disagree with lexical index k1=%s b=%s",
                    effective.buildConfig().getBm25K1(), effective.buildConfig().getBm25B(), index.k1(), index.b()));
        }

        for (String chunkId : index.chunkIds()) {
            if (store.record(chunkId).isEmpty()) {
                throw new ArtifactException(ArtifactException.Reason.CORRUPT, "lexical index references unknown chunk " + chunkId);
            }
        }

        Set<String> docIds = new HashSet<>();
        Set<String> docUids = new HashSet<>();
        for (DocumentRecord document : documents) {
            if (!docUids.add(document.docUid())) {
                throw new ArtifactException(ArtifactException.Reason.CORRUPT, "duplicate doc_uid " + document.docUid() + " in docs.meta");
            }
            docIds.add(document.docId());
        }
        for (ChunkRecord record : store.records()) {
            if (!docUids.contains(record.docUid()) || !docIds.contains(record.docId())) {
                throw new ArtifactException(ArtifactException.Reason.CORRUPT, "chunk " + record.chunkId() + " belongs to no known document");
            }
        }

        int docs = documents.size();
        int chunks = store.records().size();
        if (effective.totalDocs() == null || effective.totalChunks() == null) {
            warn(warnings, "manifest carries no counts; using " + docs + " documents and " + chunks + " chunks");
            effective = effective.withCounts(docs, chunks);
        } else if (effective.totalDocs() != docs || effective.totalChunks() != chunks) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, String.format(
                    "manifest counts %d documents and %d chunks, artifact holds %d and %d",
                    effective.totalDocs(), effective.totalChunks(), docs, chunks));
        }
        return effective;
    }

    /** Reads every active block, checking its bounds, decompression and CRC32. */
    public void verifyChunkBlocks(ChunkStoreReader store) throws ArtifactException {
        int verified = 0;
        for (ChunkRecord record : store.records()) {
            if (!record.active()) {
                continue;
            }
            if (record.storeEnd() > store.dataSize()) {
                throw new ArtifactException(ArtifactException.Reason.CORRUPT, String.format(
                        "chunk %s ends at %d past data file size %d", record.chunkId(), record.storeEnd(), store.dataSize()));
            }
            try {
                store.readPayload(record, true);
            } catch (ChunkFetchException e) {
                ArtifactException.Reason reason = e.reason() == ChunkFetchException.Reason.CHECKSUM_MISMATCH
                        ? ArtifactException.Reason.CHECKSUM_MISMATCH
                        : ArtifactException.Reason.CORRUPT;
                throw new ArtifactException(reason, "chunk " + record.chunkId() + ": " + e.getMessage(), e);
            }
            verified++;
        }
        log.debug("Verified {} active chunk blocks", verified);
    }

    private static boolean isLegacySchema(Manifest manifest) {
        return SchemaVersion.parse(manifest.schemaVersion()).major() < CURRENT.major();
    }

    private static void warn(List<String> warnings, String warning) {
        log.warn(warning);
        warnings.add(warning);
    }
}

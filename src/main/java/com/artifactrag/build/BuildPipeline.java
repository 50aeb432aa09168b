package com.artifactrag.build;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.artifactrag.core.ArtifactFiles;
import com.artifactrag.core.ArtifactIds;
import com.artifactrag.core.Hashing;
import com.artifactrag.manifest.ArtifactException;
import com.artifactrag.manifest.Manifest;
import com.artifactrag.manifest.ManifestStore;
import com.artifactrag.manifest.ValidationMode;
import com.artifactrag.query.Artifact;
import com.artifactrag.query.FetchResult;
import com.artifactrag.runtime.BuildConfig;
import com.artifactrag.search.LexicalIndexBuilder;
import com.artifactrag.search.LexicalIndexFile;
import com.artifactrag.store.ChunkDescriptor;
import com.artifactrag.store.ChunkStoreWriter;
import com.artifactrag.store.DocumentMetadataStore;
import com.artifactrag.store.DocumentRecord;

/**
 * Builds an artifact into a hidden staging directory next to the destination and moves it into
 * place only after the staged copy reopens cleanly in strict mode. Any failure leaves the
 * destination as it was and removes the staging directory.
 *
 * <p>One pipeline run owns its destination; concurrent builds to the same path must be serialized
 * by the caller.
 */
public class BuildPipeline {
    private static final Logger log = LoggerFactory.getLogger(BuildPipeline.class);

    /** Notified after each completed stage with the directory that stage wrote into. */
    interface StageObserver {
        void stageCompleted(BuildStage stage, Path directory) throws IOException;
    }

    private final BuildConfig config;
    private final StageObserver observer;
    private final Clock clock;
    private final ManifestStore manifestStore = new ManifestStore();
    private final DocumentMetadataStore documentStore = new DocumentMetadataStore();
    private final LexicalIndexFile lexicalIndexFile = new LexicalIndexFile();

    public BuildPipeline(BuildConfig config) {
        this(config, (stage, directory) -> {
        }, Clock.systemUTC());
    }

    BuildPipeline(BuildConfig config, StageObserver observer, Clock clock) {
        this.config = Objects.requireNonNull(config, "config").copy().validate();
        this.observer = Objects.requireNonNull(observer, "observer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BuildReport build(List<SourceDocument> documents, Path destination) throws BuildException {
        Objects.requireNonNull(documents, "documents");
        Path target = destination.toAbsolutePath().normalize();
        Path staging = target.resolveSibling("." + target.getFileName() + ".staging-" + UUID.randomUUID());
        long started = System.nanoTime();
        log.info("Building artifact {} from {} documents", target, documents.size());

        try {
            List<PlannedDocument> plan = plan(documents);
            Files.createDirectories(staging.getParent());
            Files.createDirectory(staging);
            notify(BuildStage.IDS_ASSIGNED, staging);

            int activeChunks = writeChunkStore(plan, staging);
            notify(BuildStage.CHUNK_STORE_WRITTEN, staging);

            writeLexicalIndex(plan, staging);
            notify(BuildStage.LEXICAL_INDEX_WRITTEN, staging);

            writeDocumentMetadata(plan, staging);
            notify(BuildStage.DOCS_META_WRITTEN, staging);

            int totalChunks = plan.stream().mapToInt(document -> document.chunks().size()).sum();
            Manifest manifest = manifestStore.create(staging, config, plan.size(), totalChunks, clock.instant());
            manifestStore.write(staging.resolve(ArtifactFiles.MANIFEST), manifest);
            notify(BuildStage.MANIFEST_WRITTEN, staging);

            verify(plan, staging);
            notify(BuildStage.VERIFIED, staging);

            commit(staging, target);
            try {
                notify(BuildStage.COMMITTED, target);
            } catch (IOException e) {
                log.warn("Stage observer failed after {} was committed: {}", target, e.getMessage());
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.info("Committed artifact {} with {} documents and {} chunks in {} ms",
                    target, plan.size(), totalChunks, elapsed.toMillis());
            return new BuildReport(
                    target,
                    plan.stream().map(PlannedDocument::docId).toList(),
                    plan.stream().flatMap(document -> document.chunks().stream()).map(chunk -> chunk.descriptor().chunkId()).toList(),
                    activeChunks,
                    manifest.checksums(),
                    elapsed);
        } catch (BuildException e) {
            log.warn("Build of {} aborted: {}", target, e.getMessage());
            throw e;
        } catch (IOException e) {
            log.warn("Build of {} aborted: {}", target, e.getMessage());
            throw new BuildException(BuildException.Reason.IO_FAILURE, "build of " + target + " failed: " + e.getMessage(), e);
        } finally {
            deleteQuietly(staging);
        }
    }

    private List<PlannedDocument> plan(List<SourceDocument> documents) throws BuildException {
        List<PlannedDocument> plan = new ArrayList<>(documents.size());
        Set<String> docUids = new HashSet<>();
        Set<String> chunkIds = new HashSet<>();
        for (SourceDocument document : documents) {
            String path = ArtifactIds.normalizePath(document.sourcePath());
            if (path.isBlank()) {
                throw violation("document has a blank source path");
            }
            String docUid = ArtifactIds.docUid(path);
            if (!docUids.add(docUid)) {
                throw violation("duplicate document " + path + " (doc_uid " + docUid + ")");
            }
            String text = document.normalizedText();
            String textSha = Hashing.sha256Hex(text);
            String docId = ArtifactIds.docId(docUid, textSha);

            List<PlannedChunk> chunks = new ArrayList<>(document.spans().size());
            for (ChunkSpan span : document.spans()) {
                if (span.start() < 0 || span.start() > span.end() || span.end() > text.length()) {
                    throw violation(String.format("span [%d, %d) of %s lies outside its %d characters of text",
                            span.start(), span.end(), path, text.length()));
                }
                if (splitsSurrogatePair(text, span.start()) || splitsSurrogatePair(text, span.end())) {
                    throw violation(String.format("span [%d, %d) of %s splits a surrogate pair", span.start(), span.end(), path));
                }
                String chunkText = text.substring(span.start(), span.end());
                String chunkId = ArtifactIds.chunkId(docUid, span.start(), span.end(), chunkText);
                if (!chunkIds.add(chunkId)) {
                    throw violation("duplicate chunk " + chunkId + " for span [" + span.start() + ", " + span.end() + ") of " + path);
                }
                Page first = null;
                Page last = null;
                for (Page page : document.pages()) {
                    if (page.overlaps(span.start(), span.end())) {
                        if (first == null) {
                            first = page;
                        }
                        last = page;
                    }
                }
                ChunkDescriptor descriptor = new ChunkDescriptor(
                        chunkId,
                        docUid,
                        docId,
                        span.start(),
                        span.end(),
                        chunks.size(),
                        first == null ? null : first.number(),
                        last == null ? null : last.number(),
                        span.active());
                chunks.add(new PlannedChunk(descriptor, chunkText));
            }
            plan.add(new PlannedDocument(document, path, docUid, docId, textSha, chunks));
        }
        return plan;
    }

    private int writeChunkStore(List<PlannedDocument> plan, Path staging) throws IOException {
        int active = 0;
        try (ChunkStoreWriter writer = ChunkStoreWriter.create(staging, config.getCompressionLevel())) {
            for (PlannedDocument document : plan) {
                for (PlannedChunk chunk : document.chunks()) {
                    writer.append(chunk.descriptor(), chunk.text());
                    if (chunk.descriptor().active()) {
                        active++;
                    }
                }
            }
            log.debug("Wrote {} chunk blocks, {} bytes", writer.recordCount(), writer.dataSize());
        }
        return active;
    }

    private void writeLexicalIndex(List<PlannedDocument> plan, Path staging) throws IOException {
        LexicalIndexBuilder builder = new LexicalIndexBuilder(config.getBm25K1(), config.getBm25B());
        for (PlannedDocument document : plan) {
            for (PlannedChunk chunk : document.chunks()) {
                if (chunk.descriptor().active()) {
                    builder.add(chunk.descriptor().chunkId(), chunk.text());
                }
            }
        }
        lexicalIndexFile.write(staging.resolve(ArtifactFiles.LEXICAL_INDEX), builder.build());
    }

    private void writeDocumentMetadata(List<PlannedDocument> plan, Path staging) throws IOException {
        List<DocumentRecord> records = plan.stream()
                .map(document -> new DocumentRecord(
                        document.docUid(),
                        document.docId(),
                        document.sourcePath(),
                        document.source().title(),
                        document.source().extractedAt(),
                        document.textSha256(),
                        document.chunks().size()))
                .toList();
        documentStore.write(staging.resolve(ArtifactFiles.DOCS_META), records);
    }

    private void verify(List<PlannedDocument> plan, Path staging) throws BuildException {
        try (Artifact artifact = Artifact.open(staging, ValidationMode.STRICT)) {
            for (PlannedDocument document : plan) {
                List<PlannedChunk> active = document.chunks().stream()
                        .filter(chunk -> chunk.descriptor().active())
                        .toList();
                List<FetchResult> fetched = artifact.fetchChunks(active.stream().map(chunk -> chunk.descriptor().chunkId()).toList());
                for (int i = 0; i < active.size(); i++) {
                    FetchResult result = fetched.get(i);
                    PlannedChunk expected = active.get(i);
                    if (!result.isSuccess()) {
                        throw new BuildException(BuildException.Reason.CHECKSUM_FAILURE,
                                "staged chunk " + result.chunkId() + " cannot be read back: " + result.message());
                    }
                    String text = document.source().normalizedText();
                    int start = result.chunk().record().offsetStart();
                    int end = result.chunk().record().offsetEnd();
                    if (!text.substring(start, end).equals(result.chunk().text()) || !expected.text().equals(result.chunk().text())) {
                        throw violation("staged chunk " + result.chunkId() + " does not match its source slice [" + start + ", " + end + ")");
                    }
                }
            }
        } catch (ArtifactException e) {
            BuildException.Reason reason = e.reason() == ArtifactException.Reason.CHECKSUM_MISMATCH
                    ? BuildException.Reason.CHECKSUM_FAILURE
                    : BuildException.Reason.INVARIANT_VIOLATION;
            throw new BuildException(reason, "staged artifact failed verification: " + e.getMessage(), e);
        } catch (BuildException e) {
            throw e;
        } catch (IOException e) {
            throw new BuildException(BuildException.Reason.IO_FAILURE, "cannot release staged artifact: " + e.getMessage(), e);
        }
    }

    private void commit(Path staging, Path target) throws IOException {
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            return;
        }

        // A directory cannot be atomically replaced, so the old one is parked beside it until the
        // new one is in place.
        Path previous = target.resolveSibling("." + target.getFileName() + ".previous-" + UUID.randomUUID());
        Files.move(target, previous, StandardCopyOption.ATOMIC_MOVE);
        try {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.move(previous, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException restore) {
                e.addSuppressed(restore);
            }
            throw e;
        }
        deleteQuietly(previous);
    }

    private void notify(BuildStage stage, Path directory) throws IOException {
        log.debug("Build stage {} complete", stage);
        observer.stageCompleted(stage, directory);
    }

    private static boolean splitsSurrogatePair(String text, int offset) {
        return offset > 0 && offset < text.length()
                && Character.isHighSurrogate(text.charAt(offset - 1))
                && Character.isLowSurrogate(text.charAt(offset));
    }

    private static BuildException violation(String message) {
        return new BuildException(BuildException.Reason.INVARIANT_VIOLATION, message);
    }

    private static void deleteQuietly(Path directory) {
        if (!Files.exists(directory, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Could not remove {}: {}", directory, e.getMessage());
        }
    }

    private record PlannedDocument(
            SourceDocument source,
            String sourcePath,
            String docUid,
            String docId,
            String textSha256,
            List<PlannedChunk> chunks) {
    }

    private record PlannedChunk(ChunkDescriptor descriptor, String text) {
    }
}

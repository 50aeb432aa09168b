package com.artifactrag.build;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** One document as handed over by an ingestion collaborator. */
public record SourceDocument(
        String sourcePath,
        String title,
        String normalizedText,
        List<ChunkSpan> spans,
        List<Page> pages,
        Instant extractedAt) {

    public SourceDocument {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(normalizedText, "normalizedText");
        Objects.requireNonNull(extractedAt, "extractedAt");
        spans = List.copyOf(spans);
        pages = pages == null ? List.of() : List.copyOf(pages);
        title = title == null ? "" : title;
    }

    public SourceDocument(String sourcePath, String title, String normalizedText, List<ChunkSpan> spans, Instant extractedAt) {
        this(sourcePath, title, normalizedText, spans, List.of(), extractedAt);
    }
}

package com.artifactrag.core;

import java.util.List;

/** File names making up an artifact directory. */
public final class ArtifactFiles {
    public static final String CHUNKS_BIN = "chunks.bin";
    public static final String CHUNKS_IDX = "chunks.idx";
    public static final String DOCS_META = "docs.meta";
    public static final String LEXICAL_INDEX = "lexical.json";
    public static final String MANIFEST = "manifest.json";

    /** Files whose SHA-256 is recorded in the manifest. */
    public static final List<String> CHECKSUMMED = List.of(CHUNKS_BIN, CHUNKS_IDX, DOCS_META, LEXICAL_INDEX);

    public static final List<String> REQUIRED = List.of(MANIFEST, CHUNKS_BIN, CHUNKS_IDX, DOCS_META, LEXICAL_INDEX);

    private ArtifactFiles() {
    }
}

package com.artifactrag.build;

public enum BuildStage {
    IDS_ASSIGNED,
    CHUNK_STORE_WRITTEN,
    LEXICAL_INDEX_WRITTEN,
    DOCS_META_WRITTEN,
    MANIFEST_WRITTEN,
    VERIFIED,
    COMMITTED
}

package com.artifactrag.manifest;

import java.util.Map;

import com.artifactrag.runtime.BuildConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Contents of {@code manifest.json}. Fields other than {@code schema_version} may be absent in
 * manifests written by older schema majors, which only legacy validation accepts.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "schema_version", "artifact_version", "build_timestamp", "index_type", "compression",
        "build_config", "checksums", "total_docs", "total_chunks" })
public record Manifest(
        String schemaVersion,
        String artifactVersion,
        String buildTimestamp,
        String indexType,
        String compression,
        BuildConfig buildConfig,
        Map<String, String> checksums,
        Integer totalDocs,
        Integer totalChunks) {

    public static final String ARTIFACT_VERSION = "1.0";
    public static final String INDEX_TYPE = "bm25";
    public static final String COMPRESSION = "deflate";

    public Manifest withBuildConfig(BuildConfig config) {
        return new Manifest(schemaVersion, artifactVersion, buildTimestamp, indexType, compression, config, checksums, totalDocs, totalChunks);
    }

    public Manifest withCounts(int docs, int chunks) {
        return new Manifest(schemaVersion, artifactVersion, buildTimestamp, indexType, compression, buildConfig, checksums, docs, chunks);
    }
}

package com.artifactrag.runtime;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Build-time options persisted in the manifest. The recognized keys are fixed; an unknown key is an
 * error rather than something silently carried along.
 */
public class BuildConfig {
    public static final String CURRENT_SCHEMA_VERSION = "2.0";
    public static final Set<String> WRITABLE_SCHEMA_VERSIONS = Set.of(CURRENT_SCHEMA_VERSION);

    public static final int DEFAULT_CHUNK_SIZE = 512;
    public static final int DEFAULT_CHUNK_OVERLAP = 50;
    public static final double DEFAULT_BM25_K1 = 1.5;
    public static final double DEFAULT_BM25_B = 0.75;
    public static final int DEFAULT_COMPRESSION_LEVEL = 6;

    private static final ObjectMapper STRICT_MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @JsonProperty("chunk_size")
    private int chunkSize = DEFAULT_CHUNK_SIZE;

    @JsonProperty("chunk_overlap")
    private int chunkOverlap = DEFAULT_CHUNK_OVERLAP;

    @JsonProperty("bm25_k1")
    private double bm25K1 = DEFAULT_BM25_K1;

    @JsonProperty("bm25_b")
    private double bm25B = DEFAULT_BM25_B;

    @JsonProperty("compression_level")
    private int compressionLevel = DEFAULT_COMPRESSION_LEVEL;

    @JsonProperty("schema_version")
    private String schemaVersion = CURRENT_SCHEMA_VERSION;

    /**
     * Builds a config from loosely typed options, e.g. parsed CLI flags.
     *
     * @throws IllegalArgumentException for an unrecognized key, a value of the wrong type or an
     *         out-of-range value
     */
    public static BuildConfig fromOptions(Map<String, ?> options) {
        Objects.requireNonNull(options, "options");
        BuildConfig config = STRICT_MAPPER.convertValue(options, BuildConfig.class);
        config.validate();
        return config;
    }

    public BuildConfig validate() {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunk_size must be positive, was " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunk_overlap must be in [0, chunk_size), was " + chunkOverlap);
        }
        if (!Double.isFinite(bm25K1) || bm25K1 < 0) {
            throw new IllegalArgumentException("bm25_k1 must be a non-negative number, was " + bm25K1);
        }
        if (!Double.isFinite(bm25B) || bm25B < 0 || bm25B > 1) {
            throw new IllegalArgumentException("bm25_b must be in [0, 1], was " + bm25B);
        }
        if (compressionLevel < 0 || compressionLevel > 9) {
            throw new IllegalArgumentException("compression_level must be in [0, 9], was " + compressionLevel);
        }
        if (!WRITABLE_SCHEMA_VERSIONS.contains(schemaVersion)) {
            throw new IllegalArgumentException("schema_version " + schemaVersion + " cannot be written; supported: "
                    + WRITABLE_SCHEMA_VERSIONS);
        }
        return this;
    }

    public BuildConfig copy() {
        BuildConfig copy = new BuildConfig();
        copy.chunkSize = chunkSize;
        copy.chunkOverlap = chunkOverlap;
        copy.bm25K1 = bm25K1;
        copy.bm25B = bm25B;
        copy.compressionLevel = compressionLevel;
        copy.schemaVersion = schemaVersion;
        return copy;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public double getBm25K1() {
        return bm25K1;
    }

    public void setBm25K1(double bm25K1) {
        this.bm25K1 = bm25K1;
    }

    public double getBm25B() {
        return bm25B;
    }

    public void setBm25B(double bm25B) {
        this.bm25B = bm25B;
    }

    public int getCompressionLevel() {
        return compressionLevel;
    }

    public void setCompressionLevel(int compressionLevel) {
        this.compressionLevel = compressionLevel;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BuildConfig other)) {
            return false;
        }
        return chunkSize == other.chunkSize
                && chunkOverlap == other.chunkOverlap
                && Double.compare(bm25K1, other.bm25K1) == 0
                && Double.compare(bm25B, other.bm25B) == 0
                && compressionLevel == other.compressionLevel
                && Objects.equals(schemaVersion, other.schemaVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chunkSize, chunkOverlap, bm25K1, bm25B, compressionLevel, schemaVersion);
    }

    @Override
    public String toString() {
        return "BuildConfig{" +
                "chunkSize=" + chunkSize +
                ", chunkOverlap=" + chunkOverlap +
                ", bm25K1=" + bm25K1 +
                ", bm25B=" + bm25B +
                ", compressionLevel=" + compressionLevel +
                ", schemaVersion='" + schemaVersion + '\'' +
                '}';
    }
}

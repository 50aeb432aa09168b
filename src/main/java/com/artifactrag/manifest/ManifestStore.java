package com.artifactrag.manifest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

import com.artifactrag.core.ArtifactFiles;
import com.artifactrag.core.Hashing;
import com.artifactrag.runtime.BuildConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ManifestStore {
    private static final SchemaVersion CURRENT = SchemaVersion.parse(BuildConfig.CURRENT_SCHEMA_VERSION);

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    // Manifests of other schema majors may carry fields this version never knew about.
    private final ObjectMapper lenientMapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /** SHA-256 of every checksummed artifact file present in {@code directory}. */
    public Map<String, String> computeChecksums(Path directory) throws IOException {
        Map<String, String> checksums = new TreeMap<>();
        for (String name : ArtifactFiles.CHECKSUMMED) {
            Path file = directory.resolve(name);
            if (Files.isRegularFile(file)) {
                checksums.put(name, Hashing.sha256Hex(file));
            }
        }
        return checksums;
    }

    public Manifest create(Path directory, BuildConfig config, int totalDocs, int totalChunks, Instant buildTimestamp)
            throws IOException {
        return new Manifest(
                config.getSchemaVersion(),
                Manifest.ARTIFACT_VERSION,
                buildTimestamp.toString(),
                Manifest.INDEX_TYPE,
                Manifest.COMPRESSION,
                config.copy(),
                computeChecksums(directory),
                totalDocs,
                totalChunks);
    }

    public void write(Path path, Manifest manifest) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), manifest);
    }

    /**
     * Parses a manifest. Only the version field is required at this point; what else must be present
     * depends on the validation mode and is decided by {@link ArtifactValidator}.
     */
    public Manifest read(Path path) throws ArtifactException {
        if (!Files.isRegularFile(path)) {
            throw new ArtifactException(ArtifactException.Reason.NOT_FOUND, "missing " + path);
        }
        JsonNode tree;
        try {
            tree = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "unreadable manifest " + path.getFileName(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "manifest is not a JSON object");
        }
        JsonNode versionNode = tree.get("schema_version");
        if (versionNode == null || !versionNode.isTextual()) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "manifest has no schema_version");
        }
        SchemaVersion version;
        try {
            version = SchemaVersion.parse(versionNode.asText());
        } catch (IllegalArgumentException e) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, e.getMessage(), e);
        }

        ObjectMapper reader = version.major() == CURRENT.major() ? mapper : lenientMapper;
        try {
            return reader.treeToValue(tree, Manifest.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ArtifactException(ArtifactException.Reason.CORRUPT, "invalid manifest " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }
}

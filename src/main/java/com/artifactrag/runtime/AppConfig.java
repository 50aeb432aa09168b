package com.artifactrag.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.artifactrag.manifest.ValidationMode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private BuildConfig build = new BuildConfig();
    private QueryConfig query = new QueryConfig();

    /**
     * Reads a YAML config file; a missing file yields the defaults. Unknown keys under {@code build}
     * are rejected.
     */
    public static AppConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return new AppConfig();
        }
        ObjectMapper mapper = YAMLMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
        AppConfig config;
        try {
            config = mapper.readValue(path.toFile(), AppConfig.class);
        } catch (UnrecognizedPropertyException e) {
            throw new IllegalArgumentException("Unrecognized option '" + e.getPropertyName() + "' in " + path, e);
        }
        config.getBuild().validate();
        return config;
    }

    public BuildConfig getBuild() {
        return build;
    }

    public void setBuild(BuildConfig build) {
        this.build = build == null ? new BuildConfig() : build;
    }

    public QueryConfig getQuery() {
        return query;
    }

    public void setQuery(QueryConfig query) {
        this.query = query == null ? new QueryConfig() : query;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryConfig {
        private int defaultTopK = 10;
        private ValidationMode validationMode = ValidationMode.NORMAL;
        private int contextMaxChars = 8000;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public ValidationMode getValidationMode() {
            return validationMode;
        }

        public void setValidationMode(ValidationMode validationMode) {
            this.validationMode = validationMode == null ? ValidationMode.NORMAL : validationMode;
        }

        public int getContextMaxChars() {
            return contextMaxChars;
        }

        public void setContextMaxChars(int contextMaxChars) {
            this.contextMaxChars = contextMaxChars;
        }
    }
}

package com.artifactrag.manifest;

import java.util.List;

/**
 * Outcome of a successful open. {@code manifest} is the effective manifest, with legacy defaults
 * already filled in.
 */
public record ValidationReport(ValidationMode mode, Manifest manifest, List<String> warnings, boolean checksumsVerified) {
    public ValidationReport {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

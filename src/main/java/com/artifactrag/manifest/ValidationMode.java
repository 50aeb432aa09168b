package com.artifactrag.manifest;

public enum ValidationMode {
    /** Schema gate with warnings on minor mismatches; required files and indexes must load. */
    NORMAL,
    /** Normal checks plus SHA-256 of every file and a read of every active chunk block. */
    STRICT,
    /** Normal checks, additionally accepting older schema majors with defaults filled in. */
    LEGACY
}

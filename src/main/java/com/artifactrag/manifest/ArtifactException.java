package com.artifactrag.manifest;

import java.io.IOException;

/** Raised when an artifact cannot be opened; no handle is produced. */
public class ArtifactException extends IOException {
    public enum Reason {
        NOT_FOUND,
        SCHEMA_INCOMPATIBLE,
        CHECKSUM_MISMATCH,
        CORRUPT
    }

    private final Reason reason;

    public ArtifactException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ArtifactException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return reason + ": " + super.getMessage();
    }
}

package com.artifactrag.build;

import java.io.IOException;

/** Aborts a build. When this is thrown the destination is exactly as it was before the build. */
public class BuildException extends IOException {
    public enum Reason {
        IO_FAILURE,
        CHECKSUM_FAILURE,
        INVARIANT_VIOLATION
    }

    private final Reason reason;

    public BuildException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public BuildException(Reason reason, String message, Throwable cause) {
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

package com.artifactrag.search;

/** Fails a single retrieval call; the artifact handle stays usable. */
public class QueryException extends RuntimeException {
    public enum Reason {
        EMPTY_INDEX,
        TOKENIZATION_FAILURE
    }

    private final Reason reason;

    public QueryException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}

package com.artifactrag.eval;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** A judged-relevant character range {@code [start, end)} of one source document. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RelevantSpan(String sourcePath, int start, int end) {
    public boolean overlaps(String path, int otherStart, int otherEnd) {
        return sourcePath.equals(path) && start < otherEnd && otherStart < end;
    }
}

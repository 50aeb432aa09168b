package com.artifactrag.store;

import java.time.Instant;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentRecord(
        String docUid,
        String docId,
        String sourcePath,
        String title,
        Instant extractedAt,
        String normalizedTextSha256,
        int chunkCount) {
}

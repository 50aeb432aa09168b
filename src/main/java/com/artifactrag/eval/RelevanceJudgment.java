package com.artifactrag.eval;

import java.util.List;

public record RelevanceJudgment(String id, String query, List<RelevantSpan> relevant) {
    public RelevanceJudgment {
        relevant = relevant == null ? List.of() : List.copyOf(relevant);
    }
}

package com.artifactrag.eval;

import java.util.List;

/** {@code firstRelevantRank} is 1-based, or 0 when nothing relevant was retrieved. */
public record QueryOutcome(String id, String query, List<String> retrievedChunkIds, int firstRelevantRank) {
    public boolean hit() {
        return firstRelevantRank > 0;
    }

    public double reciprocalRank() {
        return hit() ? 1.0 / firstRelevantRank : 0.0;
    }
}

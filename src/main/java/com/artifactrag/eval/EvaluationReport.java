package com.artifactrag.eval;

import java.util.List;

public record EvaluationReport(int k, double recallAtK, double meanReciprocalRank, List<QueryOutcome> outcomes) {
    public EvaluationReport {
        outcomes = List.copyOf(outcomes);
    }
}

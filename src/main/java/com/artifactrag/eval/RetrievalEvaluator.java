package com.artifactrag.eval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.artifactrag.query.Artifact;
import com.artifactrag.query.FetchedChunk;
import com.artifactrag.query.RetrievalResult;
import com.artifactrag.search.QueryException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Scores retrieval against judgments keyed by source path and character range. A retrieved chunk
 * is correct when its range overlaps a judged span of the same document.
 */
public class RetrievalEvaluator {
    private static final Logger log = LoggerFactory.getLogger(RetrievalEvaluator.class);

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public List<RelevanceJudgment> loadJudgments(Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), new TypeReference<List<RelevanceJudgment>>() {
        });
    }

    public EvaluationReport evaluate(Artifact artifact, List<RelevanceJudgment> judgments, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
        List<QueryOutcome> outcomes = new ArrayList<>(judgments.size());
        for (RelevanceJudgment judgment : judgments) {
            List<RetrievalResult> results;
            try {
                results = artifact.retrieve(judgment.query(), k);
            } catch (QueryException e) {
                log.warn("Query {} produced no ranking: {}", judgment.id(), e.getMessage());
                results = List.of();
            }
            List<String> ids = new ArrayList<>(results.size());
            int firstRelevant = 0;
            for (RetrievalResult result : results) {
                ids.add(result.chunkId());
                if (firstRelevant == 0 && result.isFetched() && isRelevant(result.fetch().chunk(), judgment)) {
                    firstRelevant = result.rank();
                }
            }
            outcomes.add(new QueryOutcome(judgment.id(), judgment.query(), ids, firstRelevant));
        }

        double recall = outcomes.isEmpty() ? 0.0 : outcomes.stream().filter(QueryOutcome::hit).count() / (double) outcomes.size();
        double mrr = outcomes.stream().mapToDouble(QueryOutcome::reciprocalRank).average().orElse(0.0);
        log.info("Evaluated {} queries at k={}: recall={} mrr={}", outcomes.size(), k, recall, mrr);
        return new EvaluationReport(k, recall, mrr, outcomes);
    }

    private static boolean isRelevant(FetchedChunk chunk, RelevanceJudgment judgment) {
        int start = chunk.record().offsetStart();
        int end = chunk.record().offsetEnd();
        return judgment.relevant().stream().anyMatch(span -> span.overlaps(chunk.sourcePath(), start, end));
    }
}

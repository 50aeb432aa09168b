package com.artifactrag.query;

import java.util.List;

/**
 * One ranked hit with its fetched text. {@code matchedTerms} and {@code snippet} are empty when the
 * fetch failed.
 */
public record RetrievalResult(int rank, String chunkId, double score, FetchResult fetch, List<String> matchedTerms, String snippet) {
    public RetrievalResult {
        matchedTerms = List.copyOf(matchedTerms);
        snippet = snippet == null ? "" : snippet;
    }

    public boolean isFetched() {
        return fetch.isSuccess();
    }
}

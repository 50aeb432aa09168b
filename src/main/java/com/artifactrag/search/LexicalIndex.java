package com.artifactrag.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.function.Predicate;

/**
 * Immutable BM25 index over chunk texts.
 *
 * <pre>
 * idf(t)     = ln((N - df(t) + 0.5) / (df(t) + 0.5) + 1)
 * score(t,c) = idf(t) * tf(t,c) * (k1 + 1) / (tf(t,c) + k1 * (1 - b + b * len(c) / avgLen))
 * score(c)   = sum of score(t,c) over query tokens t present in c
 * </pre>
 *
 * Query tokens are taken as given, so a token repeated in the query contributes once per
 * occurrence. Equal scores rank by ascending chunk id. Searching touches only the posting lists of
 * the query tokens and is safe from any number of threads.
 */
public final class LexicalIndex {
    private final double k1;
    private final double b;
    private final List<String> chunkIds;
    private final int[] chunkLengths;
    private final double avgChunkLength;
    private final Map<String, Postings> postings;

    LexicalIndex(double k1, double b, List<String> chunkIds, int[] chunkLengths, double avgChunkLength, Map<String, Postings> postings) {
        this.k1 = k1;
        this.b = b;
        this.chunkIds = chunkIds;
        this.chunkLengths = chunkLengths;
        this.avgChunkLength = avgChunkLength;
        this.postings = Collections.unmodifiableMap(postings);
    }

    public List<ScoredChunk> search(String query, int k) {
        return search(query, k, chunkId -> true);
    }

    /**
     * @param eligible chunks failing this test are skipped before top-k selection
     * @throws QueryException if the index holds no chunks or the query has no tokens
     */
    public List<ScoredChunk> search(String query, int k, Predicate<String> eligible) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
        if (chunkIds.isEmpty()) {
            throw new QueryException(QueryException.Reason.EMPTY_INDEX, "index contains no chunks");
        }
        List<String> tokens = Tokenizer.tokenize(query);
        if (tokens.isEmpty()) {
            throw new QueryException(QueryException.Reason.TOKENIZATION_FAILURE, "query has no indexable tokens: '" + query + "'");
        }

        Map<Integer, Double> scores = new HashMap<>();
        for (String token : tokens) {
            Postings list = postings.get(token);
            if (list == null) {
                continue;
            }
            double idf = idf(list.docFreq());
            int[] chunks = list.chunks();
            int[] frequencies = list.termFrequencies();
            for (int i = 0; i < chunks.length; i++) {
                scores.merge(chunks[i], termScore(idf, frequencies[i], chunkLengths[chunks[i]]), Double::sum);
            }
        }

        PriorityQueue<ScoredChunk> worstFirst = new PriorityQueue<>(k + 1, ScoredChunk.RANKING.reversed());
        for (Map.Entry<Integer, Double> entry : scores.entrySet()) {
            String chunkId = chunkIds.get(entry.getKey());
            if (!eligible.test(chunkId)) {
                continue;
            }
            ScoredChunk candidate = new ScoredChunk(chunkId, entry.getValue());
            if (worstFirst.size() < k) {
                worstFirst.offer(candidate);
            } else if (ScoredChunk.RANKING.compare(candidate, worstFirst.peek()) < 0) {
                worstFirst.poll();
                worstFirst.offer(candidate);
            }
        }

        List<ScoredChunk> ranked = new ArrayList<>(worstFirst);
        ranked.sort(ScoredChunk.RANKING);
        return ranked;
    }

    double idf(int docFreq) {
        int n = chunkIds.size();
        return Math.log((n - docFreq + 0.5) / (docFreq + 0.5) + 1.0);
    }

    private double termScore(double idf, int tf, int length) {
        double lengthRatio = avgChunkLength > 0 ? length / avgChunkLength : 0.0;
        return idf * tf * (k1 + 1) / (tf + k1 * (1 - b + b * lengthRatio));
    }

    public double k1() {
        return k1;
    }

    public double b() {
        return b;
    }

    public int chunkCount() {
        return chunkIds.size();
    }

    public List<String> chunkIds() {
        return chunkIds;
    }

    int[] chunkLengths() {
        return chunkLengths;
    }

    public double avgChunkLength() {
        return avgChunkLength;
    }

    public int vocabularySize() {
        return postings.size();
    }

    public int docFreq(String token) {
        Postings list = postings.get(token);
        return list == null ? 0 : list.docFreq();
    }

    Map<String, Postings> postings() {
        return postings;
    }
}

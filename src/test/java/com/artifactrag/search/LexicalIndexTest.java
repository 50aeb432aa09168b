package com.artifactrag.search;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LexicalIndexTest {

    private static final String A = "aaaaaaaaaaaaaaaa";
    private static final String B = "bbbbbbbbbbbbbbbb";
    private static final String C = "cccccccccccccccc";
    private static final String D = "dddddddddddddddd";

    @Test
    void scoresFollowBm25() {
        LexicalIndexBuilder builder = new LexicalIndexBuilder(1.5, 0.75);
        builder.add(A, "apple banana");
        builder.add(B, "banana cherry cherry");
        LexicalIndex index = builder.build();

        List<ScoredChunk> results = index.search("apple", 10);

        double idf = Math.log((2 - 1 + 0.5) / (1 + 0.5) + 1);
        double expected = idf * 1 * (1.5 + 1) / (1 + 1.5 * (1 - 0.75 + 0.75 * 2 / 2.5));
        assertEquals(1, results.size());
        assertEquals(A, results.get(0).chunkId());
        assertEquals(expected, results.get(0).score(), 1e-12);
        assertEquals(2.5, index.avgChunkLength(), 1e-12);
        assertEquals(3, index.vocabularySize());
        assertEquals(2, index.docFreq("banana"));
    }

    @Test
    void equalScoresRankByAscendingChunkId() {
        LexicalIndexBuilder builder = new LexicalIndexBuilder(1.2, 0.75);
        builder.add(C, "shared words here");
        builder.add(A, "shared words here");
        builder.add(B, "shared words here");
        LexicalIndex index = builder.build();

        List<ScoredChunk> results = index.search("shared", 10);

        assertEquals(List.of(A, B, C), results.stream().map(ScoredChunk::chunkId).toList());
        assertEquals(results.get(0).score(), results.get(2).score());
    }

    @Test
    void returnsAtMostKInNonIncreasingOrder() {
        LexicalIndexBuilder builder = new LexicalIndexBuilder(1.5, 0.75);
        builder.add(A, "river river river bank");
        builder.add(B, "river bank");
        builder.add(C, "bank");
        builder.add(D, "river river");
        LexicalIndex index = builder.build();

        List<ScoredChunk> all = index.search("river bank", 10);
        List<ScoredChunk> top2 = index.search("river bank", 2);

        assertEquals(4, all.size());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).score() >= all.get(i).score());
        }
        assertEquals(all.subList(0, 2), top2);
    }

    @Test
    void repeatedQueryTokensCountPerOccurrence() {
        LexicalIndexBuilder builder = new LexicalIndexBuilder(1.5, 0.75);
        builder.add(A, "apple pie");
        builder.add(B, "cherry pie");
        LexicalIndex index = builder.build();

        double once = index.search("apple", 1).get(0).score();
        double twice = index.search("apple APPLE", 1).get(0).score();

        assertEquals(2 * once, twice, 1e-12);
    }

    @Test
    void ineligibleChunksAreSkippedBeforeTopK() {
        LexicalIndexBuilder builder = new LexicalIndexBuilder(1.5, 0.75);
        builder.add(A, "target target");
        builder.add(B, "target");
        LexicalIndex index = builder.build();

        List<ScoredChunk> results = index.search("target", 1, chunkId -> !chunkId.equals(A));

        assertEquals(List.of(B), results.stream().map(ScoredChunk::chunkId).toList());
    }

    @Test
    void unmatchedQueryReturnsNothing() {
        LexicalIndexBuilder builder = new LexicalIndexBuilder(1.5, 0.75);
        builder.add(A, "apple");

        assertTrue(builder.build().search("zucchini", 5).isEmpty());
    }

    @Test
    void emptyIndexAndTokenlessQueriesFail() {
        LexicalIndex empty = new LexicalIndexBuilder(1.5, 0.75).build();
        QueryException emptyError = assertThrows(QueryException.class, () -> empty.search("anything", 3));
        assertEquals(QueryException.Reason.EMPTY_INDEX, emptyError.reason());

        LexicalIndexBuilder builder = new LexicalIndexBuilder(1.5, 0.75);
        builder.add(A, "apple");
        LexicalIndex index = builder.build();
        QueryException tokenError = assertThrows(QueryException.class, () -> index.search("?! ...", 3));
        assertEquals(QueryException.Reason.TOKENIZATION_FAILURE, tokenError.reason());
        assertThrows(IllegalArgumentException.class, () -> index.search("apple", 0));
    }
}

package com.artifactrag.query;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.artifactrag.build.BuildReport;
import com.artifactrag.build.TestCorpus;
import com.artifactrag.core.ArtifactFiles;
import com.artifactrag.manifest.ValidationMode;
import com.artifactrag.search.QueryException;
import com.artifactrag.search.ScoredChunk;
import com.artifactrag.store.ChunkFetchException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactTest {

    @TempDir
    Path tempDir;

    private BuildReport report;
    private Artifact artifact;

    @BeforeEach
    void openArtifact() throws IOException {
        Path destination = tempDir.resolve("artifact");
        report = TestCorpus.build(destination);
        artifact = Artifact.open(destination, ValidationMode.NORMAL);
    }

    @AfterEach
    void closeArtifact() throws IOException {
        artifact.close();
    }

    @Test
    void chunkWithUniqueTermRanksFirst() {
        String c3 = report.chunkIds().get(2);

        List<ScoredChunk> ranked = artifact.retrieveIds("alpha beta", 5);

        assertEquals(5, ranked.size());
        assertEquals(c3, ranked.get(0).chunkId());
        for (ScoredChunk other : ranked.subList(1, ranked.size())) {
            assertTrue(ranked.get(0).score() > other.score());
        }
        FetchResult fetched = artifact.fetchChunks(List.of(c3)).get(0);
        assertEquals(100, fetched.chunk().record().offsetStart());
        assertEquals(120, fetched.chunk().record().offsetEnd());
    }

    @Test
    void rankingIsNonIncreasingAndBoundedByK() {
        List<ScoredChunk> ranked = artifact.retrieveIds("beta", 3);

        assertEquals(3, ranked.size());
        for (int i = 1; i < ranked.size(); i++) {
            ScoredChunk previous = ranked.get(i - 1);
            ScoredChunk current = ranked.get(i);
            assertTrue(previous.score() > current.score()
                    || (previous.score() == current.score() && previous.chunkId().compareTo(current.chunkId()) < 0));
        }
    }

    @Test
    void fetchReturnsTheBuildTimeText() {
        List<FetchResult> results = artifact.fetchChunks(report.chunkIds());

        assertEquals(TestCorpus.ALPHA_TEXT.substring(0, 50), results.get(0).chunk().text());
        assertEquals(TestCorpus.OMEGA_TEXT.substring(40, 80), results.get(4).chunk().text());
        assertEquals(TestCorpus.OMEGA_PATH, results.get(4).chunk().sourcePath());
        assertEquals("Omega", results.get(4).chunk().title());
    }

    @Test
    void batchFetchKeepsOrderAndReportsFailuresPerId() {
        String unknown = "0123456789abcdef";
        List<String> ids = List.of(report.chunkIds().get(1), unknown, report.chunkIds().get(3));

        List<FetchResult> results = artifact.fetchChunks(ids);

        assertEquals(3, results.size());
        assertEquals(ids, results.stream().map(FetchResult::chunkId).toList());
        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertEquals(ChunkFetchException.Reason.UNKNOWN_CHUNK_ID, results.get(1).failure());
        assertTrue(results.get(2).isSuccess());
    }

    @Test
    void retrieveExplainsMatches() {
        List<RetrievalResult> results = artifact.retrieve("Alpha gamma omega", 2);

        RetrievalResult top = results.get(0);
        assertEquals(1, top.rank());
        assertEquals(report.chunkIds().get(2), top.chunkId());
        assertTrue(top.isFetched());
        assertEquals(List.of("alpha", "gamma"), top.matchedTerms());
        assertTrue(top.snippet().startsWith("alpha beta gamma"));
    }

    @Test
    void contextCarriesCitationsInRankOrder() {
        AssembledContext context = artifact.context("alpha", 3);

        assertEquals(1, context.blocks().size());
        Citation citation = context.citations().get(0);
        assertEquals(TestCorpus.ALPHA_PATH, citation.sourcePath());
        assertEquals(100, citation.offsetStart());
        assertEquals(120, citation.offsetEnd());
        assertTrue(context.render(1000).startsWith("[docs/alpha.txt:100-120] alpha beta gamma"));
    }

    @Test
    void queryErrorsDoNotCloseTheHandle() {
        QueryException error = assertThrows(QueryException.class, () -> artifact.retrieveIds("... ---", 3));
        assertEquals(QueryException.Reason.TOKENIZATION_FAILURE, error.reason());
        assertThrows(IllegalArgumentException.class, () -> artifact.retrieveIds("beta", 0));

        assertFalse(artifact.retrieveIds("beta", 1).isEmpty());
    }

    @Test
    void statsDescribeTheArtifact() {
        ArtifactStats stats = artifact.stats();

        assertEquals("2.0", stats.schemaVersion());
        assertEquals(2, stats.totalDocs());
        assertEquals(5, stats.totalChunks());
        assertEquals(5, stats.activeChunks());
        assertEquals(ArtifactFiles.REQUIRED.size(), stats.fileSizes().size());
        assertTrue(stats.totalBytes() > 0);
        assertTrue(stats.vocabularySize() > 10);
    }

    @Test
    void closedHandleRejectsFurtherUse() throws IOException {
        artifact.close();

        assertTrue(artifact.isClosed());
        assertThrows(IllegalStateException.class, () -> artifact.retrieveIds("beta", 1));
        assertThrows(IllegalStateException.class, () -> artifact.fetchChunks(report.chunkIds()));
        artifact.close();
    }

    @Test
    void concurrentReadersSeeTheSameResults() throws Exception {
        List<ScoredChunk> expected = artifact.retrieveIds("beta alpha", 5);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<ScoredChunk>>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> {
                    artifact.fetchChunks(report.chunkIds());
                    return artifact.retrieveIds("beta alpha", 5);
                }));
            }
            for (Future<List<ScoredChunk>> future : futures) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}

package com.artifactrag.query;

import java.util.ArrayList;
import java.util.List;

/** Turns retrieval results into citation-carrying context blocks. Failed fetches are skipped. */
public class ContextAssembler {
    public AssembledContext assemble(String query, List<RetrievalResult> results) {
        List<ContextBlock> blocks = new ArrayList<>(results.size());
        for (RetrievalResult result : results) {
            if (!result.isFetched()) {
                continue;
            }
            FetchedChunk chunk = result.fetch().chunk();
            blocks.add(new ContextBlock(result.rank(), result.chunkId(), result.score(), chunk.text(), Citation.of(chunk)));
        }
        return new AssembledContext(query, blocks);
    }
}

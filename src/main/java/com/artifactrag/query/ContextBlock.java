package com.artifactrag.query;

public record ContextBlock(int rank, String chunkId, double score, String text, Citation citation) {
    public String render() {
        return "[" + citation.label() + "] " + text;
    }
}

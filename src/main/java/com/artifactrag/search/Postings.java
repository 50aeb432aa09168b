package com.artifactrag.search;

/**
 * Postings of one token: parallel arrays of chunk ordinals (ascending) and term frequencies. The
 * document frequency is the number of entries.
 */
public record Postings(int[] chunks, int[] termFrequencies) {
    public int docFreq() {
        return chunks.length;
    }
}

package com.artifactrag.build;

/** A page's character range {@code [start, end)} within the normalized text. */
public record Page(int number, int start, int end) {
    public boolean overlaps(int spanStart, int spanEnd) {
        return spanStart < end && start < spanEnd;
    }
}

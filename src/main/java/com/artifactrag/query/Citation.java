package com.artifactrag.query;

public record Citation(String sourcePath, String title, int offsetStart, int offsetEnd, Integer pageStart, Integer pageEnd) {
    public static Citation of(FetchedChunk chunk) {
        return new Citation(
                chunk.sourcePath(),
                chunk.title(),
                chunk.record().offsetStart(),
                chunk.record().offsetEnd(),
                chunk.record().pageStart(),
                chunk.record().pageEnd());
    }

    /** True when this citation's range shares at least one character with {@code [start, end)}. */
    public boolean overlaps(int start, int end) {
        return offsetStart < end && start < offsetEnd;
    }

    public String label() {
        StringBuilder label = new StringBuilder()
                .append(sourcePath).append(':').append(offsetStart).append('-').append(offsetEnd);
        if (pageStart != null) {
            label.append(" p.").append(pageStart);
            if (pageEnd != null && !pageEnd.equals(pageStart)) {
                label.append('-').append(pageEnd);
            }
        }
        return label.toString();
    }
}

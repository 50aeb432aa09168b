package com.artifactrag.query;

import java.util.List;

public record AssembledContext(String query, List<ContextBlock> blocks) {
    private static final String SEPARATOR = "\n\n";

    public AssembledContext {
        blocks = List.copyOf(blocks);
    }

    public List<Citation> citations() {
        return blocks.stream().map(ContextBlock::citation).toList();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    /**
     * Joins rendered blocks in rank order, stopping at the first block that would push the result
     * past {@code maxChars}. A first block longer than the limit is cut to fit.
     */
    public String render(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive, was " + maxChars);
        }
        StringBuilder out = new StringBuilder();
        for (ContextBlock block : blocks) {
            String rendered = block.render();
            if (out.length() == 0) {
                if (rendered.length() > maxChars) {
                    return rendered.substring(0, maxChars);
                }
                out.append(rendered);
                continue;
            }
            if (out.length() + SEPARATOR.length() + rendered.length() > maxChars) {
                break;
            }
            out.append(SEPARATOR).append(rendered);
        }
        return out.toString();
    }
}

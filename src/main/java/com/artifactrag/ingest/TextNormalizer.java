package com.artifactrag.ingest;

import java.text.Normalizer;
import java.util.regex.Pattern;

/** NFKC, LF line endings, single spaces, no leading or trailing whitespace. */
public class TextNormalizer {
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");

    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String text = Normalizer.normalize(raw, Normalizer.Form.NFKC);
        text = LINE_BREAK.matcher(text).replaceAll("\n");
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        return text.strip();
    }
}

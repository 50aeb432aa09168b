package com.artifactrag.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic identifiers for documents and chunks.
 *
 * <p>Every id is the first 16 hex characters (64 bits) of a SHA-256 digest over UTF-8 input:
 * <ul>
 *   <li>{@code doc_uid = sha256(normalizedPath)} stays stable while a document's content changes;</li>
 *   <li>{@code doc_id = sha256(doc_uid + sha256(normalizedText))} changes with the content;</li>
 *   <li>{@code chunk_id = sha256(doc_uid + offsetStart + offsetEnd + sha256(chunkText))} stays stable as
 *       long as the span and its text are unchanged.</li>
 * </ul>
 * Offsets are rendered in decimal. None of these functions carry state.
 */
public final class ArtifactIds {
    public static final int ID_LENGTH = 16;

    private static final Pattern ID_PATTERN = Pattern.compile("[0-9a-f]{" + ID_LENGTH + "}");

    private ArtifactIds() {
    }

    public static String docUid(String relativePath) {
        Objects.requireNonNull(relativePath, "relativePath");
        return truncate(Hashing.sha256Hex(normalizePath(relativePath)));
    }

    public static String docId(String docUid, String normalizedTextHash) {
        Objects.requireNonNull(docUid, "docUid");
        Objects.requireNonNull(normalizedTextHash, "normalizedTextHash");
        return truncate(Hashing.sha256Hex(docUid + normalizedTextHash));
    }

    public static String chunkId(String docUid, long offsetStart, long offsetEnd, String chunkText) {
        Objects.requireNonNull(docUid, "docUid");
        Objects.requireNonNull(chunkText, "chunkText");
        String textHash = Hashing.sha256Hex(chunkText);
        return truncate(Hashing.sha256Hex(docUid + offsetStart + offsetEnd + textHash));
    }

    /**
     * Canonical form of a corpus-relative path: forward slashes, {@code .} segments removed and
     * {@code ..} resolved against the preceding segment.
     */
    public static String normalizePath(String relativePath) {
        String slashed = relativePath.replace('\\', '/');
        Deque<String> parts = new ArrayDeque<>();
        for (String part : slashed.split("/", -1)) {
            if (".".equals(part)) {
                continue;
            }
            if ("..".equals(part)) {
                if (!parts.isEmpty()) {
                    parts.removeLast();
                }
                continue;
            }
            parts.addLast(part);
        }
        return String.join("/", parts);
    }

    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    private static String truncate(String hex) {
        return hex.substring(0, ID_LENGTH);
    }
}

package com.artifactrag.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactIdsTest {

    @Test
    void idsAreSixteenLowercaseHexCharacters() {
        String docUid = ArtifactIds.docUid("guides/setup.txt");
        String docId = ArtifactIds.docId(docUid, Hashing.sha256Hex("body"));
        String chunkId = ArtifactIds.chunkId(docUid, 0, 4, "body");

        assertTrue(ArtifactIds.isValidId(docUid));
        assertTrue(ArtifactIds.isValidId(docId));
        assertTrue(ArtifactIds.isValidId(chunkId));
    }

    @Test
    void docUidIsTheTruncatedHashOfTheNormalizedPath() {
        assertEquals(Hashing.sha256Hex("guides/setup.txt").substring(0, 16), ArtifactIds.docUid("guides/setup.txt"));
        assertEquals(ArtifactIds.docUid("guides/setup.txt"), ArtifactIds.docUid("guides\\setup.txt"));
        assertEquals(ArtifactIds.docUid("guides/setup.txt"), ArtifactIds.docUid("./guides/old/../setup.txt"));
    }

    @Test
    void docIdChangesWithContentButDocUidDoesNot() {
        String docUid = ArtifactIds.docUid("notes.md");
        String before = ArtifactIds.docId(docUid, Hashing.sha256Hex("first draft"));
        String after = ArtifactIds.docId(docUid, Hashing.sha256Hex("second draft"));

        assertNotEquals(before, after);
        assertEquals(docUid, ArtifactIds.docUid("notes.md"));
    }

    @Test
    void chunkIdDependsOnOffsetsAndText() {
        String docUid = ArtifactIds.docUid("notes.md");
        String base = ArtifactIds.chunkId(docUid, 10, 20, "0123456789");

        assertEquals(base, ArtifactIds.chunkId(docUid, 10, 20, "0123456789"));
        assertNotEquals(base, ArtifactIds.chunkId(docUid, 11, 21, "0123456789"));
        assertNotEquals(base, ArtifactIds.chunkId(docUid, 10, 20, "012345678X"));
        assertNotEquals(base, ArtifactIds.chunkId(ArtifactIds.docUid("other.md"), 10, 20, "0123456789"));
    }

    @Test
    void chunkIdHashesDecimalOffsetsAndTextDigest() {
        String docUid = ArtifactIds.docUid("a.txt");
        String expected = Hashing.sha256Hex(docUid + "3" + "17" + Hashing.sha256Hex("text")).substring(0, 16);

        assertEquals(expected, ArtifactIds.chunkId(docUid, 3, 17, "text"));
    }

    @Test
    void normalizePathResolvesDotSegments() {
        assertEquals("a/c.txt", ArtifactIds.normalizePath("a/b/../c.txt"));
        assertEquals("a/c.txt", ArtifactIds.normalizePath("./a/./c.txt"));
        assertEquals("c.txt", ArtifactIds.normalizePath("../c.txt"));
        assertEquals("dir/file.txt", ArtifactIds.normalizePath("dir\\file.txt"));
    }

    @Test
    void rejectsMalformedIds() {
        assertFalse(ArtifactIds.isValidId(null));
        assertFalse(ArtifactIds.isValidId("ABCDEF0123456789"));
        assertFalse(ArtifactIds.isValidId("abc"));
        assertFalse(ArtifactIds.isValidId("0123456789abcdefa"));
    }
}

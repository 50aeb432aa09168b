package com.artifactrag;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.artifactrag.core.ArtifactFiles;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private Path corpus;
    private Path artifact;
    private Path config;
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();

    @BeforeEach
    void writeCorpus() throws IOException {
        corpus = tempDir.resolve("corpus");
        artifact = tempDir.resolve("artifact");
        config = tempDir.resolve("missing.yml");
        Files.createDirectories(corpus.resolve("guides"));
        Files.writeString(corpus.resolve("guides/install.md"), "# Installing\nRun the installer and accept the license.");
        Files.writeString(corpus.resolve("faq.txt"), "Frequently asked questions\nThe license is permissive.");
    }

    @Test
    void shouldBuildThenQueryAnArtifact() {
        assertEquals(0, run("--mode", "build", "--corpus", corpus.toString(), "--artifact", artifact.toString(),
                "--set", "chunk_size=8", "--set", "chunk_overlap=2"));
        assertTrue(Files.isRegularFile(artifact.resolve(ArtifactFiles.MANIFEST)));
        assertTrue(output().contains("2 documents"));

        assertEquals(0, run("--mode", "query", "--artifact", artifact.toString(), "--query", "installer", "--top-k", "3"));
        assertTrue(output().contains("guides/install.md"));

        assertEquals(0, run("--mode", "context", "--artifact", artifact.toString(), "--query", "license"));
        assertTrue(output().contains("[faq.txt:"));

        assertEquals(0, run("--mode", "validate", "--artifact", artifact.toString(), "--validation", "STRICT"));
        assertTrue(output().contains("valid (STRICT)"));
    }

    @Test
    void shouldFailValidationOfMissingArtifact() {
        assertEquals(1, run("--mode", "validate", "--artifact", tempDir.resolve("nothing").toString()));
    }

    @Test
    void shouldReportWarningsWhenDataHeaderIsDamaged() throws IOException {
        assertEquals(0, run("--mode", "build", "--corpus", corpus.toString(), "--artifact", artifact.toString()));
        Path data = artifact.resolve(ArtifactFiles.CHUNKS_BIN);
        byte[] bytes = Files.readAllBytes(data);
        bytes[0] ^= 0x5A;
        Files.write(data, bytes);

        assertEquals(0, run("--mode", "validate", "--artifact", artifact.toString(), "--validation", "NORMAL"));
        assertTrue(output().contains("1 warning(s)"));
        assertTrue(output().contains("chunks.bin"));

        assertEquals(1, run("--mode", "validate", "--artifact", artifact.toString(), "--validation", "STRICT"));
    }

    @Test
    void shouldRejectUnknownBuildOption() {
        assertEquals(2, run("--mode", "build", "--corpus", corpus.toString(), "--artifact", artifact.toString(),
                "--set", "embedding_model=minilm"));
        assertFalse(Files.exists(artifact));
    }

    @Test
    void shouldRequireQueryText() {
        assertEquals(2, run("--mode", "query", "--artifact", artifact.toString()));
    }

    @Test
    void shouldRejectUnknownMode() {
        assertEquals(2, run("--mode", "serve", "--artifact", artifact.toString()));
    }

    private int run(String... args) {
        captured.reset();
        Main main = new Main(new PrintStream(captured, true, StandardCharsets.UTF_8));
        return new CommandLine(main).execute(prependConfig(args));
    }

    private String[] prependConfig(String... args) {
        String[] all = new String[args.length + 2];
        all[0] = "--config";
        all[1] = config.toString();
        System.arraycopy(args, 0, all, 2, args.length);
        return all;
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }
}

package com.artifactrag.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.artifactrag.build.Page;
import com.artifactrag.build.SourceDocument;
import com.artifactrag.core.ArtifactIds;

/**
 * Reads {@code .txt} and {@code .md} files under a directory into build input. Files come back in
 * relative-path order; form feeds in the text mark page boundaries.
 */
public class TextCorpusReader {
    private static final Logger log = LoggerFactory.getLogger(TextCorpusReader.class);

    static final int MAX_TITLE_LENGTH = 120;
    private static final List<String> EXTENSIONS = List.of(".txt", ".md");
    private static final char PAGE_BREAK = '\f';

    private final TextNormalizer normalizer;
    private final FixedSizeChunker chunker;

    public TextCorpusReader(TextNormalizer normalizer, FixedSizeChunker chunker) {
        this.normalizer = normalizer;
        this.chunker = chunker;
    }

    public List<SourceDocument> read(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("corpus directory not found: " + root);
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk
                    .filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted(Comparator.comparing((Path file) -> relativePath(root, file)))
                    .toList();
        }

        List<SourceDocument> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            String relative = relativePath(root, file);
            String text = normalizer.normalize(Files.readString(file, StandardCharsets.UTF_8));
            documents.add(new SourceDocument(
                    relative,
                    title(text, file),
                    text,
                    chunker.chunk(text),
                    pages(text),
                    Files.getLastModifiedTime(file).toInstant()));
        }
        log.info("Read {} documents from {}", documents.size(), root);
        return documents;
    }

    static List<Page> pages(String text) {
        if (text.indexOf(PAGE_BREAK) < 0) {
            return List.of();
        }
        List<Page> pages = new ArrayList<>();
        int start = 0;
        int number = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == PAGE_BREAK) {
                pages.add(new Page(number++, start, i));
                start = i + 1;
            }
        }
        pages.add(new Page(number, start, text.length()));
        return pages;
    }

    static String title(String text, Path file) {
        for (String line : text.split("\n")) {
            String stripped = line.replace(PAGE_BREAK, ' ').strip();
            if (stripped.startsWith("#")) {
                stripped = stripped.replaceFirst("^#+\\s*", "");
            }
            if (!stripped.isEmpty()) {
                return stripped.length() > MAX_TITLE_LENGTH ? stripped.substring(0, MAX_TITLE_LENGTH) : stripped;
            }
        }
        return file.getFileName().toString();
    }

    private boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private static String relativePath(Path root, Path file) {
        return ArtifactIds.normalizePath(root.relativize(file).toString());
    }
}

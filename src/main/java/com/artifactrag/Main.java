package com.artifactrag;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.artifactrag.build.BuildException;
import com.artifactrag.build.BuildPipeline;
import com.artifactrag.build.BuildReport;
import com.artifactrag.build.SourceDocument;
import com.artifactrag.eval.EvaluationReport;
import com.artifactrag.eval.QueryOutcome;
import com.artifactrag.eval.RetrievalEvaluator;
import com.artifactrag.ingest.FixedSizeChunker;
import com.artifactrag.ingest.TextCorpusReader;
import com.artifactrag.ingest.TextNormalizer;
import com.artifactrag.manifest.ArtifactException;
import com.artifactrag.manifest.ValidationMode;
import com.artifactrag.query.ArtifactStats;
import com.artifactrag.query.Artifact;
import com.artifactrag.query.AssembledContext;
import com.artifactrag.query.RetrievalResult;
import com.artifactrag.runtime.AppConfig;
import com.artifactrag.runtime.BuildConfig;
import com.artifactrag.search.QueryException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "artifact-rag",
        mixinStandardHelpOptions = true,
        version = "artifact-rag 0.1.0",
        description = "Builds and queries self-contained retrieval artifacts.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Option(names = "--corpus", description = "Directory of .txt/.md files to build from")
    Path corpus;

    @Option(names = "--artifact", description = "Artifact directory to build into or open")
    Path artifactPath;

    @Option(names = "--query", description = "Query text for query, context modes")
    String query;

    @Option(names = "--top-k", description = "Results to return (default from config)")
    Integer topK;

    @Option(names = "--validation", description = "Validation mode when opening: ${COMPLETION-CANDIDATES}")
    ValidationMode validation;

    @Option(names = "--max-chars", description = "Character limit for rendered context (default from config)")
    Integer maxChars;

    @Option(names = "--judgments", description = "JSON relevance judgments for evaluate mode")
    Path judgments;

    @Option(names = "--set", description = "Build option override, e.g. --set chunk_size=256")
    Map<String, String> buildOverrides = new LinkedHashMap<>();

    private final PrintStream out;

    enum Mode {
        build,
        query,
        context,
        validate,
        evaluate
    }

    public Main() {
        this(System.out);
    }

    Main(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = AppConfig.load(configPath);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 2;
        }
        if (artifactPath == null) {
            log.error("--artifact is required");
            return 2;
        }
        log.info("Running {} mode against {}", mode, artifactPath);

        try {
            return switch (mode) {
                case build -> runBuild(config);
                case query -> runQuery(config);
                case context -> runContext(config);
                case validate -> runValidate(config);
                case evaluate -> runEvaluate(config);
            };
        } catch (BuildException | ArtifactException e) {
            log.error("{} failed: {}", mode, e.getMessage());
            return 1;
        } catch (QueryException e) {
            log.error("Query failed ({}): {}", e.reason(), e.getMessage());
            return 1;
        }
    }

    private int runBuild(AppConfig config) throws IOException {
        if (corpus == null) {
            log.error("--corpus is required in build mode");
            return 2;
        }
        BuildConfig buildConfig;
        try {
            buildConfig = withOverrides(config.getBuild());
        } catch (IllegalArgumentException e) {
            log.error("Invalid build option: {}", e.getMessage());
            return 2;
        }
        TextCorpusReader reader = new TextCorpusReader(
                new TextNormalizer(),
                new FixedSizeChunker(buildConfig.getChunkSize(), buildConfig.getChunkOverlap()));
        List<SourceDocument> documents = reader.read(corpus);
        BuildReport report = new BuildPipeline(buildConfig).build(documents, artifactPath);
        out.printf("built %s: %d documents, %d chunks (%d active) in %d ms%n",
                report.destination(), report.totalDocs(), report.totalChunks(), report.activeChunks(), report.elapsed().toMillis());
        return 0;
    }

    private int runQuery(AppConfig config) throws IOException {
        if (query == null || query.isBlank()) {
            log.error("--query is required in query mode");
            return 2;
        }
        try (Artifact artifact = Artifact.open(artifactPath, validationMode(config))) {
            for (RetrievalResult result : artifact.retrieve(query, topK(config))) {
                if (result.isFetched()) {
                    out.printf("#%d %s %.4f %s terms=%s %s%n",
                            result.rank(),
                            result.chunkId(),
                            result.score(),
                            result.fetch().chunk().sourcePath(),
                            result.matchedTerms(),
                            result.snippet());
                } else {
                    out.printf("#%d %s %.4f unavailable: %s%n", result.rank(), result.chunkId(), result.score(), result.fetch().failure());
                }
            }
        }
        return 0;
    }

    private int runContext(AppConfig config) throws IOException {
        if (query == null || query.isBlank()) {
            log.error("--query is required in context mode");
            return 2;
        }
        int limit = maxChars != null ? maxChars : config.getQuery().getContextMaxChars();
        try (Artifact artifact = Artifact.open(artifactPath, validationMode(config))) {
            AssembledContext context = artifact.context(query, topK(config));
            out.println(context.render(limit));
        }
        return 0;
    }

    private int runValidate(AppConfig config) throws IOException {
        try (Artifact artifact = Artifact.open(artifactPath, validationMode(config))) {
            ArtifactStats stats = artifact.stats();
            out.printf("valid (%s): schema %s, %d documents, %d chunks (%d active), %d terms, %d bytes, opened in %d ms%n",
                    artifact.validation().mode(),
                    stats.schemaVersion(),
                    stats.totalDocs(),
                    stats.totalChunks(),
                    stats.activeChunks(),
                    stats.vocabularySize(),
                    stats.totalBytes(),
                    stats.coldStartMillis());
            if (artifact.validation().hasWarnings()) {
                out.printf("%d warning(s):%n", artifact.warnings().size());
                artifact.warnings().forEach(warning -> out.println("warning: " + warning));
            }
        }
        return 0;
    }

    private int runEvaluate(AppConfig config) throws IOException {
        if (judgments == null) {
            log.error("--judgments is required in evaluate mode");
            return 2;
        }
        RetrievalEvaluator evaluator = new RetrievalEvaluator();
        try (Artifact artifact = Artifact.open(artifactPath, validationMode(config))) {
            EvaluationReport report = evaluator.evaluate(artifact, evaluator.loadJudgments(judgments), topK(config));
            for (QueryOutcome outcome : report.outcomes()) {
                out.printf("%s rank=%d %s%n", outcome.id(), outcome.firstRelevantRank(), outcome.query());
            }
            out.printf("recall@%d=%.4f mrr=%.4f%n", report.k(), report.recallAtK(), report.meanReciprocalRank());
        }
        return 0;
    }

    private BuildConfig withOverrides(BuildConfig base) {
        if (buildOverrides.isEmpty()) {
            return base.copy().validate();
        }
        ObjectMapper mapper = new ObjectMapper();
        Map<String, Object> options = mapper.convertValue(base, new TypeReference<Map<String, Object>>() {
        });
        options.putAll(buildOverrides);
        return BuildConfig.fromOptions(options);
    }

    private ValidationMode validationMode(AppConfig config) {
        return validation != null ? validation : config.getQuery().getValidationMode();
    }

    private int topK(AppConfig config) {
        return topK != null ? topK : config.getQuery().getDefaultTopK();
    }
}

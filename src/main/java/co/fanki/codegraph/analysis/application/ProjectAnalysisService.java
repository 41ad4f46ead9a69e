package co.fanki.codegraph.analysis.application;

import co.fanki.codegraph.analysis.domain.GraphBuilder;
import co.fanki.codegraph.analysis.domain.ImportResolver;
import co.fanki.codegraph.analysis.domain.JsSourceAnalyzer;
import co.fanki.codegraph.analysis.domain.ModuleCollections;
import co.fanki.codegraph.analysis.domain.ProjectFiles;
import co.fanki.codegraph.analysis.domain.SourceFile;
import co.fanki.codegraph.enrichment.domain.Enricher;
import co.fanki.codegraph.enrichment.domain.EnrichmentResult;
import co.fanki.codegraph.graph.domain.GraphBackend;
import co.fanki.codegraph.shared.DomainException;
import co.fanki.codegraph.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs one analysis batch over a project directory.
 *
 * <p>Flow:</p>
 * <ol>
 *   <li>Discover the supported files under the root</li>
 *   <li>Skip files above the size limit</li>
 *   <li>Analyze and build each file on a fixed worker pool; a file that
 *       fails to parse or validate is reported and contributes nothing</li>
 *   <li>Run every enricher, in order, once all files are built</li>
 * </ol>
 *
 * <p>This service does not guard against concurrent batches on the same
 * graph; {@link AnalysisCoordinator} does.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ProjectAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectAnalysisService.class);

    private final JsSourceAnalyzer analyzer;
    private final GraphBuilder builder;
    private final GraphBackend backend;
    private final List<Enricher> enrichers;
    private final int workerThreads;
    private final long maxFileSizeBytes;

    /**
     * Creates a new ProjectAnalysisService.
     *
     * @param theAnalyzer the per-file analyzer
     * @param theBuilder the graph builder
     * @param theBackend the graph backend, read for the final counts
     * @param theEnrichers the enrichment passes, in run order
     * @param theWorkerThreads the size of the analysis pool
     * @param theMaxFileSizeBytes files larger than this are skipped
     */
    public ProjectAnalysisService(
            final JsSourceAnalyzer theAnalyzer,
            final GraphBuilder theBuilder,
            final GraphBackend theBackend,
            final List<Enricher> theEnrichers,
            @Value("${analysis.worker-threads:4}") final int theWorkerThreads,
            @Value("${analysis.max-file-size-bytes:1048576}")
            final long theMaxFileSizeBytes) {
        analyzer = Preconditions.requireNonNull(theAnalyzer,
                "Analyzer is required");
        builder = Preconditions.requireNonNull(theBuilder,
                "Builder is required");
        backend = Preconditions.requireNonNull(theBackend,
                "Graph backend is required");
        enrichers = List.copyOf(Preconditions.requireNonNull(theEnrichers,
                "Enrichers are required"));
        workerThreads = Preconditions.requirePositive(theWorkerThreads,
                "Worker threads must be positive");
        Preconditions.require(theMaxFileSizeBytes > 0,
                "Max file size must be positive");
        maxFileSizeBytes = theMaxFileSizeBytes;
    }

    /**
     * Analyzes every supported file under a directory and enriches the
     * resulting graph.
     *
     * @param projectRoot the project directory, never null
     * @return the batch report
     * @throws IllegalArgumentException if the root is not a directory
     * @throws DomainException if the directory cannot be walked
     */
    public AnalysisReport analyze(final Path projectRoot) {
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        Preconditions.require(Files.isDirectory(projectRoot),
                "Project root is not a directory: " + projectRoot);

        final long startTime = System.currentTimeMillis();
        final List<Path> discovered = discover(projectRoot);
        LOG.info("Found {} source files under {}", discovered.size(),
                projectRoot);

        final List<Path> files = new ArrayList<>();
        final List<String> skipped = new ArrayList<>();
        for (final Path file : discovered) {
            final String relativePath = ProjectFiles.relativePath(projectRoot,
                    file);
            if (sizeOf(file) > maxFileSizeBytes) {
                LOG.info("Skipping large file: {}", relativePath);
                skipped.add(relativePath);
            } else {
                files.add(file);
            }
        }

        final Set<String> knownFiles = new LinkedHashSet<>();
        files.forEach(file -> knownFiles.add(
                ProjectFiles.relativePath(projectRoot, file)));
        final ImportResolver resolver = new ImportResolver(knownFiles);

        final List<FileAnalysisFailure> failures = analyzeAll(projectRoot,
                files, resolver);
        final int analyzed = files.size() - failures.size();
        LOG.info("Analyzed {} files, {} failed, {} skipped", analyzed,
                failures.size(), skipped.size());

        final List<EnrichmentResult> enrichments = new ArrayList<>();
        for (final Enricher enricher : enrichers) {
            final EnrichmentResult result = enricher.enrich();
            LOG.info("Enricher {} added {} edges in {} rounds (converged: {})",
                    result.enricher(), result.edgesCreated(),
                    result.iterations(), result.converged());
            enrichments.add(result);
        }

        final long duration = System.currentTimeMillis() - startTime;
        LOG.info("Analysis of {} completed in {} ms", projectRoot, duration);

        return new AnalysisReport(projectRoot.toString(), discovered.size(),
                analyzed, skipped, failures, backend.countNodesByType(),
                backend.countEdgesByType(), enrichments, duration);
    }

    private List<FileAnalysisFailure> analyzeAll(final Path projectRoot,
            final List<Path> files, final ImportResolver resolver) {

        final List<FileAnalysisFailure> failures = new ArrayList<>();
        final ExecutorService executor = Executors.newFixedThreadPool(
                workerThreads);
        try {
            final List<Future<Optional<FileAnalysisFailure>>> futures =
                    new ArrayList<>(files.size());
            for (final Path file : files) {
                futures.add(executor.submit(() -> analyzeFile(projectRoot,
                        file, resolver)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get().ifPresent(failures::add);
                } catch (final ExecutionException e) {
                    final String file = ProjectFiles.relativePath(projectRoot,
                            files.get(i));
                    LOG.error("Unexpected error analyzing {}", file,
                            e.getCause());
                    failures.add(new FileAnalysisFailure(file,
                            "UNEXPECTED_ERROR",
                            String.valueOf(e.getCause().getMessage())));
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DomainException("Analysis interrupted",
                    "ANALYSIS_INTERRUPTED", e);
        } finally {
            executor.shutdownNow();
        }
        return failures;
    }

    private Optional<FileAnalysisFailure> analyzeFile(final Path projectRoot,
            final Path file, final ImportResolver resolver) {

        final String relativePath = ProjectFiles.relativePath(projectRoot,
                file);
        try {
            final String content = Files.readString(file,
                    StandardCharsets.UTF_8);
            final ModuleCollections collections = analyzer.analyze(
                    new SourceFile(relativePath, content), resolver);
            builder.build(collections);
            return Optional.empty();
        } catch (final IOException e) {
            LOG.warn("Failed to read file: {}", relativePath, e);
            return Optional.of(new FileAnalysisFailure(relativePath,
                    "READ_FAILURE", String.valueOf(e.getMessage())));
        } catch (final DomainException e) {
            LOG.warn("Failed to analyze file {}: {}", relativePath,
                    e.getMessage());
            return Optional.of(new FileAnalysisFailure(relativePath,
                    e.getErrorCode(), e.getMessage()));
        }
    }

    private List<Path> discover(final Path projectRoot) {
        try {
            return ProjectFiles.discover(projectRoot);
        } catch (final IOException e) {
            throw new DomainException("Failed to list files under "
                    + projectRoot, "PROJECT_READ_FAILURE", e);
        }
    }

    private long sizeOf(final Path file) {
        try {
            return Files.size(file);
        } catch (final IOException e) {
            throw new DomainException("Failed to read size of " + file,
                    "PROJECT_READ_FAILURE", e);
        }
    }

}

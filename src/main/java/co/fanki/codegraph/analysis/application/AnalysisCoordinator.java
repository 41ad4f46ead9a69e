package co.fanki.codegraph.analysis.application;

import co.fanki.codegraph.graph.domain.GraphBackend;
import co.fanki.codegraph.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes analysis batches against the graph.
 *
 * <p>Only one batch runs at a time. A regular request waits for the
 * running batch, up to a bounded timeout. A forced request clears the
 * graph before analyzing, so it never waits: it fails right away when a
 * batch is in flight. The clear happens while the lock is held and before
 * any file is analyzed.</p>
 *
 * <p>The lock lives in memory; a restarted process starts unlocked.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class AnalysisCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisCoordinator.class);

    private final ReentrantLock lock = new ReentrantLock(true);

    private final ProjectAnalysisService analysisService;
    private final GraphBackend backend;
    private final long lockTimeoutSeconds;

    private volatile String currentProject;
    private volatile AnalysisReport lastReport;

    /**
     * Creates a new AnalysisCoordinator.
     *
     * @param theAnalysisService the batch pipeline
     * @param theBackend the graph backend, cleared by forced runs
     * @param theLockTimeoutSeconds how long a regular request waits
     */
    public AnalysisCoordinator(
            final ProjectAnalysisService theAnalysisService,
            final GraphBackend theBackend,
            @Value("${analysis.lock-timeout-seconds:300}")
            final long theLockTimeoutSeconds) {
        analysisService = Preconditions.requireNonNull(theAnalysisService,
                "Analysis service is required");
        backend = Preconditions.requireNonNull(theBackend,
                "Graph backend is required");
        Preconditions.require(theLockTimeoutSeconds > 0,
                "Lock timeout must be positive");
        lockTimeoutSeconds = theLockTimeoutSeconds;
    }

    /**
     * Runs an analysis batch once the graph is free.
     *
     * @param projectRoot the project directory, never null
     * @param force whether to clear the graph first
     * @return the batch report
     * @throws AnalysisConflictException if a forced run meets a running
     *         batch, or a regular run times out waiting
     */
    public AnalysisReport analyze(final Path projectRoot,
            final boolean force) {
        Preconditions.requireNonNull(projectRoot, "Project root is required");

        acquire(force);
        try {
            currentProject = projectRoot.toString();
            if (force) {
                LOG.info("Forced analysis of {}, clearing the graph",
                        projectRoot);
                backend.clear();
            }
            final AnalysisReport report = analysisService.analyze(projectRoot);
            lastReport = report;
            return report;
        } finally {
            currentProject = null;
            lock.unlock();
        }
    }

    /**
     * Returns what the coordinator is doing.
     *
     * @return the current status
     */
    public AnalysisStatus status() {
        return new AnalysisStatus(lock.isLocked(), currentProject, lastReport);
    }

    private void acquire(final boolean force) {
        if (force) {
            if (!lock.tryLock()) {
                throw AnalysisConflictException.inProgress(currentProject);
            }
            return;
        }
        try {
            if (!lock.tryLock(lockTimeoutSeconds, TimeUnit.SECONDS)) {
                LOG.warn("Gave up waiting {}s for the running analysis of {}",
                        lockTimeoutSeconds, currentProject);
                throw AnalysisConflictException.lockTimeout(
                        lockTimeoutSeconds);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AnalysisConflictException.lockTimeout(lockTimeoutSeconds);
        }
    }

}

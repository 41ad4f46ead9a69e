package co.fanki.codegraph.analysis.application;

import co.fanki.codegraph.shared.DomainException;

/**
 * Raised when an analysis request cannot run because another one holds the
 * graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalysisConflictException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** A forced run was requested while another run is in flight. */
    public static final String IN_PROGRESS = "ANALYSIS_IN_PROGRESS";

    /** The wait for the running analysis exceeded its bound. */
    public static final String LOCK_TIMEOUT = "ANALYSIS_LOCK_TIMEOUT";

    private AnalysisConflictException(final String message,
            final String errorCode) {
        super(message, errorCode);
    }

    /**
     * A forced run cannot start while another run is in flight.
     *
     * @param runningPath the root of the running analysis, may be null
     * @return the exception
     */
    public static AnalysisConflictException inProgress(
            final String runningPath) {
        return new AnalysisConflictException("An analysis of "
                + (runningPath == null ? "another project" : runningPath)
                + " is in progress; wait for it to finish or poll"
                + " /api/analysis/status before forcing a new run",
                IN_PROGRESS);
    }

    /**
     * The running analysis did not release the graph in time.
     *
     * @param timeoutSeconds the wait bound
     * @return the exception
     */
    public static AnalysisConflictException lockTimeout(
            final long timeoutSeconds) {
        return new AnalysisConflictException("Timed out after "
                + timeoutSeconds + "s waiting for the running analysis;"
                + " check the logs for a stuck run or restart the service",
                LOCK_TIMEOUT);
    }

}

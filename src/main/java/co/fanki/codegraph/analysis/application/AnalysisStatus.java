package co.fanki.codegraph.analysis.application;

/**
 * What the coordinator is doing.
 *
 * @param running whether a batch holds the graph
 * @param currentProject the root of the running batch, null when idle
 * @param lastReport the report of the last finished batch, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisStatus(boolean running, String currentProject,
        AnalysisReport lastReport) {
}

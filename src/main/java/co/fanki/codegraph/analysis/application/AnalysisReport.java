package co.fanki.codegraph.analysis.application;

import co.fanki.codegraph.enrichment.domain.EnrichmentResult;
import co.fanki.codegraph.graph.domain.EdgeType;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.List;
import java.util.Map;

/**
 * Summary of one analysis batch.
 *
 * <p>A batch succeeds even when some files failed or an enrichment pass
 * did not converge; both are reported here.</p>
 *
 * @param projectRoot the analyzed directory
 * @param filesDiscovered the number of supported files found
 * @param filesAnalyzed the number of files written to the graph
 * @param skippedFiles files skipped for exceeding the size limit
 * @param failures files that could not be analyzed
 * @param nodesByType node counts of the graph after the batch
 * @param edgesByType edge counts of the graph after the batch
 * @param enrichments the result of every enrichment pass, in run order
 * @param durationMillis the wall time of the batch
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisReport(
        String projectRoot,
        int filesDiscovered,
        int filesAnalyzed,
        List<String> skippedFiles,
        List<FileAnalysisFailure> failures,
        Map<NodeType, Long> nodesByType,
        Map<EdgeType, Long> edgesByType,
        List<EnrichmentResult> enrichments,
        long durationMillis) {

    /** Creates a report, copying the collections. */
    public AnalysisReport {
        skippedFiles = List.copyOf(skippedFiles);
        failures = List.copyOf(failures);
        nodesByType = Map.copyOf(nodesByType);
        edgesByType = Map.copyOf(edgesByType);
        enrichments = List.copyOf(enrichments);
    }

    /**
     * Whether every enrichment pass reached its fixpoint.
     *
     * @return true when no pass stopped at its bound
     */
    public boolean converged() {
        return enrichments.stream().allMatch(EnrichmentResult::converged);
    }

}

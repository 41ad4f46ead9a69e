package co.fanki.codegraph.enrichment.domain;

import co.fanki.codegraph.shared.Preconditions;

/**
 * The outcome of one enrichment pass.
 *
 * <p>A pass that stopped at its iteration bound reports
 * {@code converged = false}. What it added is still correct, only
 * incomplete.</p>
 *
 * @param enricher the name of the pass
 * @param edgesCreated the number of edges added
 * @param converged whether the last round added nothing
 * @param iterations the number of rounds run
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EnrichmentResult(String enricher, int edgesCreated,
        boolean converged, int iterations) {

    /** Creates a result. */
    public EnrichmentResult {
        Preconditions.requireNonBlank(enricher, "Enricher name is required");
        Preconditions.require(edgesCreated >= 0,
                "Edges created cannot be negative");
        Preconditions.require(iterations >= 0,
                "Iterations cannot be negative");
    }

}

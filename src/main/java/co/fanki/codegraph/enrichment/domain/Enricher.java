package co.fanki.codegraph.enrichment.domain;

/**
 * A whole-graph pass that runs after every file of a batch has been built
 * and adds facts no single file can produce on its own.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Enricher {

    /**
     * The name used in logs and reports.
     *
     * @return the enricher name, never null
     */
    String name();

    /**
     * Runs the pass against the graph.
     *
     * @return what the pass added and whether it reached a fixpoint
     */
    EnrichmentResult enrich();

}

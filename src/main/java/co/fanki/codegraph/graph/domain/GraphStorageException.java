package co.fanki.codegraph.graph.domain;

import co.fanki.codegraph.shared.DomainException;

/**
 * Thrown when the graph backend rejects or fails a write.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphStorageException extends DomainException {

    private static final long serialVersionUID = 1L;

    public GraphStorageException(final String message) {
        super(message, "GRAPH_STORAGE");
    }

    public GraphStorageException(final String message, final Throwable cause) {
        super(message, "GRAPH_STORAGE", cause);
    }

}

package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.shared.DomainException;

/**
 * Thrown when a node contract is called without a required field.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NodeValidationException extends DomainException {

    private static final long serialVersionUID = 1L;

    public NodeValidationException(final String message) {
        super(message, "NODE_VALIDATION");
    }

}

package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.DomainException;

/**
 * Thrown when a source file cannot be parsed. The file contributes no
 * nodes or edges to the graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceParseException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final String file;

    public SourceParseException(final String theFile, final String message) {
        super(theFile + ": " + message, "PARSE_FAILURE");
        file = theFile;
    }

    public String file() {
        return file;
    }

}

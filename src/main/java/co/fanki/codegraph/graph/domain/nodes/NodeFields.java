package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;

/**
 * Required field checks shared by the node contracts. A missing field is
 * a contract violation, never defaulted.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class NodeFields {

    private NodeFields() {
    }

    static String name(final NodeType type, final String name) {
        if (name == null || name.isBlank()) {
            throw new NodeValidationException(type + " node requires a name");
        }
        return name;
    }

    static String file(final NodeType type, final String file) {
        if (file == null || file.isBlank()) {
            throw new NodeValidationException(type + " node requires a file");
        }
        return file;
    }

    static int line(final NodeType type, final Integer line) {
        if (line == null || line < 0) {
            throw new NodeValidationException(type
                    + " node requires a non negative line, got " + line);
        }
        return line;
    }

    static int column(final NodeType type, final Integer column) {
        if (column == null || column < 0) {
            throw new NodeValidationException(type
                    + " node requires a non negative column, got " + column);
        }
        return column;
    }

    static ScopeContext context(final NodeType type,
            final ScopeContext context) {
        if (context == null) {
            throw new NodeValidationException(type
                    + " node requires a scope context");
        }
        return context;
    }

    static int discriminator(final NodeType type, final int discriminator) {
        if (discriminator < 0) {
            throw new NodeValidationException(type
                    + " discriminator must not be negative");
        }
        return discriminator;
    }

}

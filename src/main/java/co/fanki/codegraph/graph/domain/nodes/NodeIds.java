package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;

/**
 * The two id formats of the graph. Package private: node ids are minted
 * by the contracts of this package only.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class NodeIds {

    private static final String SEPARATOR = "->";

    private NodeIds() {
    }

    /**
     * {@code {file}:{TYPE}:{name}:{line}:{column}}.
     */
    static String positional(final NodeType type, final String name,
            final String file, final int line, final int column) {
        return file + ':' + type.name() + ':' + name + ':' + line + ':'
                + column;
    }

    /**
     * {@code {file}->{scope->...|global}->{TYPE}->{name}[#n]}.
     */
    static String semantic(final NodeType type, final String name,
            final ScopeContext context, final int discriminator) {
        final StringBuilder id = new StringBuilder(context.file());
        id.append(SEPARATOR);
        if (context.isGlobal()) {
            id.append("global");
        } else {
            id.append(String.join(SEPARATOR, context.scopePath()));
        }
        id.append(SEPARATOR).append(type.name())
                .append(SEPARATOR).append(name);
        if (discriminator > 0) {
            id.append('#').append(discriminator);
        }
        return id.toString();
    }

}

package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;

import java.util.Map;

/**
 * VARIABLE contract for var, let and const declarations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class VariableNode {

    private VariableNode() {
    }

    /**
     * Optional VARIABLE fields.
     *
     * @param kind the declaration keyword: var, let or const
     * @param discriminator 0, or n for the n-th repeated name in a scope
     */
    public record Options(String kind, int discriminator) {

        public static Options of(final String kind) {
            return new Options(kind, 0);
        }
    }

    public static GraphNode create(final String name, final String file,
            final Integer line, final Integer column, final Options options) {
        final String id = NodeIds.positional(NodeType.VARIABLE,
                NodeFields.name(NodeType.VARIABLE, name),
                NodeFields.file(NodeType.VARIABLE, file),
                NodeFields.line(NodeType.VARIABLE, line),
                NodeFields.column(NodeType.VARIABLE, column));
        return build(id, name, file, line, column, options);
    }

    public static GraphNode createWithContext(final String name,
            final ScopeContext context, final Integer line,
            final Integer column, final Options options) {
        final Options opts = options == null ? Options.of("var") : options;
        final String id = NodeIds.semantic(NodeType.VARIABLE,
                NodeFields.name(NodeType.VARIABLE, name),
                NodeFields.context(NodeType.VARIABLE, context),
                NodeFields.discriminator(NodeType.VARIABLE,
                        opts.discriminator()));
        NodeFields.line(NodeType.VARIABLE, line);
        NodeFields.column(NodeType.VARIABLE, column);
        return build(id, name, context.file(), line, column, opts);
    }

    private static GraphNode build(final String id, final String name,
            final String file, final int line, final int column,
            final Options options) {
        final String kind = options == null || options.kind() == null
                ? "var" : options.kind();
        return GraphNode.reconstitute(id, NodeType.VARIABLE, name, file,
                line, column, Map.of("kind", kind), null);
    }

}

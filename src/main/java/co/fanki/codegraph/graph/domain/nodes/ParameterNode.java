package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;

import java.util.Map;

/**
 * PARAMETER contract. The scope of a parameter is its function.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ParameterNode {

    private ParameterNode() {
    }

    /**
     * Optional PARAMETER fields.
     *
     * @param index the 0-based position in the parameter list
     * @param rest whether a rest parameter
     * @param hasDefault whether it declares a default value
     */
    public record Options(int index, boolean rest, boolean hasDefault) {
    }

    public static GraphNode create(final String name, final String file,
            final Integer line, final Integer column, final Options options) {
        final String id = NodeIds.positional(NodeType.PARAMETER,
                NodeFields.name(NodeType.PARAMETER, name),
                NodeFields.file(NodeType.PARAMETER, file),
                NodeFields.line(NodeType.PARAMETER, line),
                NodeFields.column(NodeType.PARAMETER, column));
        return build(id, name, file, line, column, options);
    }

    public static GraphNode createWithContext(final String name,
            final ScopeContext context, final Integer line,
            final Integer column, final Options options) {
        final String id = NodeIds.semantic(NodeType.PARAMETER,
                NodeFields.name(NodeType.PARAMETER, name),
                NodeFields.context(NodeType.PARAMETER, context), 0);
        NodeFields.line(NodeType.PARAMETER, line);
        NodeFields.column(NodeType.PARAMETER, column);
        return build(id, name, context.file(), line, column, options);
    }

    private static GraphNode build(final String id, final String name,
            final String file, final int line, final int column,
            final Options options) {
        final Options opts = options == null
                ? new Options(0, false, false) : options;
        return GraphNode.reconstitute(id, NodeType.PARAMETER, name, file,
                line, column, Map.of(
                        "index", opts.index(),
                        "rest", opts.rest(),
                        "hasDefault", opts.hasDefault()), null);
    }

}

package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.Map;

/**
 * CONSTRUCTOR_CALL contract for {@code new X(...)} expressions.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConstructorCallNode {

    private ConstructorCallNode() {
    }

    /**
     * Creates a constructor call.
     *
     * @param className the instantiated class as written
     * @param file the file
     * @param line the 1-based line
     * @param column the 0-based column
     * @param argumentCount the number of arguments
     * @return the node
     */
    public static GraphNode create(final String className, final String file,
            final Integer line, final Integer column,
            final int argumentCount) {
        final String id = NodeIds.positional(NodeType.CONSTRUCTOR_CALL,
                NodeFields.name(NodeType.CONSTRUCTOR_CALL, className),
                NodeFields.file(NodeType.CONSTRUCTOR_CALL, file),
                NodeFields.line(NodeType.CONSTRUCTOR_CALL, line),
                NodeFields.column(NodeType.CONSTRUCTOR_CALL, column));
        return GraphNode.reconstitute(id, NodeType.CONSTRUCTOR_CALL, className,
                file, line, column, Map.of("argumentCount", argumentCount),
                null);
    }

}

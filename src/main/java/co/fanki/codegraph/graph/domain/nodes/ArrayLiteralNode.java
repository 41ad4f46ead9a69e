package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.Map;

/**
 * ARRAY_LITERAL contract.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ArrayLiteralNode {

    static final String NAME = "<array>";

    private ArrayLiteralNode() {
    }

    public static GraphNode create(final String file, final Integer line,
            final Integer column, final int elementCount) {
        final String id = NodeIds.positional(NodeType.ARRAY_LITERAL, NAME,
                NodeFields.file(NodeType.ARRAY_LITERAL, file),
                NodeFields.line(NodeType.ARRAY_LITERAL, line),
                NodeFields.column(NodeType.ARRAY_LITERAL, column));
        return GraphNode.reconstitute(id, NodeType.ARRAY_LITERAL, NAME, file,
                line, column, Map.of("elementCount", elementCount), null);
    }

}

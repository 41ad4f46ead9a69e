package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.Map;

/**
 * OBJECT_LITERAL contract. Whether the object is a call argument, a
 * property value or a variable initializer is carried by the edge that
 * reaches it, not by its id.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ObjectLiteralNode {

    static final String NAME = "<object>";

    private ObjectLiteralNode() {
    }

    public static GraphNode create(final String file, final Integer line,
            final Integer column, final int propertyCount) {
        final String id = NodeIds.positional(NodeType.OBJECT_LITERAL, NAME,
                NodeFields.file(NodeType.OBJECT_LITERAL, file),
                NodeFields.line(NodeType.OBJECT_LITERAL, line),
                NodeFields.column(NodeType.OBJECT_LITERAL, column));
        return GraphNode.reconstitute(id, NodeType.OBJECT_LITERAL, NAME, file,
                line, column, Map.of("propertyCount", propertyCount), null);
    }

}

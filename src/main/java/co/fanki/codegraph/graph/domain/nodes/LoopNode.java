package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.Map;

/**
 * LOOP contract; the name is the loop kind (for, for-in, for-of, while,
 * do-while).
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LoopNode {

    private LoopNode() {
    }

    public static GraphNode create(final String kind, final String file,
            final Integer line, final Integer column) {
        final String id = NodeIds.positional(NodeType.LOOP,
                NodeFields.name(NodeType.LOOP, kind),
                NodeFields.file(NodeType.LOOP, file),
                NodeFields.line(NodeType.LOOP, line),
                NodeFields.column(NodeType.LOOP, column));
        return GraphNode.reconstitute(id, NodeType.LOOP, kind, file, line,
                column, Map.of(), null);
    }

}

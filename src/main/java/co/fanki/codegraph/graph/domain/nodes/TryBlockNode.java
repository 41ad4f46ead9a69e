package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.Map;

/**
 * TRY_BLOCK contract, created for try statements that have a catch clause.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TryBlockNode {

    static final String NAME = "try";

    private TryBlockNode() {
    }

    public static GraphNode create(final String file, final Integer line,
            final Integer column, final boolean hasFinally) {
        final String id = NodeIds.positional(NodeType.TRY_BLOCK, NAME,
                NodeFields.file(NodeType.TRY_BLOCK, file),
                NodeFields.line(NodeType.TRY_BLOCK, line),
                NodeFields.column(NodeType.TRY_BLOCK, column));
        return GraphNode.reconstitute(id, NodeType.TRY_BLOCK, NAME, file, line,
                column, Map.of("hasFinally", hasFinally), null);
    }

}

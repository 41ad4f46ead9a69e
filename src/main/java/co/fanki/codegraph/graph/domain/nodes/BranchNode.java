package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.Map;

/**
 * BRANCH contract for if and switch statements; the name is the keyword.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class BranchNode {

    private BranchNode() {
    }

    public static GraphNode create(final String kind, final String file,
            final Integer line, final Integer column, final int caseCount) {
        final String id = NodeIds.positional(NodeType.BRANCH,
                NodeFields.name(NodeType.BRANCH, kind),
                NodeFields.file(NodeType.BRANCH, file),
                NodeFields.line(NodeType.BRANCH, line),
                NodeFields.column(NodeType.BRANCH, column));
        return GraphNode.reconstitute(id, NodeType.BRANCH, kind, file, line,
                column, Map.of("caseCount", caseCount), null);
    }

}

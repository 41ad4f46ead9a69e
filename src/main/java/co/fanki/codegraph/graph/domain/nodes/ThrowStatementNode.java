package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * THROW_STATEMENT contract.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ThrowStatementNode {

    static final String NAME = "throw";

    private ThrowStatementNode() {
    }

    /**
     * Creates a throw statement.
     *
     * @param file the file
     * @param line the 1-based line
     * @param column the 0-based column
     * @param errorClassName the resolved error class, or null
     * @param async whether the enclosing function is async
     * @return the node
     */
    public static GraphNode create(final String file, final Integer line,
            final Integer column, final String errorClassName,
            final boolean async) {
        final String id = NodeIds.positional(NodeType.THROW_STATEMENT, NAME,
                NodeFields.file(NodeType.THROW_STATEMENT, file),
                NodeFields.line(NodeType.THROW_STATEMENT, line),
                NodeFields.column(NodeType.THROW_STATEMENT, column));
        final Map<String, Object> metadata = new LinkedHashMap<>();
        if (errorClassName != null) {
            metadata.put("errorClassName", errorClassName);
        }
        metadata.put("async", async);
        return GraphNode.reconstitute(id, NodeType.THROW_STATEMENT, NAME, file,
                line, column, metadata, null);
    }

}

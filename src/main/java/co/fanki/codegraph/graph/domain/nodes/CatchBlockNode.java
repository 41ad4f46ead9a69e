package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CATCH_BLOCK contract.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CatchBlockNode {

    static final String NAME = "catch";

    private CatchBlockNode() {
    }

    /**
     * Creates a catch block.
     *
     * @param file the file
     * @param line the 1-based line
     * @param column the 0-based column
     * @param parameterName the catch parameter, null for {@code catch {}}
     * @return the node
     */
    public static GraphNode create(final String file, final Integer line,
            final Integer column, final String parameterName) {
        final String id = NodeIds.positional(NodeType.CATCH_BLOCK, NAME,
                NodeFields.file(NodeType.CATCH_BLOCK, file),
                NodeFields.line(NodeType.CATCH_BLOCK, line),
                NodeFields.column(NodeType.CATCH_BLOCK, column));
        final Map<String, Object> metadata = new LinkedHashMap<>();
        if (parameterName != null) {
            metadata.put("parameterName", parameterName);
        }
        return GraphNode.reconstitute(id, NodeType.CATCH_BLOCK, NAME, file,
                line, column, metadata, null);
    }

}

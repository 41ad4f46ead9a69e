package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.Map;

/**
 * LITERAL contract for primitive values. The name is the literal as
 * written, cut to {@value #MAX_NAME_LENGTH} characters.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LiteralNode {

    static final int MAX_NAME_LENGTH = 64;

    private LiteralNode() {
    }

    /**
     * Creates a literal.
     *
     * @param rawValue the source text of the literal
     * @param file the file
     * @param line the 1-based line
     * @param column the 0-based column
     * @param valueType string, number, boolean, null, template or regex
     * @return the node
     */
    public static GraphNode create(final String rawValue, final String file,
            final Integer line, final Integer column, final String valueType) {
        final String name = abbreviate(
                NodeFields.name(NodeType.LITERAL, rawValue));
        final String id = NodeIds.positional(NodeType.LITERAL, name,
                NodeFields.file(NodeType.LITERAL, file),
                NodeFields.line(NodeType.LITERAL, line),
                NodeFields.column(NodeType.LITERAL, column));
        return GraphNode.reconstitute(id, NodeType.LITERAL, name, file, line,
                column, Map.of("valueType",
                        valueType == null ? "unknown" : valueType), null);
    }

    private static String abbreviate(final String value) {
        final String singleLine = value.replace('\n', ' ');
        if (singleLine.length() <= MAX_NAME_LENGTH) {
            return singleLine;
        }
        return singleLine.substring(0, MAX_NAME_LENGTH - 3) + "...";
    }

}

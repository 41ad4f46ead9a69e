package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CALL contract. Call sites are identified by position only: the same
 * callee is usually invoked many times in one scope.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CallNode {

    private CallNode() {
    }

    /**
     * Optional CALL fields.
     *
     * @param objectName the receiver of a member call, or null
     * @param methodName the property of a member call, or null
     * @param awaited whether the call is the operand of an await
     * @param insideTry whether the call is inside a protecting try block
     * @param argumentCount the number of arguments
     */
    public record Options(String objectName, String methodName,
            boolean awaited, boolean insideTry, int argumentCount) {

        public static Options plain(final int argumentCount) {
            return new Options(null, null, false, false, argumentCount);
        }
    }

    /**
     * Creates a call site.
     *
     * @param name the callee as written, e.g. {@code this.repo.save}
     * @param file the file
     * @param line the 1-based line
     * @param column the 0-based column
     * @param options the optional fields
     * @return the node
     */
    public static GraphNode create(final String name, final String file,
            final Integer line, final Integer column, final Options options) {
        final String id = NodeIds.positional(NodeType.CALL,
                NodeFields.name(NodeType.CALL, name),
                NodeFields.file(NodeType.CALL, file),
                NodeFields.line(NodeType.CALL, line),
                NodeFields.column(NodeType.CALL, column));
        final Options opts = options == null ? Options.plain(0) : options;
        final Map<String, Object> metadata = new LinkedHashMap<>();
        if (opts.objectName() != null) {
            metadata.put("object", opts.objectName());
        }
        if (opts.methodName() != null) {
            metadata.put("method", opts.methodName());
        }
        metadata.put("isAwaited", opts.awaited());
        metadata.put("isInsideTry", opts.insideTry());
        metadata.put("argumentCount", opts.argumentCount());
        return GraphNode.reconstitute(id, NodeType.CALL, name, file, line,
                column, metadata, null);
    }

}

package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.ControlFlowMetadata;
import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FUNCTION contract: declarations, expressions, arrow functions and class
 * methods.
 *
 * <p>New nodes start with a straight line {@link ControlFlowMetadata};
 * the analyzer replaces it when it leaves the function body.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FunctionNode {

    private FunctionNode() {
    }

    /**
     * Optional FUNCTION fields.
     *
     * @param async whether declared async
     * @param generator whether declared as a generator
     * @param arrowFunction whether an arrow function
     * @param method whether a class method
     * @param className the owning class, null unless a method
     * @param parameterNames the parameter names in order
     * @param discriminator 0, or n for the n-th repeated name in a scope
     */
    public record Options(boolean async, boolean generator,
            boolean arrowFunction, boolean method, String className,
            List<String> parameterNames, int discriminator) {

        public Options {
            parameterNames = parameterNames == null
                    ? List.of() : List.copyOf(parameterNames);
        }

        public static Options none() {
            return new Options(false, false, false, false, null, List.of(), 0);
        }
    }

    /**
     * Creates a function identified by its physical position.
     *
     * @param name the function name
     * @param file the file
     * @param line the 1-based line
     * @param column the 0-based column
     * @param options the optional fields
     * @return the node
     * @throws NodeValidationException if a required field is missing
     */
    public static GraphNode create(final String name, final String file,
            final Integer line, final Integer column, final Options options) {
        final String id = NodeIds.positional(NodeType.FUNCTION,
                NodeFields.name(NodeType.FUNCTION, name),
                NodeFields.file(NodeType.FUNCTION, file),
                NodeFields.line(NodeType.FUNCTION, line),
                NodeFields.column(NodeType.FUNCTION, column));
        return build(id, name, file, line, column, options);
    }

    /**
     * Creates a function identified by its lexical scope.
     *
     * @param name the function name
     * @param context the enclosing scope
     * @param line the 1-based line
     * @param column the 0-based column
     * @param options the optional fields
     * @return the node
     * @throws NodeValidationException if a required field is missing
     */
    public static GraphNode createWithContext(final String name,
            final ScopeContext context, final Integer line,
            final Integer column, final Options options) {
        final Options opts = options == null ? Options.none() : options;
        final String id = idFor(name, context, opts.discriminator());
        NodeFields.line(NodeType.FUNCTION, line);
        NodeFields.column(NodeType.FUNCTION, column);
        return build(id, name, context.file(), line, column, opts);
    }

    /**
     * The scope aware id of a function, for references to functions that
     * live in other files.
     *
     * @param name the function name
     * @param context the scope the function is declared in
     * @param discriminator 0 for the first function with that name
     * @return the id the function will have once created
     */
    public static String idFor(final String name, final ScopeContext context,
            final int discriminator) {
        return NodeIds.semantic(NodeType.FUNCTION,
                NodeFields.name(NodeType.FUNCTION, name),
                NodeFields.context(NodeType.FUNCTION, context),
                NodeFields.discriminator(NodeType.FUNCTION, discriminator));
    }

    private static GraphNode build(final String id, final String name,
            final String file, final int line, final int column,
            final Options options) {
        final Options opts = options == null ? Options.none() : options;
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("async", opts.async());
        metadata.put("generator", opts.generator());
        metadata.put("arrowFunction", opts.arrowFunction());
        metadata.put("method", opts.method());
        if (opts.className() != null) {
            metadata.put("className", opts.className());
        }
        metadata.put("parameterNames", opts.parameterNames());
        return GraphNode.reconstitute(id, NodeType.FUNCTION, name, file, line,
                column, metadata, ControlFlowMetadata.straightLine());
    }

}

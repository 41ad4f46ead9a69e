package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLASS contract.
 *
 * <p>{@link #idFor} is the only way to reference a class that has no node
 * in the current file (a superclass imported from another module, or a
 * built-in error class), so such references match the id the class gets
 * when its own file is analyzed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ClassNode {

    private ClassNode() {
    }

    /**
     * Optional CLASS fields.
     *
     * @param superClass the name in the extends clause, or null
     * @param exported whether the class is exported
     * @param discriminator 0, or n for the n-th repeated name in a scope
     */
    public record Options(String superClass, boolean exported,
            int discriminator) {

        public static Options none() {
            return new Options(null, false, 0);
        }
    }

    /**
     * Creates a class identified by its physical position.
     *
     * @param name the class name
     * @param file the file
     * @param line the 1-based line
     * @param column the 0-based column
     * @param options the optional fields
     * @return the node
     */
    public static GraphNode create(final String name, final String file,
            final Integer line, final Integer column, final Options options) {
        final String id = NodeIds.positional(NodeType.CLASS,
                NodeFields.name(NodeType.CLASS, name),
                NodeFields.file(NodeType.CLASS, file),
                NodeFields.line(NodeType.CLASS, line),
                NodeFields.column(NodeType.CLASS, column));
        return build(id, name, file, line, column, options);
    }

    /**
     * Creates a class identified by its lexical scope.
     *
     * @param name the class name
     * @param context the enclosing scope
     * @param line the 1-based line
     * @param column the 0-based column
     * @param options the optional fields
     * @return the node
     */
    public static GraphNode createWithContext(final String name,
            final ScopeContext context, final Integer line,
            final Integer column, final Options options) {
        final Options opts = options == null ? Options.none() : options;
        final String id = NodeIds.semantic(NodeType.CLASS,
                NodeFields.name(NodeType.CLASS, name),
                NodeFields.context(NodeType.CLASS, context),
                NodeFields.discriminator(NodeType.CLASS, opts.discriminator()));
        NodeFields.line(NodeType.CLASS, line);
        NodeFields.column(NodeType.CLASS, column);
        return build(id, name, context.file(), line, column, opts);
    }

    /**
     * The scope aware id of a class declared in a scope.
     *
     * @param name the class name
     * @param context the declaring scope
     * @return the class id
     */
    public static String idFor(final String name, final ScopeContext context) {
        return NodeIds.semantic(NodeType.CLASS,
                NodeFields.name(NodeType.CLASS, name),
                NodeFields.context(NodeType.CLASS, context), 0);
    }

    /**
     * The id a built-in class such as {@code Error} is referenced by. No
     * node exists for it.
     *
     * @param name the built-in class name
     * @return the reference id
     */
    public static String builtinIdFor(final String name) {
        return idFor(name, ScopeContext.builtins());
    }

    private static GraphNode build(final String id, final String name,
            final String file, final int line, final int column,
            final Options options) {
        final Options opts = options == null ? Options.none() : options;
        final Map<String, Object> metadata = new LinkedHashMap<>();
        if (opts.superClass() != null) {
            metadata.put("superClass", opts.superClass());
        }
        metadata.put("exported", opts.exported());
        return GraphNode.reconstitute(id, NodeType.CLASS, name, file, line,
                column, metadata, null);
    }

}

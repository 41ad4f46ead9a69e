package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * IMPORT contract. One node per local binding an import statement
 * introduces, named after the local binding.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ImportNode {

    private ImportNode() {
    }

    /**
     * Optional IMPORT fields.
     *
     * @param source the module specifier as written
     * @param importedName the exported name, "default" or "*"
     * @param resolvedFile the project file the specifier resolves to, or
     *        null for external packages
     */
    public record Options(String source, String importedName,
            String resolvedFile) {
    }

    public static GraphNode create(final String localName, final String file,
            final Integer line, final Integer column, final Options options) {
        final String id = NodeIds.positional(NodeType.IMPORT,
                NodeFields.name(NodeType.IMPORT, localName),
                NodeFields.file(NodeType.IMPORT, file),
                NodeFields.line(NodeType.IMPORT, line),
                NodeFields.column(NodeType.IMPORT, column));
        return build(id, localName, file, line, column, options);
    }

    public static GraphNode createWithContext(final String localName,
            final ScopeContext context, final Integer line,
            final Integer column, final Options options) {
        final String id = NodeIds.semantic(NodeType.IMPORT,
                NodeFields.name(NodeType.IMPORT, localName),
                NodeFields.context(NodeType.IMPORT, context), 0);
        NodeFields.line(NodeType.IMPORT, line);
        NodeFields.column(NodeType.IMPORT, column);
        return build(id, localName, context.file(), line, column, options);
    }

    private static GraphNode build(final String id, final String name,
            final String file, final int line, final int column,
            final Options options) {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        if (options != null) {
            if (options.source() != null) {
                metadata.put("source", options.source());
            }
            if (options.importedName() != null) {
                metadata.put("importedName", options.importedName());
            }
            if (options.resolvedFile() != null) {
                metadata.put("resolvedFile", options.resolvedFile());
            }
        }
        return GraphNode.reconstitute(id, NodeType.IMPORT, name, file, line,
                column, metadata, null);
    }

}

package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;

import java.util.Map;

/**
 * MODULE contract. A module is identified by its file alone, so importers
 * can compute the id of a module they have not seen yet.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ModuleNode {

    static final String NAME = "module";

    private ModuleNode() {
    }

    /**
     * Creates the node of a source file.
     *
     * @param file the project relative path, never blank
     * @param lineCount the number of lines in the file
     * @return the module node
     */
    public static GraphNode create(final String file, final int lineCount) {
        NodeFields.file(NodeType.MODULE, file);
        return GraphNode.reconstitute(idFor(file), NodeType.MODULE, file,
                file, 0, 0, Map.of("lineCount", lineCount),
                null);
    }

    /**
     * The id of the module for a file.
     *
     * @param file the project relative path, never blank
     * @return the module id
     */
    public static String idFor(final String file) {
        NodeFields.file(NodeType.MODULE, file);
        return NodeIds.semantic(NodeType.MODULE, NAME,
                ScopeContext.global(file), 0);
    }

}

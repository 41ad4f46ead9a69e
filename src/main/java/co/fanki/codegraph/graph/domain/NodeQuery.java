package co.fanki.codegraph.graph.domain;

/**
 * Node filter for {@link GraphBackend#queryNodes}. Null fields match
 * anything.
 *
 * @param type the node type to match, or null
 * @param file the file to match, or null
 * @param name the node name to match, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NodeQuery(NodeType type, String file, String name) {

    public static NodeQuery all() {
        return new NodeQuery(null, null, null);
    }

    public static NodeQuery ofType(final NodeType type) {
        return new NodeQuery(type, null, null);
    }

    public static NodeQuery inFile(final NodeType type, final String file) {
        return new NodeQuery(type, file, null);
    }

    /**
     * Whether the node satisfies every non null field of this filter.
     *
     * @param node the node to test
     * @return true if it matches
     */
    public boolean matches(final GraphNode node) {
        return (type == null || type == node.type())
                && (file == null || file.equals(node.file()))
                && (name == null || name.equals(node.name()));
    }

}

package co.fanki.codegraph.graph.domain;

/**
 * Edge filter for {@link GraphBackend#queryEdges}. Null fields match
 * anything.
 *
 * @param type the edge type to match, or null
 * @param src the source id to match, or null
 * @param dst the destination id to match, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EdgeQuery(EdgeType type, String src, String dst) {

    public static EdgeQuery all() {
        return new EdgeQuery(null, null, null);
    }

    public static EdgeQuery ofType(final EdgeType type) {
        return new EdgeQuery(type, null, null);
    }

    /**
     * Whether the edge satisfies every non null field of this filter.
     *
     * @param edge the edge to test
     * @return true if it matches
     */
    public boolean matches(final GraphEdge edge) {
        return (type == null || type == edge.type())
                && (src == null || src.equals(edge.src()))
                && (dst == null || dst.equals(edge.dst()));
    }

}

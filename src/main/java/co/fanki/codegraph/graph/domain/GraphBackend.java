package co.fanki.codegraph.graph.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Port to the storage engine holding the graph.
 *
 * <p>Every operation is safe to repeat: adding a node twice keeps one node
 * (the last write wins), adding an edge twice keeps one edge per
 * {@code (type, src, dst)}. Edges may point at ids that are not (yet)
 * nodes unless target validation is requested.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface GraphBackend {

    /**
     * Adds or replaces a node.
     *
     * @param node the node, never null
     */
    void addNode(GraphNode node);

    /**
     * Adds edges.
     *
     * @param edges the edges, never null
     * @param skipTargetValidation when false, every source and destination
     *        must already exist as a node
     * @throws GraphStorageException if validation is requested and an
     *         endpoint is missing
     */
    void addEdges(List<GraphEdge> edges, boolean skipTargetValidation);

    /**
     * Writes the nodes and then the edges of one file as a single unit of
     * work. Edge targets are not validated.
     *
     * <p>The default implementation is not atomic; backends that support
     * transactions override it.</p>
     *
     * @param nodes the nodes, never null
     * @param edges the edges, never null
     */
    default void writeUnit(final List<GraphNode> nodes,
            final List<GraphEdge> edges) {
        nodes.forEach(this::addNode);
        addEdges(edges, true);
    }

    Optional<GraphNode> getNode(String id);

    List<GraphNode> queryNodes(NodeQuery query);

    List<GraphEdge> queryEdges(EdgeQuery query);

    /**
     * Returns the edges pointing at a node.
     *
     * @param id the destination id
     * @param types the edge types to include, empty for all
     * @return the matching edges
     */
    List<GraphEdge> getIncomingEdges(String id, Set<EdgeType> types);

    /**
     * Returns the edges leaving a node.
     *
     * @param id the source id
     * @param types the edge types to include, empty for all
     * @return the matching edges
     */
    List<GraphEdge> getOutgoingEdges(String id, Set<EdgeType> types);

    Map<NodeType, Long> countNodesByType();

    Map<EdgeType, Long> countEdgesByType();

    /** Removes every node and edge. */
    void clear();

}

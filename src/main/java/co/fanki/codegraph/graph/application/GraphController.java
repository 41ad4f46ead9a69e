package co.fanki.codegraph.graph.application;

import co.fanki.codegraph.graph.domain.ControlFlowMetadata;
import co.fanki.codegraph.graph.domain.EdgeType;
import co.fanki.codegraph.graph.domain.GraphBackend;
import co.fanki.codegraph.graph.domain.GraphEdge;
import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read only access to the graph.
 *
 * <p>Node ids carry file paths, so they travel as query parameters.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/graph")
@Tag(name = "Graph", description = "Inspect the analyzed graph")
public class GraphController {

    private final GraphBackend backend;

    /**
     * Creates a new GraphController.
     *
     * @param theBackend the graph backend
     */
    public GraphController(final GraphBackend theBackend) {
        this.backend = theBackend;
    }

    /**
     * Counts nodes and edges per type.
     *
     * @return the counts
     */
    @Operation(summary = "Count nodes and edges by type")
    @GetMapping("/stats")
    public ResponseEntity<GraphStats> stats() {
        return ResponseEntity.ok(new GraphStats(backend.countNodesByType(),
                backend.countEdgesByType()));
    }

    /**
     * Returns one node.
     *
     * @param id the node id
     * @return the node, or 404
     */
    @Operation(summary = "Get a node by id")
    @GetMapping("/node")
    public ResponseEntity<NodeView> node(
            @RequestParam("id") final String id) {
        final Optional<GraphNode> node = backend.getNode(id);
        return node.map(NodeView::of).map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Returns the edges around a node.
     *
     * @param id the node id
     * @param types the edge types to include, all when absent
     * @return the incoming and outgoing edges
     */
    @Operation(summary = "Get the edges of a node",
            description = "Edges may point at ids that are not nodes yet:"
                    + " cross-file references resolve once the target file"
                    + " is analyzed, builtin error classes never do.")
    @GetMapping("/edges")
    public ResponseEntity<NodeEdges> edges(
            @RequestParam("id") final String id,
            @Parameter(description = "Edge types, e.g. CALLS,REJECTS")
            @RequestParam(value = "types", required = false)
            final List<EdgeType> types) {
        final Set<EdgeType> filter = types == null || types.isEmpty()
                ? Set.of() : EnumSet.copyOf(types);
        return ResponseEntity.ok(new NodeEdges(id,
                backend.getIncomingEdges(id, filter),
                backend.getOutgoingEdges(id, filter)));
    }

    /**
     * A node as served over HTTP.
     *
     * @param id the node id
     * @param type the node type
     * @param name the node name
     * @param file the file of the node
     * @param line the 1-based line
     * @param column the 0-based column
     * @param metadata type specific metadata
     * @param controlFlow the control flow summary, null unless FUNCTION
     */
    public record NodeView(String id, NodeType type, String name, String file,
            int line, int column, Map<String, Object> metadata,
            ControlFlowMetadata controlFlow) {

        static NodeView of(final GraphNode node) {
            return new NodeView(node.id(), node.type(), node.name(),
                    node.file(), node.line(), node.column(), node.metadata(),
                    node.controlFlow());
        }
    }

    /**
     * Graph size.
     *
     * @param nodes node count per type
     * @param edges edge count per type
     */
    public record GraphStats(Map<NodeType, Long> nodes,
            Map<EdgeType, Long> edges) {}

    /**
     * The neighbourhood of a node.
     *
     * @param id the node id
     * @param incoming edges pointing at the node
     * @param outgoing edges leaving the node
     */
    public record NodeEdges(String id, List<GraphEdge> incoming,
            List<GraphEdge> outgoing) {}

}

package co.fanki.codegraph.graph.application;

import co.fanki.codegraph.graph.domain.EdgeType;
import co.fanki.codegraph.graph.domain.GraphEdge;
import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.InMemoryGraphBackend;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;
import co.fanki.codegraph.graph.domain.nodes.FunctionNode;
import co.fanki.codegraph.graph.domain.nodes.NodeFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for GraphController.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphControllerTest {

    private InMemoryGraphBackend backend;
    private GraphController controller;
    private GraphNode function;

    @BeforeEach
    void setUp() {
        backend = new InMemoryGraphBackend();
        controller = new GraphController(backend);
        final GraphNode module = NodeFactory.createModule("src/app.ts", 3);
        function = NodeFactory.createFunctionWithContext("load",
                ScopeContext.global("src/app.ts"), 1, 0,
                FunctionNode.Options.none());
        backend.writeUnit(List.of(module, function), List.of(
                GraphEdge.of(EdgeType.CONTAINS, module.id(), function.id()),
                GraphEdge.of(EdgeType.REJECTS, function.id(),
                        NodeFactory.builtinClassId("Error"))));
    }

    @Test
    void whenGettingStats_givenGraph_shouldCountByType() {
        final GraphController.GraphStats stats = controller.stats().getBody();

        assertEquals(1L, stats.nodes().get(NodeType.FUNCTION));
        assertEquals(1L, stats.edges().get(EdgeType.REJECTS));
    }

    @Test
    void whenGettingNode_givenUnknownId_shouldReturnNotFound() {
        final ResponseEntity<GraphController.NodeView> response =
                controller.node("src/app.ts->global->FUNCTION->missing");

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNull(response.getBody());
    }

    @Test
    void whenGettingNode_givenFunctionId_shouldReturnView() {
        final GraphController.NodeView view = controller.node(function.id())
                .getBody();

        assertEquals("load", view.name());
        assertEquals(NodeType.FUNCTION, view.type());
    }

    @Test
    void whenGettingEdges_givenTypeFilter_shouldSplitDirections() {
        final GraphController.NodeEdges all = controller.edges(function.id(),
                null).getBody();
        final GraphController.NodeEdges rejects = controller.edges(
                function.id(), List.of(EdgeType.REJECTS)).getBody();

        assertEquals(1, all.incoming().size());
        assertEquals(1, all.outgoing().size());
        assertEquals(0, rejects.incoming().size());
        assertEquals(1, rejects.outgoing().size());
    }

}

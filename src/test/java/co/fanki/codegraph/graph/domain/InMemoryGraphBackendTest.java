package co.fanki.codegraph.graph.domain;

import co.fanki.codegraph.graph.domain.nodes.ClassNode;
import co.fanki.codegraph.graph.domain.nodes.FunctionNode;
import co.fanki.codegraph.graph.domain.nodes.NodeFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for InMemoryGraphBackend.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class InMemoryGraphBackendTest {

    private static final ScopeContext A = ScopeContext.global("src/a.ts");

    private InMemoryGraphBackend backend;
    private GraphNode caller;
    private GraphNode callee;

    @BeforeEach
    void setUp() {
        backend = new InMemoryGraphBackend();
        caller = NodeFactory.createFunctionWithContext("caller", A, 1, 0,
                FunctionNode.Options.none());
        callee = NodeFactory.createFunctionWithContext("callee", A, 5, 0,
                FunctionNode.Options.none());
    }

    // -- nodes -------------------------------------------------------------

    @Test
    void whenAddingNode_givenSameIdTwice_shouldKeepLastWrite() {
        backend.addNode(caller);
        backend.addNode(caller.withMetadata("async", true));

        assertEquals(1, backend.queryNodes(NodeQuery.all()).size());
        assertTrue(backend.getNode(caller.id()).orElseThrow().flag("async"));
    }

    @Test
    void whenQueryingNodes_givenTypeAndFile_shouldFilter() {
        backend.addNode(caller);
        backend.addNode(NodeFactory.createModule("src/a.ts", 10));
        backend.addNode(NodeFactory.createFunctionWithContext("other",
                ScopeContext.global("src/b.ts"), 1, 0,
                FunctionNode.Options.none()));

        final List<GraphNode> result = backend.queryNodes(
                NodeQuery.inFile(NodeType.FUNCTION, "src/a.ts"));

        assertEquals(List.of(caller), result);
    }

    // -- edges -------------------------------------------------------------

    @Test
    void whenAddingEdges_givenDuplicateRelation_shouldKeepOne() {
        backend.addNode(caller);
        backend.addNode(callee);
        final GraphEdge edge = GraphEdge.of(EdgeType.CALLS, caller.id(),
                callee.id());

        backend.addEdges(List.of(edge, edge), false);
        backend.addEdges(List.of(new GraphEdge(EdgeType.CALLS, caller.id(),
                callee.id(), Map.of("note", "again"))), false);

        assertEquals(1, backend.queryEdges(EdgeQuery.all()).size());
    }

    @Test
    void whenAddingEdges_givenSameRelationWithOtherMetadata_shouldKeepFirst() {
        backend.addNode(caller);
        backend.addNode(callee);
        final GraphEdge first = new GraphEdge(EdgeType.CALLS, caller.id(),
                callee.id(), Map.of("line", 3));
        final GraphEdge second = new GraphEdge(EdgeType.CALLS, caller.id(),
                callee.id(), Map.of("line", 9));

        backend.addEdges(List.of(first, second), false);

        assertEquals(first.relationKey(), second.relationKey());
        assertFalse(first.equals(second));
        assertEquals(List.of(first), backend.queryEdges(EdgeQuery.all()));
    }

    @Test
    void whenAddingEdges_givenMissingTargetAndValidation_shouldFail() {
        backend.addNode(caller);
        final GraphEdge edge = GraphEdge.of(EdgeType.CALLS, caller.id(),
                "src/b.ts->global->FUNCTION->missing");

        assertThrows(GraphStorageException.class,
                () -> backend.addEdges(List.of(edge), false));
        assertTrue(backend.queryEdges(EdgeQuery.all()).isEmpty());
    }

    @Test
    void whenAddingEdges_givenMissingTargetWithoutValidation_shouldKeepEdge() {
        backend.addNode(caller);
        final String builtin = NodeFactory.builtinClassId("Error");

        backend.addEdges(List.of(GraphEdge.of(EdgeType.REJECTS, caller.id(),
                builtin)), true);

        assertEquals(1, backend.getIncomingEdges(builtin, Set.of()).size());
        assertFalse(backend.getNode(builtin).isPresent());
    }

    @Test
    void whenReadingEdges_givenTypeFilter_shouldOnlyReturnThoseTypes() {
        final GraphNode error = NodeFactory.createClassWithContext("E", A, 9,
                0, ClassNode.Options.none());
        backend.writeUnit(List.of(caller, callee, error), List.of(
                GraphEdge.of(EdgeType.CALLS, caller.id(), callee.id()),
                GraphEdge.of(EdgeType.REJECTS, caller.id(), error.id())));

        assertEquals(1, backend.getOutgoingEdges(caller.id(),
                Set.of(EdgeType.REJECTS)).size());
        assertEquals(2, backend.getOutgoingEdges(caller.id(), Set.of()).size());
        assertEquals(1, backend.getIncomingEdges(callee.id(),
                Set.of(EdgeType.CALLS)).size());
    }

    // -- counts ------------------------------------------------------------

    @Test
    void whenCounting_givenMixedGraph_shouldGroupByType() {
        backend.writeUnit(List.of(caller, callee,
                NodeFactory.createModule("src/a.ts", 3)), List.of(
                GraphEdge.of(EdgeType.CALLS, caller.id(), callee.id())));

        assertEquals(2L, backend.countNodesByType().get(NodeType.FUNCTION));
        assertEquals(1L, backend.countNodesByType().get(NodeType.MODULE));
        assertEquals(1L, backend.countEdgesByType().get(EdgeType.CALLS));
    }

    @Test
    void whenClearing_givenPopulatedGraph_shouldRemoveEverything() {
        backend.writeUnit(List.of(caller, callee), List.of(
                GraphEdge.of(EdgeType.CALLS, caller.id(), callee.id())));

        backend.clear();

        assertTrue(backend.countNodesByType().isEmpty());
        assertTrue(backend.countEdgesByType().isEmpty());
    }

}

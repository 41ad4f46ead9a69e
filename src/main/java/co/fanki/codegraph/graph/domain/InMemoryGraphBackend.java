package co.fanki.codegraph.graph.domain;

import co.fanki.codegraph.shared.Preconditions;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Graph backend held in memory.
 *
 * <p>Nodes are keyed by id and edges by {@code (type, src, dst)}, both in
 * sorted maps, so queries return results in a stable order. Writes of one
 * file are serialized with the instance monitor.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(name = "graph.storage", havingValue = "memory")
public class InMemoryGraphBackend implements GraphBackend {

    private final Map<String, GraphNode> nodes = new ConcurrentSkipListMap<>();

    private final Map<String, GraphEdge> edges = new ConcurrentSkipListMap<>();

    @Override
    public void addNode(final GraphNode node) {
        Preconditions.requireNonNull(node, "Node is required");
        nodes.put(node.id(), node);
    }

    @Override
    public synchronized void addEdges(final List<GraphEdge> theEdges,
            final boolean skipTargetValidation) {
        Preconditions.requireNonNull(theEdges, "Edges are required");
        if (!skipTargetValidation) {
            for (GraphEdge edge : theEdges) {
                if (!nodes.containsKey(edge.src())
                        || !nodes.containsKey(edge.dst())) {
                    throw new GraphStorageException("Edge " + edge.type()
                            + " references a missing node: " + edge.src()
                            + " -> " + edge.dst());
                }
            }
        }
        for (GraphEdge edge : theEdges) {
            edges.putIfAbsent(edge.relationKey(), edge);
        }
    }

    @Override
    public synchronized void writeUnit(final List<GraphNode> theNodes,
            final List<GraphEdge> theEdges) {
        theNodes.forEach(this::addNode);
        addEdges(theEdges, true);
    }

    @Override
    public Optional<GraphNode> getNode(final String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    @Override
    public List<GraphNode> queryNodes(final NodeQuery query) {
        final List<GraphNode> result = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (query.matches(node)) {
                result.add(node);
            }
        }
        return result;
    }

    @Override
    public List<GraphEdge> queryEdges(final EdgeQuery query) {
        final List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : edges.values()) {
            if (query.matches(edge)) {
                result.add(edge);
            }
        }
        return result;
    }

    @Override
    public List<GraphEdge> getIncomingEdges(final String id,
            final Set<EdgeType> types) {
        final List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : edges.values()) {
            if (edge.dst().equals(id)
                    && (types.isEmpty() || types.contains(edge.type()))) {
                result.add(edge);
            }
        }
        return result;
    }

    @Override
    public List<GraphEdge> getOutgoingEdges(final String id,
            final Set<EdgeType> types) {
        final List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : edges.values()) {
            if (edge.src().equals(id)
                    && (types.isEmpty() || types.contains(edge.type()))) {
                result.add(edge);
            }
        }
        return result;
    }

    @Override
    public Map<NodeType, Long> countNodesByType() {
        final Map<NodeType, Long> counts = new EnumMap<>(NodeType.class);
        for (GraphNode node : nodes.values()) {
            counts.merge(node.type(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public Map<EdgeType, Long> countEdgesByType() {
        final Map<EdgeType, Long> counts = new EnumMap<>(EdgeType.class);
        for (GraphEdge edge : edges.values()) {
            counts.merge(edge.type(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public synchronized void clear() {
        nodes.clear();
        edges.clear();
    }

}

package co.fanki.codegraph.enrichment.domain;

import co.fanki.codegraph.graph.domain.EdgeQuery;
import co.fanki.codegraph.graph.domain.EdgeType;
import co.fanki.codegraph.graph.domain.GraphBackend;
import co.fanki.codegraph.graph.domain.GraphEdge;
import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeQuery;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.nodes.NodeFactory;
import co.fanki.codegraph.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Propagates rejections along unprotected await chains.
 *
 * <p>When an async function F awaits, outside of any try block, a call
 * that resolves to a function T, every error class T rejects with is also
 * rejected by F. A single round only moves facts one hop, so rounds repeat
 * until one adds nothing or the iteration bound is hit.</p>
 *
 * <p>Each round reads the rejections known at its start and applies what
 * it found only at its end, so the result does not depend on the order in
 * which functions are visited. Rounds only add (function, error class)
 * pairs, never remove them.</p>
 *
 * <p>Builtin error names recorded in a function's control flow metadata
 * are sources too; they are addressed by their builtin class id, which
 * never exists as a node, so those edges are written without target
 * validation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@Order(1)
public class RejectionPropagationEnricher implements Enricher {

    private static final Logger LOG = LoggerFactory.getLogger(
            RejectionPropagationEnricher.class);

    private static final String NAME = "rejection-propagation";

    private final GraphBackend backend;

    private final int maxIterations;

    /**
     * Creates the enricher.
     *
     * @param theBackend the graph backend, never null
     * @param theMaxIterations the bound on rounds, at least 1
     */
    public RejectionPropagationEnricher(final GraphBackend theBackend,
            @Value("${enrichment.max-iterations:10}")
            final int theMaxIterations) {
        backend = Preconditions.requireNonNull(theBackend,
                "Graph backend is required");
        maxIterations = Preconditions.requirePositive(theMaxIterations,
                "Max iterations must be positive");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EnrichmentResult enrich() {
        final long startedAt = System.currentTimeMillis();
        final Indices indices = Indices.load(backend);

        int iterations = 0;
        int created = 0;
        boolean converged = false;

        while (iterations < maxIterations) {
            iterations++;
            final Map<String, Map<String, String>> additions =
                    round(indices);
            if (additions.isEmpty()) {
                converged = true;
                break;
            }
            created += write(additions);
            additions.forEach((functionId, errors) -> indices.rejects
                    .computeIfAbsent(functionId, k -> new TreeSet<>())
                    .addAll(errors.keySet()));
        }

        if (converged) {
            LOG.info("Rejection propagation converged after {} rounds, {}"
                    + " edges added in {} ms", iterations, created,
                    System.currentTimeMillis() - startedAt);
        } else {
            LOG.warn("Rejection propagation stopped at the bound of {} rounds"
                    + " without converging, {} edges added", maxIterations,
                    created);
        }
        return new EnrichmentResult(NAME, created, converged, iterations);
    }

    /**
     * Computes one round of additions from the current rejections.
     *
     * @return function id to (error class id to the function it came from)
     */
    private Map<String, Map<String, String>> round(final Indices indices) {
        final Map<String, Map<String, String>> additions = new TreeMap<>();
        for (String functionId : indices.asyncFunctions) {
            final Set<String> known = indices.rejects.getOrDefault(functionId,
                    Set.of());
            for (GraphNode call : indices.callsByFunction.getOrDefault(
                    functionId, List.of())) {
                if (!call.flag("isAwaited") || call.flag("isInsideTry")) {
                    continue;
                }
                for (String targetId : indices.callTargets.getOrDefault(
                        call.id(), Set.of())) {
                    for (String errorId : indices.rejects.getOrDefault(
                            targetId, Set.of())) {
                        if (!known.contains(errorId)) {
                            additions.computeIfAbsent(functionId,
                                    k -> new TreeMap<>())
                                    .merge(errorId, targetId,
                                            RejectionPropagationEnricher::first);
                        }
                    }
                }
            }
        }
        return additions;
    }

    /** The lowest id, so the reported source does not depend on order. */
    private static String first(final String one, final String other) {
        return one.compareTo(other) <= 0 ? one : other;
    }

    private int write(final Map<String, Map<String, String>> additions) {
        final List<GraphEdge> toClasses = new ArrayList<>();
        final List<GraphEdge> unvalidated = new ArrayList<>();
        additions.forEach((functionId, errors) -> errors.forEach(
                (errorId, sourceId) -> {
                    final GraphEdge edge = propagatedEdge(functionId, errorId,
                            sourceId);
                    final boolean isClassNode = backend.getNode(errorId)
                            .map(node -> node.type() == NodeType.CLASS)
                            .orElse(false);
                    if (isClassNode) {
                        toClasses.add(edge);
                    } else {
                        unvalidated.add(edge);
                    }
                }));
        if (!toClasses.isEmpty()) {
            backend.addEdges(toClasses, false);
        }
        if (!unvalidated.isEmpty()) {
            backend.addEdges(unvalidated, true);
        }
        return toClasses.size() + unvalidated.size();
    }

    private GraphEdge propagatedEdge(final String functionId,
            final String errorId, final String sourceId) {
        final Map<String, Object> metadata = new HashMap<>();
        metadata.put("rejectionType", "propagated");
        metadata.put("propagatedFrom", sourceId);
        metadata.put("errorClassName", errorClassName(errorId));
        return new GraphEdge(EdgeType.REJECTS, functionId, errorId, metadata);
    }

    private String errorClassName(final String errorId) {
        return backend.getNode(errorId).map(GraphNode::name)
                .orElseGet(() -> errorId.substring(
                        errorId.lastIndexOf("->") + 2));
    }

    /** The read side of the pass, loaded once from the graph. */
    private static final class Indices {

        private final Set<String> asyncFunctions = new TreeSet<>();
        private final Map<String, Set<String>> rejects = new HashMap<>();
        private final Map<String, Set<String>> callTargets = new HashMap<>();
        private final Map<String, List<GraphNode>> callsByFunction =
                new HashMap<>();

        static Indices load(final GraphBackend backend) {
            final Indices indices = new Indices();

            final Set<String> functions = new TreeSet<>();
            for (GraphNode function : backend.queryNodes(
                    NodeQuery.ofType(NodeType.FUNCTION))) {
                functions.add(function.id());
                if (function.flag("async")) {
                    indices.asyncFunctions.add(function.id());
                }
                if (function.controlFlow() != null) {
                    for (String name
                            : function.controlFlow().rejectedBuiltinErrors()) {
                        indices.rejects.computeIfAbsent(function.id(),
                                k -> new TreeSet<>())
                                .add(NodeFactory.builtinClassId(name));
                    }
                }
            }

            for (GraphEdge edge : backend.queryEdges(
                    EdgeQuery.ofType(EdgeType.REJECTS))) {
                indices.rejects.computeIfAbsent(edge.src(),
                        k -> new TreeSet<>()).add(edge.dst());
            }

            for (GraphEdge edge : backend.queryEdges(
                    EdgeQuery.ofType(EdgeType.CALLS))) {
                indices.callTargets.computeIfAbsent(edge.src(),
                        k -> new TreeSet<>()).add(edge.dst());
            }

            final Map<String, GraphNode> calls = new HashMap<>();
            for (GraphNode call : backend.queryNodes(
                    NodeQuery.ofType(NodeType.CALL))) {
                calls.put(call.id(), call);
            }
            for (GraphEdge edge : backend.queryEdges(
                    EdgeQuery.ofType(EdgeType.CONTAINS))) {
                final GraphNode call = calls.get(edge.dst());
                if (call != null && functions.contains(edge.src())) {
                    indices.callsByFunction.computeIfAbsent(edge.src(),
                            k -> new ArrayList<>()).add(call);
                }
            }
            return indices;
        }
    }

}

package co.fanki.codegraph.enrichment.domain;

import co.fanki.codegraph.analysis.domain.GraphBuilder;
import co.fanki.codegraph.analysis.domain.ImportResolver;
import co.fanki.codegraph.analysis.domain.JsSourceAnalyzer;
import co.fanki.codegraph.analysis.domain.SourceFile;
import co.fanki.codegraph.graph.domain.EdgeQuery;
import co.fanki.codegraph.graph.domain.EdgeType;
import co.fanki.codegraph.graph.domain.GraphEdge;
import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.InMemoryGraphBackend;
import co.fanki.codegraph.graph.domain.NodeQuery;
import co.fanki.codegraph.graph.domain.ScopeContext;
import co.fanki.codegraph.graph.domain.nodes.NodeFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for RejectionPropagationEnricher over graphs built from
 * TypeScript snippets.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RejectionPropagationEnricherTest {

    private static final String FILE = "src/users.ts";

    private static final String VALIDATE = """
            class ValidationError extends Error {}
            async function validate(input) {
              if (!input) {
                throw new ValidationError('missing');
              }
              return input;
            }
            """;

    private static final String CHAIN = VALIDATE + """
            async function service(input) {
              return await validate(input);
            }
            async function controller(req) {
              const result = await service(req.body);
              return result;
            }
            """;

    private InMemoryGraphBackend backend;

    @BeforeEach
    void setUp() {
        backend = new InMemoryGraphBackend();
    }

    // -- propagation -------------------------------------------------------

    @Test
    void whenEnriching_givenUnprotectedAwait_shouldPropagateRejection() {
        build(VALIDATE + """
                async function handler(req) {
                  const user = await validate(req.body);
                  return user;
                }
                """);

        final EnrichmentResult result = enricher(10).enrich();

        assertEquals("rejection-propagation", result.enricher());
        assertEquals(1, result.edgesCreated());
        assertTrue(result.converged());
        assertEquals(2, result.iterations());

        final List<GraphEdge> rejects = rejectsFrom(functionId("handler"));
        assertEquals(1, rejects.size());
        final GraphEdge edge = rejects.get(0);
        assertEquals(classId("ValidationError"), edge.dst());
        assertEquals("propagated", edge.metadata().get("rejectionType"));
        assertEquals(functionId("validate"),
                edge.metadata().get("propagatedFrom"));
        assertEquals("ValidationError", edge.metadata().get("errorClassName"));
    }

    @Test
    void whenEnriching_givenAwaitInsideTry_shouldNotPropagate() {
        build(VALIDATE + """
                async function handler(req) {
                  try {
                    return await validate(req.body);
                  } catch (e) {
                    return null;
                  }
                }
                """);

        final EnrichmentResult result = enricher(10).enrich();

        assertEquals(0, result.edgesCreated());
        assertTrue(result.converged());
        assertEquals(1, result.iterations());
        assertTrue(rejectsFrom(functionId("handler")).isEmpty());
    }

    @Test
    void whenEnriching_givenCallNotAwaited_shouldNotPropagate() {
        build(VALIDATE + """
                async function fireAndForget(req) {
                  validate(req.body);
                }
                """);

        assertEquals(0, enricher(10).enrich().edgesCreated());
        assertTrue(rejectsFrom(functionId("fireAndForget")).isEmpty());
    }

    @Test
    void whenEnriching_givenTwoHopChain_shouldReachOuterFunction() {
        build(CHAIN);

        final EnrichmentResult result = enricher(10).enrich();

        assertEquals(2, result.edgesCreated());
        assertEquals(3, result.iterations());
        assertTrue(result.converged());
        final GraphEdge outer = rejectsFrom(functionId("controller")).get(0);
        assertEquals(classId("ValidationError"), outer.dst());
        assertEquals(functionId("service"),
                outer.metadata().get("propagatedFrom"));
    }

    @Test
    void whenEnriching_givenMutualRecursion_shouldConverge() {
        build("""
                class FirstError extends Error {}
                class SecondError extends Error {}
                async function ping(n) {
                  await pong(n - 1);
                  throw new FirstError('ping');
                }
                async function pong(n) {
                  await ping(n - 1);
                  throw new SecondError('pong');
                }
                """);

        final EnrichmentResult result = enricher(10).enrich();

        assertTrue(result.converged());
        assertEquals(2, result.edgesCreated());
        assertEquals(2, result.iterations());
        assertEquals(Set.of(classId("FirstError"), classId("SecondError")),
                targets(rejectsFrom(functionId("ping"))));
        assertEquals(Set.of(classId("FirstError"), classId("SecondError")),
                targets(rejectsFrom(functionId("pong"))));
    }

    @Test
    void whenEnriching_givenBuiltinRejection_shouldPropagateToBuiltinId() {
        build("""
                async function load() {
                  throw new TypeError('bad payload');
                }
                async function run() {
                  await load();
                }
                """);

        final EnrichmentResult result = enricher(10).enrich();

        assertEquals(1, result.edgesCreated());
        final GraphEdge edge = rejectsFrom(functionId("run")).get(0);
        assertEquals(NodeFactory.builtinClassId("TypeError"), edge.dst());
        assertEquals("TypeError", edge.metadata().get("errorClassName"));
        assertFalse(backend.getNode(edge.dst()).isPresent());
    }

    @Test
    void whenEnriching_givenCrossFileCall_shouldPropagateThroughImport() {
        final ImportResolver resolver = new ImportResolver(Set.of(
                "src/validate.ts", "src/handler.ts"));
        final JsSourceAnalyzer analyzer = new JsSourceAnalyzer();
        final GraphBuilder builder = new GraphBuilder(backend);
        builder.build(analyzer.analyze(new SourceFile("src/validate.ts",
                "export " + VALIDATE.replace("async function",
                        "export async function")), resolver));
        builder.build(analyzer.analyze(new SourceFile("src/handler.ts", """
                import { validate } from './validate';
                export async function handler(req) {
                  await validate(req.body);
                }
                """), resolver));

        enricher(10).enrich();

        final List<GraphEdge> rejects = rejectsFrom(NodeFactory.functionId(
                "handler", ScopeContext.global("src/handler.ts")));
        assertEquals(1, rejects.size());
        assertEquals(NodeFactory.classId("ValidationError",
                ScopeContext.global("src/validate.ts")), rejects.get(0).dst());
    }

    // -- bounds ------------------------------------------------------------

    @Test
    void whenEnriching_givenBoundTooLow_shouldReportNotConverged() {
        build(CHAIN);

        final EnrichmentResult result = enricher(1).enrich();

        assertFalse(result.converged());
        assertEquals(1, result.iterations());
        assertEquals(1, result.edgesCreated());
        assertTrue(rejectsFrom(functionId("controller")).isEmpty());
    }

    @Test
    void whenEnriching_givenSecondRun_shouldOnlyAddMissingEdges() {
        build(CHAIN);
        enricher(1).enrich();
        final int before = backend.queryEdges(
                EdgeQuery.ofType(EdgeType.REJECTS)).size();

        final EnrichmentResult second = enricher(10).enrich();
        final EnrichmentResult third = enricher(10).enrich();

        assertEquals(1, second.edgesCreated());
        assertTrue(second.converged());
        assertEquals(before + 1, backend.queryEdges(
                EdgeQuery.ofType(EdgeType.REJECTS)).size());
        assertEquals(0, third.edgesCreated());
        assertEquals(1, third.iterations());
    }

    @Test
    void whenEnriching_givenReversedReadOrder_shouldProduceSameEdges() {
        final String source = VALIDATE + """
                async function check(input) {
                  if (!input) {
                    throw new ValidationError('empty');
                  }
                  return input;
                }
                async function both(req) {
                  await validate(req.body);
                  await check(req.query);
                }
                async function entry(req) {
                  return await both(req);
                }
                """;
        final InMemoryGraphBackend reversed = new ReversedReadBackend();
        build(backend, source);
        build(reversed, source);

        final EnrichmentResult forward = enricher(10).enrich();
        final EnrichmentResult backward = new RejectionPropagationEnricher(
                reversed, 10).enrich();

        assertEquals(forward.edgesCreated(), backward.edgesCreated());
        assertEquals(forward.iterations(), backward.iterations());
        assertEquals(Set.copyOf(backend.queryEdges(
                EdgeQuery.ofType(EdgeType.REJECTS))),
                Set.copyOf(reversed.queryEdges(
                        EdgeQuery.ofType(EdgeType.REJECTS))));
        assertEquals(functionId("check"), rejectsFrom(functionId("both"))
                .get(0).metadata().get("propagatedFrom"));
    }

    @Test
    void whenEnriching_givenEmptyGraph_shouldConvergeImmediately() {
        final EnrichmentResult result = enricher(10).enrich();

        assertTrue(result.converged());
        assertEquals(1, result.iterations());
        assertEquals(0, result.edgesCreated());
    }

    @Test
    void whenCreating_givenNonPositiveBound_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> new RejectionPropagationEnricher(backend, 0));
    }

    // -- helpers -----------------------------------------------------------

    private void build(final String content) {
        build(backend, content);
    }

    private static void build(final InMemoryGraphBackend target,
            final String content) {
        new GraphBuilder(target).build(new JsSourceAnalyzer().analyze(
                new SourceFile(FILE, content)));
    }

    private RejectionPropagationEnricher enricher(final int maxIterations) {
        return new RejectionPropagationEnricher(backend, maxIterations);
    }

    private List<GraphEdge> rejectsFrom(final String functionId) {
        return backend.getOutgoingEdges(functionId, Set.of(EdgeType.REJECTS));
    }

    private static Set<String> targets(final List<GraphEdge> edges) {
        return Set.copyOf(edges.stream().map(GraphEdge::dst).toList());
    }

    private static String functionId(final String name) {
        return NodeFactory.functionId(name, ScopeContext.global(FILE));
    }

    private static String classId(final String name) {
        return NodeFactory.classId(name, ScopeContext.global(FILE));
    }

    /** Serves every read in the opposite order of the plain backend. */
    private static final class ReversedReadBackend
            extends InMemoryGraphBackend {

        @Override
        public List<GraphNode> queryNodes(final NodeQuery query) {
            return reversed(super.queryNodes(query));
        }

        @Override
        public List<GraphEdge> queryEdges(final EdgeQuery query) {
            return reversed(super.queryEdges(query));
        }

        @Override
        public List<GraphEdge> getIncomingEdges(final String id,
                final Set<EdgeType> types) {
            return reversed(super.getIncomingEdges(id, types));
        }

        @Override
        public List<GraphEdge> getOutgoingEdges(final String id,
                final Set<EdgeType> types) {
            return reversed(super.getOutgoingEdges(id, types));
        }

        private static <T> List<T> reversed(final List<T> items) {
            final List<T> copy = new ArrayList<>(items);
            Collections.reverse(copy);
            return copy;
        }
    }

}

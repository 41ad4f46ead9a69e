package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.graph.domain.EdgeQuery;
import co.fanki.codegraph.graph.domain.EdgeType;
import co.fanki.codegraph.graph.domain.GraphBackend;
import co.fanki.codegraph.graph.domain.GraphEdge;
import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.InMemoryGraphBackend;
import co.fanki.codegraph.graph.domain.NodeQuery;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;
import co.fanki.codegraph.graph.domain.nodes.NodeFactory;

import org.easymock.Capture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for GraphBuilder, fed by the real analyzer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphBuilderTest {

    private static final String FILE = "src/app.ts";

    private final JsSourceAnalyzer analyzer = new JsSourceAnalyzer();

    private InMemoryGraphBackend backend;
    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        backend = new InMemoryGraphBackend();
        builder = new GraphBuilder(backend);
    }

    // -- structure ---------------------------------------------------------

    @Test
    void whenBuilding_givenAnyFile_shouldOnlyReferenceKnownSources() {
        build("""
                class ValidationError extends Error {}
                async function validate(input) {
                  const result = { ok: false, errors: [1, 2] };
                  try {
                    check(input);
                  } catch (e) {
                    throw new TypeError('unexpected');
                  }
                  return result;
                }
                """);

        final Set<String> ids = nodeIds();
        for (GraphEdge edge : backend.queryEdges(EdgeQuery.all())) {
            assertTrue(ids.contains(edge.src()), "dangling source " + edge);
            if (edge.type() == EdgeType.CONTAINS) {
                assertTrue(ids.contains(edge.dst()), "dangling child " + edge);
            }
        }
    }

    @Test
    void whenBuilding_givenFunctionWithParameters_shouldLinkThem() {
        build("""
                function add(a, b) {
                  const sum = a + b;
                  return sum;
                }
                """);

        final String add = NodeFactory.functionId("add",
                ScopeContext.global(FILE));
        assertEquals(2, backend.getOutgoingEdges(add,
                Set.of(EdgeType.HAS_PARAMETER)).size());
        assertEquals(1, backend.getOutgoingEdges(add,
                Set.of(EdgeType.DECLARES)).size());
        assertEquals(1, backend.getIncomingEdges(add,
                Set.of(EdgeType.CONTAINS)).size());
    }

    @Test
    void whenBuilding_givenLocalSuperclass_shouldDeriveFromIt() {
        build("""
                class HttpError extends Error {}
                class NotFoundError extends HttpError {}
                """);

        final List<GraphEdge> derives = edges(EdgeType.DERIVES_FROM);
        assertEquals(1, derives.size());
        assertEquals(classId("NotFoundError"), derives.get(0).src());
        assertEquals(classId("HttpError"), derives.get(0).dst());
    }

    // -- rejections and throws ---------------------------------------------

    @Test
    void whenBuilding_givenRejectedLocalClass_shouldCreateRejectsEdge() {
        build("""
                class ValidationError extends Error {}
                async function validate(input) {
                  if (!input) {
                    throw new ValidationError('missing');
                  }
                }
                """);

        final List<GraphEdge> rejects = edges(EdgeType.REJECTS);
        assertEquals(1, rejects.size());
        final GraphEdge edge = rejects.get(0);
        assertEquals(functionId("validate"), edge.src());
        assertEquals(classId("ValidationError"), edge.dst());
        assertEquals("async_throw", edge.metadata().get("rejectionType"));
        assertEquals("ValidationError", edge.metadata().get("errorClassName"));
    }

    @Test
    void whenBuilding_givenBuiltinErrors_shouldRecordThemInMetadata() {
        build("""
                async function load() {
                  throw new TypeError('bad');
                }
                function parse() {
                  throw new Error('bad');
                }
                """);

        assertTrue(edges(EdgeType.REJECTS).isEmpty());
        assertTrue(edges(EdgeType.THROWS).isEmpty());
        assertEquals(List.of("TypeError"), node(functionId("load"))
                .controlFlow().rejectedBuiltinErrors());
        assertEquals(List.of("Error"), node(functionId("parse"))
                .controlFlow().thrownBuiltinErrors());
    }

    @Test
    void whenBuilding_givenRejectionPatterns_shouldAttachThemToFunction() {
        build("""
                function fail(reason) {
                  return Promise.reject(reason);
                }
                """);

        @SuppressWarnings("unchecked")
        final List<Map<String, Object>> patterns = (List<Map<String, Object>>)
                node(functionId("fail")).metadata().get("rejectionPatterns");
        assertEquals(1, patterns.size());
        assertEquals("variable_parameter",
                patterns.get(0).get("rejectionType"));
        assertEquals(List.of("reason"), patterns.get(0).get("tracePath"));
    }

    @Test
    void whenBuilding_givenImportedErrorClass_shouldPointAcrossFiles() {
        final ImportResolver resolver = new ImportResolver(Set.of(FILE,
                "src/errors.ts"));
        builder.build(analyzer.analyze(new SourceFile(FILE, """
                import { NotFoundError } from './errors';
                function find() {
                  throw new NotFoundError('user');
                }
                """), resolver));

        final List<GraphEdge> throwsEdges = edges(EdgeType.THROWS);
        assertEquals(1, throwsEdges.size());
        assertEquals(NodeFactory.classId("NotFoundError",
                ScopeContext.global("src/errors.ts")), throwsEdges.get(0).dst());
        assertTrue(node(functionId("find")).controlFlow()
                .thrownBuiltinErrors().isEmpty());
    }

    @Test
    void whenBuilding_givenNamespacedErrorClass_shouldPointAtImportedModule() {
        final ImportResolver resolver = new ImportResolver(Set.of(FILE,
                "src/errors.ts"));
        builder.build(analyzer.analyze(new SourceFile(FILE, """
                import * as errors from './errors';
                class NotFound extends Error {}
                async function f() {
                  throw new errors.NotFound('user');
                }
                async function g() {
                  throw new errors.Forbidden('admin');
                }
                function h() {
                  return new NotFound('local');
                }
                """), resolver));

        final ScopeContext errors = ScopeContext.global("src/errors.ts");
        final Set<String> fromF = new HashSet<>();
        final Set<String> fromG = new HashSet<>();
        for (GraphEdge edge : edges(EdgeType.REJECTS)) {
            if (edge.src().equals(functionId("f"))) {
                fromF.add(edge.dst());
            } else if (edge.src().equals(functionId("g"))) {
                fromG.add(edge.dst());
            }
        }
        assertEquals(Set.of(NodeFactory.classId("NotFound", errors)), fromF);
        assertEquals(Set.of(NodeFactory.classId("Forbidden", errors)), fromG);
        assertTrue(node(functionId("g")).controlFlow().rejectedBuiltinErrors()
                .isEmpty());

        final Set<String> instanceTargets = new HashSet<>();
        edges(EdgeType.INSTANCE_OF).forEach(edge ->
                instanceTargets.add(edge.dst()));
        assertEquals(Set.of(NodeFactory.classId("NotFound", errors),
                NodeFactory.classId("Forbidden", errors), classId("NotFound")),
                instanceTargets);
    }

    @Test
    void whenBuilding_givenNamespaceOfPackage_shouldKeepQualifiedBuiltinName() {
        build("""
                import * as http from 'http-errors';
                async function load() {
                  throw new http.NotFound();
                }
                """);

        assertTrue(edges(EdgeType.REJECTS).isEmpty());
        assertEquals(List.of("http.NotFound"), node(functionId("load"))
                .controlFlow().rejectedBuiltinErrors());
    }

    // -- calls -------------------------------------------------------------

    @Test
    void whenBuilding_givenLocalAndImportedCalls_shouldResolveTargets() {
        final ImportResolver resolver = new ImportResolver(Set.of(FILE,
                "src/repo.ts", "src/db.ts"));
        builder.build(analyzer.analyze(new SourceFile(FILE, """
                import { findUser } from './repo';
                import * as db from './db';
                function helper() {}
                async function handler() {
                  helper();
                  await findUser();
                  await db.connect();
                  unknown();
                }
                """), resolver));

        final Set<String> targets = new TreeSet<>();
        edges(EdgeType.CALLS).forEach(edge -> targets.add(edge.dst()));
        assertEquals(Set.of(
                functionId("helper"),
                NodeFactory.functionId("findUser",
                        ScopeContext.global("src/repo.ts")),
                NodeFactory.functionId("connect",
                        ScopeContext.global("src/db.ts"))), targets);
        assertEquals(2, edges(EdgeType.IMPORTS_FROM).size());
        assertEquals(1, backend.getIncomingEdges(
                NodeFactory.moduleId("src/db.ts"),
                Set.of(EdgeType.IMPORTS_FROM)).size());
    }

    @Test
    void whenBuilding_givenThisCall_shouldResolveToMethod() {
        build("""
                class UserService {
                  async save(user) {
                    await this.validate(user);
                  }
                  async validate(user) {}
                }
                """);

        final List<GraphEdge> calls = edges(EdgeType.CALLS);
        assertEquals(1, calls.size());
        assertEquals("src/app.ts->UserService->FUNCTION->validate",
                calls.get(0).dst());
    }

    @Test
    void whenBuilding_givenTryCatch_shouldLinkCatchToSources() {
        build("""
                async function handler() {
                  try {
                    await fetchUser();
                  } catch (err) {
                    report(err);
                  }
                }
                """);

        final List<GraphEdge> catches = edges(EdgeType.CATCHES_FROM);
        assertEquals(1, catches.size());
        final GraphEdge edge = catches.get(0);
        assertEquals(NodeType.CATCH_BLOCK, node(edge.src()).type());
        assertEquals(NodeType.CALL, node(edge.dst()).type());
        assertEquals("err", edge.metadata().get("parameterName"));
        assertEquals("awaited_call", edge.metadata().get("sourceType"));
        assertEquals(3, edge.metadata().get("sourceLine"));
    }

    @Test
    void whenBuilding_givenExecutorReject_shouldLinkResolution() {
        build("""
                function wait(ms) {
                  return new Promise((resolve, reject) => {
                    reject(new RangeError('negative'));
                  });
                }
                """);

        final List<GraphEdge> resolutions = edges(EdgeType.RESOLVES_TO);
        assertEquals(1, resolutions.size());
        assertEquals(true, resolutions.get(0).metadata().get("isReject"));
        assertEquals(NodeType.CONSTRUCTOR_CALL,
                node(resolutions.get(0).dst()).type());
    }

    // -- backend interaction -----------------------------------------------

    @Test
    void whenBuilding_givenFile_shouldWriteOneUnit() {
        final GraphBackend mock = createMock(GraphBackend.class);
        final Capture<List<GraphNode>> nodes = newCapture();
        final Capture<List<GraphEdge>> edges = newCapture();
        mock.writeUnit(capture(nodes), capture(edges));
        expectLastCall().once();
        replay(mock);

        new GraphBuilder(mock).build(analyzer.analyze(new SourceFile(FILE,
                "function f() { g(); }\nfunction g() {}\n")));

        verify(mock);
        assertEquals(NodeType.MODULE, nodes.getValue().get(0).type());
        assertFalse(edges.getValue().isEmpty());
    }

    // -- helpers -----------------------------------------------------------

    private void build(final String content) {
        builder.build(analyzer.analyze(new SourceFile(FILE, content)));
    }

    private Set<String> nodeIds() {
        final Set<String> ids = new HashSet<>();
        backend.queryNodes(NodeQuery.all()).forEach(node -> ids.add(node.id()));
        return ids;
    }

    private List<GraphEdge> edges(final EdgeType type) {
        return backend.queryEdges(EdgeQuery.ofType(type));
    }

    private GraphNode node(final String id) {
        return backend.getNode(id).orElseThrow(
                () -> new AssertionError("No node " + id));
    }

    private static String functionId(final String name) {
        return NodeFactory.functionId(name, ScopeContext.global(FILE));
    }

    private static String classId(final String name) {
        return NodeFactory.classId(name, ScopeContext.global(FILE));
    }

}

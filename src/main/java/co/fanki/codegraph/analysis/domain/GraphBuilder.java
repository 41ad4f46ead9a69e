package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.graph.domain.ControlFlowMetadata;
import co.fanki.codegraph.graph.domain.EdgeType;
import co.fanki.codegraph.graph.domain.GraphBackend;
import co.fanki.codegraph.graph.domain.GraphEdge;
import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;
import co.fanki.codegraph.graph.domain.nodes.NodeFactory;
import co.fanki.codegraph.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the collections of one file into nodes and edges and writes them
 * to the graph backend as one unit.
 *
 * <p>References that can be resolved inside the file point at the real
 * node. References into other project files point at the id the target
 * will get once its file is analyzed, computed with the same node
 * contract, and stay dangling until then. Nothing else is invented: a
 * rejected or thrown error class that is neither declared in the file nor
 * imported from the project (Error, TypeError, classes from packages) is
 * recorded in the function's control flow metadata instead of as an
 * edge.</p>
 *
 * <p>The builder keeps no state between calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(GraphBuilder.class);

    private final GraphBackend backend;

    /**
     * Creates a builder.
     *
     * @param theBackend the graph backend, never null
     */
    public GraphBuilder(final GraphBackend theBackend) {
        backend = Preconditions.requireNonNull(theBackend,
                "Graph backend is required");
    }

    /**
     * Builds and writes the graph of one file.
     *
     * @param collections the analyzer output, never null
     */
    public void build(final ModuleCollections collections) {
        Preconditions.requireNonNull(collections, "Collections are required");
        final FileBuild build = new FileBuild(collections);
        build.run();
        backend.writeUnit(new ArrayList<>(build.nodes.values()), build.edges);
        LOG.debug("Built {}: {} nodes, {} edges", collections.file(),
                build.nodes.size(), build.edges.size());
    }

    /** The state of building one file. */
    private static final class FileBuild {

        private final ModuleCollections collections;
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final List<GraphEdge> edges = new ArrayList<>();
        private final Set<String> relations = new HashSet<>();

        private final Map<String, String> classesByName = new HashMap<>();
        private final Map<String, ImportInfo> importsByName = new HashMap<>();
        private final Map<String, Map<String, String>> functionsByParent =
                new HashMap<>();
        private final Map<String, Map<String, String>> methodsByClass =
                new HashMap<>();

        private final Map<String, List<String>> rejectedBuiltins =
                new HashMap<>();
        private final Map<String, List<String>> thrownBuiltins =
                new HashMap<>();
        private final Map<String, List<Map<String, Object>>> patterns =
                new HashMap<>();

        FileBuild(final ModuleCollections theCollections) {
            collections = theCollections;
        }

        void run() {
            indexNodes();
            superClasses();
            calls();
            constructorCalls();
            rejections();
            throwsStatements();
            promiseResolutions();
            catches();
            imports();
            valueBindings();
            finishFunctions();
        }

        private void indexNodes() {
            nodes.put(collections.module().id(), collections.module());
            for (ContainedNode contained : collections.nodes()) {
                final GraphNode node = contained.node();
                nodes.put(node.id(), node);
                addEdge(GraphEdge.of(EdgeType.CONTAINS, contained.parentId(),
                        node.id()));
                switch (node.type()) {
                    case PARAMETER -> addEdge(GraphEdge.of(
                            EdgeType.HAS_PARAMETER, contained.parentId(),
                            node.id()));
                    case VARIABLE -> addEdge(GraphEdge.of(EdgeType.DECLARES,
                            contained.parentId(), node.id()));
                    case FUNCTION -> {
                        functionsByParent.computeIfAbsent(contained.parentId(),
                                k -> new HashMap<>())
                                .putIfAbsent(node.name(), node.id());
                        final String className = node.text("className");
                        if (className != null) {
                            methodsByClass.computeIfAbsent(className,
                                    k -> new HashMap<>())
                                    .putIfAbsent(node.name(), node.id());
                        }
                    }
                    default -> {
                    }
                }
            }
            for (ClassDeclarationInfo declaration : collections.classes()) {
                classesByName.putIfAbsent(declaration.name(),
                        declaration.classId());
            }
            for (ImportInfo info : collections.imports()) {
                importsByName.put(info.localName(), info);
            }
        }

        private void superClasses() {
            for (ClassDeclarationInfo declaration : collections.classes()) {
                final String superClass = declaration.superClassName();
                if (superClass == null) {
                    continue;
                }
                final String target = classReference(superClass);
                if (target != null) {
                    addEdge(GraphEdge.of(EdgeType.DERIVES_FROM,
                            declaration.classId(), target));
                }
            }
        }

        private void calls() {
            for (CallSiteInfo call : collections.callSites()) {
                final String target = call.isMemberCall()
                        ? memberCallTarget(call) : plainCallTarget(call);
                if (target != null) {
                    addEdge(GraphEdge.of(EdgeType.CALLS, call.callId(),
                            target));
                }
            }
        }

        private String plainCallTarget(final CallSiteInfo call) {
            for (String ownerId : call.scopeOwnerIds()) {
                final Map<String, String> declared =
                        functionsByParent.get(ownerId);
                if (declared != null && declared.containsKey(
                        call.calleeName())) {
                    return declared.get(call.calleeName());
                }
            }
            final ImportInfo imported = importsByName.get(call.calleeName());
            if (imported != null && imported.resolvedFile() != null
                    && imported.isNamed()) {
                return NodeFactory.functionId(imported.importedName(),
                        ScopeContext.global(imported.resolvedFile()));
            }
            return null;
        }

        private String memberCallTarget(final CallSiteInfo call) {
            if ("this".equals(call.objectName())) {
                final Map<String, String> methods = call.enclosingClassName()
                        == null ? null
                        : methodsByClass.get(call.enclosingClassName());
                return methods == null ? null : methods.get(call.methodName());
            }
            final ImportInfo namespace = importsByName.get(call.objectName());
            if (namespace != null && "*".equals(namespace.importedName())
                    && namespace.resolvedFile() != null) {
                return NodeFactory.functionId(call.methodName(),
                        ScopeContext.global(namespace.resolvedFile()));
            }
            return null;
        }

        private void constructorCalls() {
            for (ConstructorCallInfo construction
                    : collections.constructorCalls()) {
                final String target = classReference(construction.className());
                if (target != null) {
                    addEdge(GraphEdge.of(EdgeType.INSTANCE_OF,
                            construction.callId(), target));
                }
            }
        }

        private void rejections() {
            for (RejectionPattern pattern : collections.rejectionPatterns()) {
                patterns.computeIfAbsent(pattern.functionId(),
                        k -> new ArrayList<>()).add(pattern.toMetadata());
                final String className = pattern.errorClassName();
                if (className == null) {
                    continue;
                }
                final String target = classReference(className);
                if (target == null) {
                    rejectedBuiltins.computeIfAbsent(pattern.functionId(),
                            k -> new ArrayList<>()).add(className);
                    continue;
                }
                final Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("rejectionType",
                        pattern.rejectionType().label());
                metadata.put("errorClassName", className);
                addEdge(new GraphEdge(EdgeType.REJECTS, pattern.functionId(),
                        target, metadata));
            }
        }

        private void throwsStatements() {
            for (ThrowPattern pattern : collections.throwPatterns()) {
                final String className = pattern.errorClassName();
                if (className == null) {
                    continue;
                }
                final String target = classReference(className);
                if (target == null) {
                    thrownBuiltins.computeIfAbsent(pattern.functionId(),
                            k -> new ArrayList<>()).add(className);
                    continue;
                }
                addEdge(new GraphEdge(EdgeType.THROWS, pattern.functionId(),
                        target, Map.of("errorClassName", className)));
            }
        }

        private void promiseResolutions() {
            for (PromiseResolutionInfo info
                    : collections.promiseResolutions()) {
                addEdge(new GraphEdge(EdgeType.RESOLVES_TO, info.callId(),
                        info.promiseId(), Map.of("isReject", info.reject())));
            }
        }

        private void catches() {
            for (CatchesFromInfo info : collections.catchesFrom()) {
                for (CatchesFromInfo.Source source : info.sources()) {
                    final Map<String, Object> metadata = new LinkedHashMap<>();
                    if (info.parameterName() != null) {
                        metadata.put("parameterName", info.parameterName());
                    }
                    metadata.put("sourceType", source.type().label());
                    metadata.put("sourceLine", source.line());
                    addEdge(new GraphEdge(EdgeType.CATCHES_FROM,
                            info.catchBlockId(), source.sourceId(), metadata));
                }
            }
        }

        private void imports() {
            for (ImportInfo info : collections.imports()) {
                if (info.resolvedFile() != null) {
                    addEdge(new GraphEdge(EdgeType.IMPORTS_FROM,
                            info.importId(),
                            NodeFactory.moduleId(info.resolvedFile()),
                            Map.of("importedName", info.importedName())));
                }
            }
        }

        private void valueBindings() {
            for (ValueBinding binding : collections.valueBindings()) {
                addEdge(new GraphEdge(binding.edgeType(), binding.ownerId(),
                        binding.valueId(), binding.metadata()));
            }
        }

        private void finishFunctions() {
            for (Map.Entry<String, GraphNode> entry : nodes.entrySet()) {
                GraphNode node = entry.getValue();
                if (node.type() != NodeType.FUNCTION) {
                    continue;
                }
                final List<String> rejected = rejectedBuiltins.getOrDefault(
                        node.id(), List.of());
                final List<String> thrown = thrownBuiltins.getOrDefault(
                        node.id(), List.of());
                final ControlFlowMetadata controlFlow = node.controlFlow() == null
                        ? ControlFlowMetadata.straightLine()
                        : node.controlFlow();
                node = node.withControlFlow(controlFlow.withBuiltinErrors(
                        rejected, thrown));
                final List<Map<String, Object>> functionPatterns =
                        patterns.get(node.id());
                if (functionPatterns != null) {
                    node = node.withMetadata("rejectionPatterns",
                            functionPatterns);
                }
                entry.setValue(node);
            }
        }

        /**
         * The id of a class referenced by name: the local declaration, or
         * the class an import of the project points at. Null for anything
         * else.
         */
        private String classReference(final String name) {
            final String local = classesByName.get(name);
            if (local != null) {
                return local;
            }
            final int dot = name.indexOf('.');
            if (dot > 0) {
                final String member = name.substring(dot + 1);
                final ImportInfo namespace = importsByName.get(
                        name.substring(0, dot));
                if (namespace != null && "*".equals(namespace.importedName())
                        && namespace.resolvedFile() != null
                        && !member.isEmpty() && member.indexOf('.') < 0) {
                    return NodeFactory.classId(member,
                            ScopeContext.global(namespace.resolvedFile()));
                }
                return null;
            }
            final ImportInfo imported = importsByName.get(name);
            if (imported == null || imported.resolvedFile() == null
                    || "*".equals(imported.importedName())) {
                return null;
            }
            final String exportedName = imported.isNamed()
                    ? imported.importedName() : imported.localName();
            return NodeFactory.classId(exportedName,
                    ScopeContext.global(imported.resolvedFile()));
        }

        private void addEdge(final GraphEdge edge) {
            if (relations.add(edge.relationKey())) {
                edges.add(edge);
            }
        }
    }

}

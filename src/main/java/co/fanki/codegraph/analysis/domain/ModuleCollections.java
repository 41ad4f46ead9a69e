package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.graph.domain.GraphNode;

import java.util.List;

/**
 * Everything the analyzer learned about one file: the nodes it created and
 * the deferred facts the graph builder turns into edges.
 *
 * @param file the project relative path
 * @param module the MODULE node
 * @param nodes every other node, in source order
 * @param classes the class declarations
 * @param callSites the call expressions
 * @param constructorCalls the new expressions
 * @param imports the import bindings
 * @param rejectionPatterns the ways functions reject
 * @param throwPatterns the synchronous throws
 * @param promiseResolutions resolve and reject calls in promise executors
 * @param catchesFrom the sources of each catch clause
 * @param valueBindings literal and initializer relations
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ModuleCollections(
        String file,
        GraphNode module,
        List<ContainedNode> nodes,
        List<ClassDeclarationInfo> classes,
        List<CallSiteInfo> callSites,
        List<ConstructorCallInfo> constructorCalls,
        List<ImportInfo> imports,
        List<RejectionPattern> rejectionPatterns,
        List<ThrowPattern> throwPatterns,
        List<PromiseResolutionInfo> promiseResolutions,
        List<CatchesFromInfo> catchesFrom,
        List<ValueBinding> valueBindings) {

    public ModuleCollections {
        nodes = List.copyOf(nodes);
        classes = List.copyOf(classes);
        callSites = List.copyOf(callSites);
        constructorCalls = List.copyOf(constructorCalls);
        imports = List.copyOf(imports);
        rejectionPatterns = List.copyOf(rejectionPatterns);
        throwPatterns = List.copyOf(throwPatterns);
        promiseResolutions = List.copyOf(promiseResolutions);
        catchesFrom = List.copyOf(catchesFrom);
        valueBindings = List.copyOf(valueBindings);
    }

    /**
     * Finds a node created for this file.
     *
     * @param id the node id
     * @return the node, or null
     */
    public GraphNode node(final String id) {
        if (module.id().equals(id)) {
            return module;
        }
        for (ContainedNode contained : nodes) {
            if (contained.node().id().equals(id)) {
                return contained.node();
            }
        }
        return null;
    }

}

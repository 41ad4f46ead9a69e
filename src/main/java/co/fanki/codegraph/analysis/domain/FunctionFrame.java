package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.graph.domain.ControlFlowMetadata;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable traversal state of one function body, or of the module top
 * level when {@link #functionId} is null.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class FunctionFrame {

    /**
     * The resolve and reject parameter names of a promise executor.
     */
    record PromiseExecutor(String resolveName, String rejectName,
            String promiseId, String creatorFunctionId) {
    }

    /**
     * Collects the exception sources of the try block being traversed.
     */
    static final class CatchCollector {

        private final String catchBlockId;
        private final String parameterName;
        private final List<CatchesFromInfo.Source> sources = new ArrayList<>();

        CatchCollector(final String theCatchBlockId,
                final String theParameterName) {
            catchBlockId = theCatchBlockId;
            parameterName = theParameterName;
        }

        void add(final String sourceId, final CatchSourceType type,
                final int line) {
            sources.add(new CatchesFromInfo.Source(sourceId, type, line));
        }

        CatchesFromInfo toInfo() {
            return new CatchesFromInfo(catchBlockId, parameterName, sources);
        }
    }

    private final String functionId;
    private final String ownerId;
    private final boolean async;
    private final String thisClassName;
    private final String bodyKey;
    private final PromiseExecutor executor;

    private final Map<String, AliasBinding> bindings = new HashMap<>();
    private final Deque<CatchCollector> catchCollectors = new ArrayDeque<>();

    private int tryDepth;
    private int branches;
    private int switches;
    private int cases;
    private int loops;
    private int logicalOperators;
    private boolean hasTryCatch;
    private boolean hasEarlyReturn;
    private boolean hasThrow;
    private boolean hasAsyncThrow;
    private boolean canReject;

    FunctionFrame(final String theFunctionId, final String theOwnerId,
            final boolean isAsync, final String theThisClassName,
            final String theBodyKey, final PromiseExecutor theExecutor) {
        functionId = theFunctionId;
        ownerId = theOwnerId;
        async = isAsync;
        thisClassName = theThisClassName;
        bodyKey = theBodyKey;
        executor = theExecutor;
    }

    static FunctionFrame module(final String moduleId) {
        return new FunctionFrame(null, moduleId, false, null, null, null);
    }

    boolean isModule() {
        return functionId == null;
    }

    String functionId() {
        return functionId;
    }

    /** The id new nodes in this frame are contained by. */
    String ownerId() {
        return ownerId;
    }

    boolean async() {
        return async;
    }

    String thisClassName() {
        return thisClassName;
    }

    String bodyKey() {
        return bodyKey;
    }

    PromiseExecutor executor() {
        return executor;
    }

    Map<String, AliasBinding> bindings() {
        return bindings;
    }

    CatchCollector currentCatch() {
        return catchCollectors.peek();
    }

    void enterTry(final CatchCollector collector) {
        tryDepth++;
        catchCollectors.push(collector);
        hasTryCatch = true;
    }

    CatchCollector exitTry() {
        tryDepth--;
        return catchCollectors.pop();
    }

    boolean insideTry() {
        return tryDepth > 0;
    }

    void branch() {
        branches++;
    }

    void switchStatement() {
        switches++;
    }

    void switchCase() {
        cases++;
    }

    void loop() {
        loops++;
    }

    void logicalOperator() {
        logicalOperators++;
    }

    void earlyReturn() {
        hasEarlyReturn = true;
    }

    void syncThrow() {
        hasThrow = true;
    }

    void asyncThrow() {
        hasAsyncThrow = true;
        canReject = true;
    }

    void rejects() {
        canReject = true;
    }

    ControlFlowMetadata controlFlow() {
        return new ControlFlowMetadata(
                branches + switches > 0,
                loops > 0,
                hasTryCatch,
                hasEarlyReturn,
                hasThrow,
                hasAsyncThrow,
                canReject,
                1 + branches + loops + cases + logicalOperators,
                List.of(),
                List.of());
    }

}

package co.fanki.codegraph.graph.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Control flow summary attached to FUNCTION nodes.
 *
 * <p>{@code hasThrow} is only ever set for a throw inside a synchronous
 * function; a throw inside an async function settles the returned promise
 * and sets {@code hasAsyncThrow} and {@code canReject} instead.</p>
 *
 * @param hasBranches whether the body has if, ternary or switch
 * @param hasLoops whether the body has any loop
 * @param hasTryCatch whether the body has a try statement with a catch
 * @param hasEarlyReturn whether a return is not the last body statement
 * @param hasThrow whether a synchronous function throws
 * @param hasAsyncThrow whether an async function throws
 * @param canReject whether the function can produce a rejected promise
 * @param cyclomaticComplexity the cyclomatic complexity, at least 1
 * @param rejectedBuiltinErrors rejected error names with no class node
 * @param thrownBuiltinErrors thrown error names with no class node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ControlFlowMetadata(
        boolean hasBranches,
        boolean hasLoops,
        boolean hasTryCatch,
        boolean hasEarlyReturn,
        boolean hasThrow,
        boolean hasAsyncThrow,
        boolean canReject,
        int cyclomaticComplexity,
        List<String> rejectedBuiltinErrors,
        List<String> thrownBuiltinErrors) {

    /** Creates the metadata, copying the name lists. */
    public ControlFlowMetadata {
        rejectedBuiltinErrors = distinct(rejectedBuiltinErrors);
        thrownBuiltinErrors = distinct(thrownBuiltinErrors);
    }

    /**
     * The metadata of a function with a straight line body.
     *
     * @return metadata with complexity 1 and every flag off
     */
    public static ControlFlowMetadata straightLine() {
        return new ControlFlowMetadata(false, false, false, false, false,
                false, false, 1, List.of(), List.of());
    }

    /**
     * Returns a copy with the given builtin error names appended,
     * deduplicated and keeping the first occurrence order.
     *
     * @param rejected rejected builtin error names, never null
     * @param thrown thrown builtin error names, never null
     * @return a new metadata instance
     */
    public ControlFlowMetadata withBuiltinErrors(final List<String> rejected,
            final List<String> thrown) {
        final List<String> allRejected = new ArrayList<>(rejectedBuiltinErrors);
        allRejected.addAll(rejected);
        final List<String> allThrown = new ArrayList<>(thrownBuiltinErrors);
        allThrown.addAll(thrown);
        return new ControlFlowMetadata(hasBranches, hasLoops, hasTryCatch,
                hasEarlyReturn, hasThrow, hasAsyncThrow, canReject,
                cyclomaticComplexity, allRejected, allThrown);
    }

    private static List<String> distinct(final List<String> names) {
        if (names == null) {
            return List.of();
        }
        return Collections.unmodifiableList(
                new ArrayList<>(new LinkedHashSet<>(names)));
    }

}

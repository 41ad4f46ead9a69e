package co.fanki.codegraph.analysis.domain;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Follows a chain of local aliases back to a constructor call.
 *
 * <p>The walk stops at the first of: a constructor ({@code new X()}), a
 * parameter, a name with no known binding, a name already visited, or
 * {@value #MAX_HOPS} hops. Only bindings visible in the enclosing function
 * chain are considered; values flowing in through callers are not
 * traced.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class MicroTracer {

    static final int MAX_HOPS = 5;

    private MicroTracer() {
    }

    /**
     * The outcome of a trace.
     *
     * @param errorClassName the constructed class, null when unresolved
     * @param rejectionType TRACED_VARIABLE, UNRESOLVED_PARAMETER or
     *        UNRESOLVED_VARIABLE
     * @param tracePath the names visited, ending with the class name when
     *        resolved
     */
    record Result(String errorClassName, RejectionType rejectionType,
            List<String> tracePath) {
    }

    /**
     * Traces an identifier.
     *
     * @param start the identifier to trace
     * @param lookup the binding of a name, null when unknown
     * @return the trace result, never null
     */
    static Result trace(final String start,
            final Function<String, AliasBinding> lookup) {
        final Set<String> visited = new HashSet<>();
        final List<String> path = new ArrayList<>();
        String name = start;
        for (int hop = 0; hop < MAX_HOPS; hop++) {
            path.add(name);
            if (!visited.add(name)) {
                return unresolved(RejectionType.UNRESOLVED_VARIABLE, path);
            }
            final AliasBinding binding = lookup.apply(name);
            if (binding == null) {
                return unresolved(RejectionType.UNRESOLVED_VARIABLE, path);
            }
            switch (binding.kind()) {
                case CONSTRUCT -> {
                    path.add(binding.value());
                    return new Result(binding.value(),
                            RejectionType.TRACED_VARIABLE, path);
                }
                case PARAMETER -> {
                    return unresolved(RejectionType.UNRESOLVED_PARAMETER,
                            path);
                }
                case OPAQUE -> {
                    return unresolved(RejectionType.UNRESOLVED_VARIABLE,
                            path);
                }
                case ALIAS -> name = binding.value();
                default -> throw new IllegalStateException(
                        "Unknown binding " + binding.kind());
            }
        }
        return unresolved(RejectionType.UNRESOLVED_VARIABLE, path);
    }

    private static Result unresolved(final RejectionType type,
            final List<String> path) {
        return new Result(null, type, path);
    }

}

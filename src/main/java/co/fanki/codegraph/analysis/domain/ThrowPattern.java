package co.fanki.codegraph.analysis.domain;

import java.util.List;

/**
 * A synchronous throw inside a non async function.
 *
 * @param functionId the throwing function
 * @param errorClassName the thrown class, null when unresolved
 * @param line the line of the throw
 * @param tracePath the names visited while tracing, may be empty
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ThrowPattern(String functionId, String errorClassName,
        int line, List<String> tracePath) {

    public ThrowPattern {
        tracePath = tracePath == null ? List.of() : List.copyOf(tracePath);
    }

}

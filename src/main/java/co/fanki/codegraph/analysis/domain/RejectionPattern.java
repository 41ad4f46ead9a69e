package co.fanki.codegraph.analysis.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A way a function can produce a rejected promise.
 *
 * @param functionId the function that rejects
 * @param errorClassName the error class, null when unresolved
 * @param rejectionType how the class was determined
 * @param file the file
 * @param line the line of the rejecting expression
 * @param column the column of the rejecting expression
 * @param tracePath the names visited while tracing, may be empty
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RejectionPattern(String functionId, String errorClassName,
        RejectionType rejectionType, String file, int line, int column,
        List<String> tracePath) {

    public RejectionPattern {
        tracePath = tracePath == null ? List.of() : List.copyOf(tracePath);
    }

    /**
     * A JSON friendly view for node metadata.
     *
     * @return the pattern as a map
     */
    public Map<String, Object> toMetadata() {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rejectionType", rejectionType.label());
        if (errorClassName != null) {
            metadata.put("errorClassName", errorClassName);
        }
        metadata.put("line", line);
        if (!tracePath.isEmpty()) {
            metadata.put("tracePath", tracePath);
        }
        return metadata;
    }

}

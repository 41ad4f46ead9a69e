package co.fanki.codegraph.analysis.application;

/**
 * A file that contributed nothing to the graph.
 *
 * @param file the project relative path
 * @param errorCode the error code of the failure
 * @param message what went wrong
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileAnalysisFailure(String file, String errorCode,
        String message) {
}

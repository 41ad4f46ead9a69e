package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

/**
 * A source file handed to the analyzer.
 *
 * @param path the project relative path with forward slashes
 * @param content the file content
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceFile(String path, String content) {

    public SourceFile {
        Preconditions.requireNonBlank(path, "Source path is required");
        Preconditions.requireNonNull(content, "Source content is required");
        path = path.replace('\\', '/');
    }

}

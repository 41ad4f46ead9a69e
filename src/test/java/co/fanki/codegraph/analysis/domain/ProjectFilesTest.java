package co.fanki.codegraph.analysis.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for ProjectFiles.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectFilesTest {

    @Test
    void whenDiscovering_givenMixedTree_shouldKeepOnlyProjectSources(
            @TempDir final Path root) throws IOException {
        touch(root, "src/app.ts");
        touch(root, "src/util/strings.mjs");
        touch(root, "lib/legacy.cjs");
        touch(root, "src/types.d.ts");
        touch(root, "src/readme.md");
        touch(root, "node_modules/express/index.js");
        touch(root, "dist/app.js");
        touch(root, ".cache/tmp.ts");

        final List<String> files = ProjectFiles.discover(root).stream()
                .map(file -> ProjectFiles.relativePath(root, file))
                .toList();

        assertEquals(List.of("lib/legacy.cjs", "src/app.ts",
                "src/util/strings.mjs"), files);
    }

    @Test
    void whenDiscovering_givenEmptyDirectory_shouldReturnNothing(
            @TempDir final Path root) throws IOException {
        assertEquals(List.of(), ProjectFiles.discover(root));
    }

    @Test
    void whenComputingRelativePath_givenNestedFile_shouldUseForwardSlashes(
            @TempDir final Path root) {
        assertEquals("src/api/client.ts", ProjectFiles.relativePath(root,
                root.resolve("src").resolve("api").resolve("client.ts")));
    }

    private static void touch(final Path root, final String relativePath)
            throws IOException {
        final Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "export {};\n");
    }

}

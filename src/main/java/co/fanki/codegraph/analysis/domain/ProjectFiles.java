package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Finds the source files of a project.
 *
 * <p>Walks the project root and keeps regular files with a supported
 * extension, skipping dependency and build output directories, hidden
 * directories and TypeScript declaration files. The result is sorted so
 * that a batch always sees its files in the same order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ProjectFiles {

    private static final Set<String> EXCLUDED_DIRS = Set.of(
            "node_modules", "dist", "build", "coverage");

    private ProjectFiles() {
    }

    /**
     * Lists the analyzable files under a root.
     *
     * @param projectRoot the project root directory, never null
     * @return the absolute paths, sorted
     * @throws IOException if the tree cannot be walked
     */
    public static List<Path> discover(final Path projectRoot)
            throws IOException {
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        final Path root = projectRoot.toAbsolutePath().normalize();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(ProjectFiles::hasValidExtension)
                    .filter(path -> isNotInExcludedDir(root.relativize(path)))
                    .filter(ProjectFiles::isNotDeclarationFile)
                    .sorted()
                    .toList();
        }
    }

    /**
     * The project relative path of a file, with forward slashes.
     *
     * @param projectRoot the project root
     * @param file a file under the root
     * @return the relative path
     */
    public static String relativePath(final Path projectRoot,
            final Path file) {
        return projectRoot.toAbsolutePath().normalize()
                .relativize(file.toAbsolutePath().normalize())
                .toString().replace('\\', '/');
    }

    private static boolean hasValidExtension(final Path path) {
        final String name = path.getFileName().toString();
        for (final String ext : ImportResolver.EXTENSIONS) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNotInExcludedDir(final Path relative) {
        final Path parent = relative.getParent();
        if (parent == null) {
            return true;
        }
        for (final Path component : parent) {
            final String name = component.toString();
            if (EXCLUDED_DIRS.contains(name) || name.startsWith(".")) {
                return false;
            }
        }
        return true;
    }

    private static boolean isNotDeclarationFile(final Path path) {
        final String name = path.getFileName().toString();
        return !name.endsWith(".d.ts") && !name.endsWith(".d.mts")
                && !name.endsWith(".d.cts");
    }

}

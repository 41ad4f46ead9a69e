package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves relative import specifiers to project files.
 *
 * <p>Resolution tries, in order: the specifier as is, the specifier with
 * each supported extension, a TypeScript file for a {@code .js} specifier,
 * and {@code index} files inside a directory. When nothing matches, the
 * importing file's extension is appended so the computed id is still
 * deterministic. Bare specifiers (packages) are external and resolve to
 * null.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ImportResolver {

    /** Extensions the analyzer accepts, in resolution order. */
    public static final List<String> EXTENSIONS = List.of(
            ".ts", ".mts", ".cts", ".js", ".mjs", ".cjs");

    private final Set<String> knownFiles;

    /**
     * Creates a resolver over the files of one analysis batch.
     *
     * @param theKnownFiles the project relative paths, never null
     */
    public ImportResolver(final Set<String> theKnownFiles) {
        Preconditions.requireNonNull(theKnownFiles, "Known files are required");
        knownFiles = Collections.unmodifiableSet(new HashSet<>(theKnownFiles));
    }

    /**
     * A resolver that knows no other file.
     *
     * @return the resolver
     */
    public static ImportResolver isolated() {
        return new ImportResolver(Set.of());
    }

    /**
     * Resolves a specifier.
     *
     * @param fromFile the importing file
     * @param specifier the specifier as written
     * @return the project relative path, or null for external packages
     */
    public String resolve(final String fromFile, final String specifier) {
        if (specifier == null || !specifier.startsWith(".")) {
            return null;
        }
        final String base = normalize(directoryOf(fromFile), specifier);
        if (knownFiles.contains(base)) {
            return base;
        }
        for (String extension : EXTENSIONS) {
            if (knownFiles.contains(base + extension)) {
                return base + extension;
            }
        }
        final String withoutExtension = stripExtension(base);
        if (!withoutExtension.equals(base)) {
            for (String extension : EXTENSIONS) {
                if (knownFiles.contains(withoutExtension + extension)) {
                    return withoutExtension + extension;
                }
            }
        }
        for (String extension : EXTENSIONS) {
            final String index = base + "/index" + extension;
            if (knownFiles.contains(index)) {
                return index;
            }
        }
        if (!withoutExtension.equals(base)) {
            return base;
        }
        return base + extensionOf(fromFile);
    }

    private static String directoryOf(final String file) {
        final int slash = file.lastIndexOf('/');
        return slash < 0 ? "" : file.substring(0, slash);
    }

    private static String normalize(final String directory,
            final String specifier) {
        final Deque<String> parts = new ArrayDeque<>();
        final String joined = directory.isEmpty()
                ? specifier : directory + "/" + specifier;
        for (String part : joined.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                if (!parts.isEmpty()) {
                    parts.removeLast();
                }
                continue;
            }
            parts.addLast(part);
        }
        return String.join("/", parts);
    }

    private static String stripExtension(final String path) {
        for (String extension : EXTENSIONS) {
            if (path.endsWith(extension)) {
                return path.substring(0, path.length() - extension.length());
            }
        }
        return path;
    }

    private static String extensionOf(final String file) {
        for (String extension : EXTENSIONS) {
            if (file.endsWith(extension)) {
                return extension;
            }
        }
        return "";
    }

}

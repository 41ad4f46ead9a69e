package co.fanki.codegraph.graph.domain;

import co.fanki.codegraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The lexical position of a declaration: the file and the chain of named
 * scopes (classes and functions) enclosing it, outermost first.
 *
 * <p>Scope aware ids derived from this context survive line churn: adding
 * a blank line above a function does not change its id.</p>
 *
 * @param file the project relative path of the file
 * @param scopePath the enclosing scope names, outermost first
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScopeContext(String file, List<String> scopePath) {

    /** The reserved file that hosts built-in classes such as Error. */
    public static final String BUILTIN_FILE = "<builtin>";

    /**
     * Creates a scope context.
     *
     * @param file the file, never blank
     * @param scopePath the enclosing scope names, never null
     */
    public ScopeContext {
        Preconditions.requireNonBlank(file, "Scope file is required");
        Preconditions.requireNonNull(scopePath, "Scope path is required");
        scopePath = Collections.unmodifiableList(new ArrayList<>(scopePath));
    }

    /**
     * The module level scope of a file.
     *
     * @param file the file, never blank
     * @return the global scope of the file
     */
    public static ScopeContext global(final String file) {
        return new ScopeContext(file, List.of());
    }

    /**
     * The global scope of the built-in runtime.
     *
     * @return the built-in scope
     */
    public static ScopeContext builtins() {
        return global(BUILTIN_FILE);
    }

    /**
     * Returns a child scope nested in this one.
     *
     * @param scopeName the name of the nested scope, never blank
     * @return a new context, this one is not modified
     */
    public ScopeContext enter(final String scopeName) {
        Preconditions.requireNonBlank(scopeName, "Scope name is required");
        final List<String> path = new ArrayList<>(scopePath);
        path.add(scopeName);
        return new ScopeContext(file, path);
    }

    /**
     * Whether this is the module level scope.
     *
     * @return true when no scope encloses the position
     */
    public boolean isGlobal() {
        return scopePath.isEmpty();
    }

}

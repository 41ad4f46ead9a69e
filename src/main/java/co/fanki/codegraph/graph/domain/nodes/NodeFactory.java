package co.fanki.codegraph.graph.domain.nodes;

import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.ScopeContext;

/**
 * Single entry point to the node contracts of this package.
 *
 * <p>Each node type has exactly one contract class that owns its id
 * format. Types that have a lexical identity expose two variants: the
 * positional {@code createX} ({@code file:TYPE:name:line:column}) and the
 * scope aware {@code createXWithContext}
 * ({@code file->scope->TYPE->name}). Callers pick the variant by whether
 * they hold a {@link ScopeContext}. Code outside this package has no way
 * to format an id other than the {@code xId} methods below.</p>
 *
 * <p>All methods throw {@link NodeValidationException} when a required
 * field (name, file, line, column or context) is missing.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NodeFactory {

    private NodeFactory() {
    }

    /**
     * Creates the MODULE node of a file, with id
     * {@code file->global->MODULE->module}.
     *
     * @param file the project relative path, never blank
     * @param lineCount the number of lines, zero for an empty file
     *
     * @return the module node
     */
    public static GraphNode createModule(final String file,
            final int lineCount) {
        return ModuleNode.create(file, lineCount);
    }

    /**
     * Creates a FUNCTION node with a positional id.
     *
     * @param name the function name, never blank
     * @param file the project relative path, never blank
     * @param line the 1-based line, never null
     * @param column the 0-based column, never null nor negative
     * @param options the type specific fields, may be null
     *
     * @return the function node, without control flow metadata
     */
    public static GraphNode createFunction(final String name,
            final String file, final Integer line, final Integer column,
            final FunctionNode.Options options) {
        return FunctionNode.create(name, file, line, column, options);
    }

    /**
     * Creates a FUNCTION node with a semantic id built from the lexical
     * scope, so the id survives edits that only move lines.
     *
     * <p>The position is still validated and stored on the node, it just
     * does not take part in the id. A non zero discriminator in the
     * options appends {@code #n} to the id.</p>
     *
     * @param name the function name, never blank
     * @param context the enclosing scope, never null
     * @param line the 1-based line, never null
     * @param column the 0-based column, never null nor negative
     * @param options the type specific fields, may be null
     *
     * @return the function node, without control flow metadata
     */
    public static GraphNode createFunctionWithContext(final String name,
            final ScopeContext context, final Integer line,
            final Integer column, final FunctionNode.Options options) {
        return FunctionNode.createWithContext(name, context, line, column,
                options);
    }

    /**
     * Creates a CLASS node with a positional id.
     *
     * @param name the class name, never blank
     * @param file the project relative path, never blank
     * @param line the 1-based line, never null
     * @param column the 0-based column, never null nor negative
     * @param options the superclass and export flags, may be null
     *
     * @return the class node
     */
    public static GraphNode createClass(final String name, final String file,
            final Integer line, final Integer column,
            final ClassNode.Options options) {
        return ClassNode.create(name, file, line, column, options);
    }

    /**
     * Creates a CLASS node with a semantic id. This is the id that
     * {@link #classId(String, ScopeContext)} computes for other files.
     *
     * @param name the class name, never blank
     * @param context the enclosing scope, never null
     * @param line the 1-based line, never null
     * @param column the 0-based column, never null nor negative
     * @param options the superclass and export flags, may be null
     *
     * @return the class node
     */
    public static GraphNode createClassWithContext(final String name,
            final ScopeContext context, final Integer line,
            final Integer column, final ClassNode.Options options) {
        return ClassNode.createWithContext(name, context, line, column,
                options);
    }

    /** Creates a PARAMETER node with a positional id. */
    public static GraphNode createParameter(final String name,
            final String file, final Integer line, final Integer column,
            final ParameterNode.Options options) {
        return ParameterNode.create(name, file, line, column, options);
    }

    /**
     * Creates a PARAMETER node scoped to its function.
     *
     * @param name the parameter name, never blank
     * @param context the scope of the owning function, never null
     * @param line the 1-based line, never null
     * @param column the 0-based column, never null nor negative
     * @param options position, rest and default flags, may be null
     *
     * @return the parameter node
     */
    public static GraphNode createParameterWithContext(final String name,
            final ScopeContext context, final Integer line,
            final Integer column, final ParameterNode.Options options) {
        return ParameterNode.createWithContext(name, context, line, column,
                options);
    }

    /** Creates a VARIABLE node with a positional id. */
    public static GraphNode createVariable(final String name,
            final String file, final Integer line, final Integer column,
            final VariableNode.Options options) {
        return VariableNode.create(name, file, line, column, options);
    }

    /**
     * Creates a VARIABLE node scoped to its declaring function or module.
     *
     * @param name the variable name, never blank
     * @param context the declaring scope, never null
     * @param line the 1-based line, never null
     * @param column the 0-based column, never null nor negative
     * @param options the declaration kind and discriminator, may be null
     *
     * @return the variable node
     */
    public static GraphNode createVariableWithContext(final String name,
            final ScopeContext context, final Integer line,
            final Integer column, final VariableNode.Options options) {
        return VariableNode.createWithContext(name, context, line, column,
                options);
    }

    /** Creates an IMPORT node with a positional id. */
    public static GraphNode createImport(final String localName,
            final String file, final Integer line, final Integer column,
            final ImportNode.Options options) {
        return ImportNode.create(localName, file, line, column, options);
    }

    /**
     * Creates an IMPORT node for one local binding of an import
     * declaration.
     *
     * @param localName the name bound in the importing file, never blank
     * @param context the module scope, never null
     * @param line the 1-based line, never null
     * @param column the 0-based column, never null nor negative
     * @param options the specifier, imported name and resolved file
     *
     * @return the import node
     */
    public static GraphNode createImportWithContext(final String localName,
            final ScopeContext context, final Integer line,
            final Integer column, final ImportNode.Options options) {
        return ImportNode.createWithContext(localName, context, line, column,
                options);
    }

    /**
     * Creates a CALL node. Calls only have positional ids.
     *
     * @param name the callee as written, never blank
     * @param file the project relative path, never blank
     * @param line the 1-based line, never null
     * @param column the 0-based column, never null nor negative
     * @param options object, method, await and try flags
     *
     * @return the call node
     */
    public static GraphNode createCall(final String name, final String file,
            final Integer line, final Integer column,
            final CallNode.Options options) {
        return CallNode.create(name, file, line, column, options);
    }

    /** Creates a CONSTRUCTOR_CALL node for a {@code new} expression. */
    public static GraphNode createConstructorCall(final String className,
            final String file, final Integer line, final Integer column,
            final int argumentCount) {
        return ConstructorCallNode.create(className, file, line, column,
                argumentCount);
    }

    /** Creates a LITERAL node, abbreviating long raw values in the id. */
    public static GraphNode createLiteral(final String rawValue,
            final String file, final Integer line, final Integer column,
            final String valueType) {
        return LiteralNode.create(rawValue, file, line, column, valueType);
    }

    public static GraphNode createObjectLiteral(final String file,
            final Integer line, final Integer column, final int propertyCount) {
        return ObjectLiteralNode.create(file, line, column, propertyCount);
    }

    public static GraphNode createArrayLiteral(final String file,
            final Integer line, final Integer column, final int elementCount) {
        return ArrayLiteralNode.create(file, line, column, elementCount);
    }

    // -- control flow --

    public static GraphNode createTryBlock(final String file,
            final Integer line, final Integer column,
            final boolean hasFinally) {
        return TryBlockNode.create(file, line, column, hasFinally);
    }

    public static GraphNode createCatchBlock(final String file,
            final Integer line, final Integer column,
            final String parameterName) {
        return CatchBlockNode.create(file, line, column, parameterName);
    }

    public static GraphNode createThrowStatement(final String file,
            final Integer line, final Integer column,
            final String errorClassName, final boolean async) {
        return ThrowStatementNode.create(file, line, column, errorClassName,
                async);
    }

    public static GraphNode createBranch(final String kind, final String file,
            final Integer line, final Integer column, final int caseCount) {
        return BranchNode.create(kind, file, line, column, caseCount);
    }

    public static GraphNode createLoop(final String kind, final String file,
            final Integer line, final Integer column) {
        return LoopNode.create(kind, file, line, column);
    }

    /**
     * Computes the id {@link #createModule(String, int)} gives a file,
     * without creating the node.
     *
     * @param file the project relative path, never blank
     *
     * @return the module id
     */
    public static String moduleId(final String file) {
        return ModuleNode.idFor(file);
    }

    /**
     * Computes the semantic id of a function that is not discriminated.
     * Used to point edges at functions of other files.
     *
     * @param name the function name, never blank
     * @param context the enclosing scope, never null
     *
     * @return the function id
     */
    public static String functionId(final String name,
            final ScopeContext context) {
        return FunctionNode.idFor(name, context, 0);
    }

    /**
     * Computes the semantic id of a class, which may be declared in a file
     * that is not analyzed yet.
     *
     * @param name the class name, never blank
     * @param context the scope that declares it, never null
     *
     * @return the class id
     */
    public static String classId(final String name,
            final ScopeContext context) {
        return ClassNode.idFor(name, context);
    }

    /**
     * Computes the id used for an error class that no project file
     * declares, such as {@code TypeError}. No node is ever created for it.
     *
     * @param name the class name, never blank
     *
     * @return the id in the reserved {@code <builtin>} file
     */
    public static String builtinClassId(final String name) {
        return ClassNode.builtinIdFor(name);
    }

}

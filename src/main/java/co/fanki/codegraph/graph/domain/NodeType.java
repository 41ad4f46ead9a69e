package co.fanki.codegraph.graph.domain;

/**
 * The closed set of node types the graph holds.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeType {

    /** A source file. */
    MODULE,

    /** A function declaration, expression, arrow function or method. */
    FUNCTION,

    /** A class declaration or class expression. */
    CLASS,

    /** A formal parameter of a function. */
    PARAMETER,

    /** A variable declared with var, let or const. */
    VARIABLE,

    /** A call expression. */
    CALL,

    /** A new expression. */
    CONSTRUCTOR_CALL,

    /** A binding introduced by an import statement. */
    IMPORT,

    /** A primitive literal: string, number, boolean, null or template. */
    LITERAL,

    /** An object literal. */
    OBJECT_LITERAL,

    /** An array literal. */
    ARRAY_LITERAL,

    /** The protected block of a try statement with a catch clause. */
    TRY_BLOCK,

    /** A catch clause. */
    CATCH_BLOCK,

    /** A throw statement. */
    THROW_STATEMENT,

    /** An if or switch statement. */
    BRANCH,

    /** A for, for-in, for-of, while or do-while loop. */
    LOOP

}

package co.fanki.codegraph.graph.domain;

/**
 * The closed set of edge types the graph holds.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeType {

    /** Structural parent to child. */
    CONTAINS,

    /** Function to each of its parameters. */
    HAS_PARAMETER,

    /** Function or module to the variables it declares. */
    DECLARES,

    /** Call site to the function it invokes. */
    CALLS,

    /** Class to its superclass. */
    DERIVES_FROM,

    /** Constructor call to the class it instantiates. */
    INSTANCE_OF,

    /** Resolve or reject call to the promise it settles. */
    RESOLVES_TO,

    /** Function to an error class it can reject with. */
    REJECTS,

    /** Synchronous function to an error class it can throw. */
    THROWS,

    /** Catch block to an exception source inside its try block. */
    CATCHES_FROM,

    /** Import binding to the module it comes from. */
    IMPORTS_FROM,

    /** Call site to a literal passed as argument. */
    PASSES_ARGUMENT,

    /** Object literal to a literal property value. */
    HAS_PROPERTY,

    /** Array literal to a literal element. */
    HAS_ELEMENT,

    /** Variable to the expression node that initializes it. */
    ASSIGNED_FROM

}

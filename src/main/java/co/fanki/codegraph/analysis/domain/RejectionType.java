package co.fanki.codegraph.analysis.domain;

/**
 * How the error class of a rejection was determined.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RejectionType {

    /** {@code reject(new X())} inside a promise executor. */
    REJECT_CALL("executor_reject"),

    /** {@code Promise.reject(new X())}. */
    STATIC_REJECT("promise_reject"),

    /** {@code throw new X()} inside an async function. */
    ASYNC_THROW("async_throw"),

    /** An identifier traced back to {@code new X()} in the same function. */
    TRACED_VARIABLE("variable_traced"),

    /** An identifier that is a parameter of the function. */
    UNRESOLVED_PARAMETER("variable_parameter"),

    /** An identifier or expression whose class could not be traced. */
    UNRESOLVED_VARIABLE("variable_unknown");

    private final String label;

    RejectionType(final String theLabel) {
        label = theLabel;
    }

    /**
     * The value stored in graph metadata.
     *
     * @return the label
     */
    public String label() {
        return label;
    }

    public boolean isResolved() {
        return this != UNRESOLVED_PARAMETER && this != UNRESOLVED_VARIABLE;
    }

}

package co.fanki.codegraph.analysis.domain;

/**
 * A {@code new X()} expression.
 *
 * @param callId the CONSTRUCTOR_CALL node id
 * @param className the instantiated class as written
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ConstructorCallInfo(String callId, String className) {
}

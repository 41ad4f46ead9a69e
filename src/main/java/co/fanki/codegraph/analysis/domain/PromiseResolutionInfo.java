package co.fanki.codegraph.analysis.domain;

/**
 * A call to the resolve or reject parameter of a promise executor.
 *
 * @param callId the CALL node id of {@code resolve(...)} or
 *        {@code reject(...)}
 * @param promiseId the CONSTRUCTOR_CALL node id of {@code new Promise}
 * @param reject whether the call rejects
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PromiseResolutionInfo(String callId, String promiseId,
        boolean reject) {
}

package co.fanki.codegraph.analysis.domain;

import java.util.List;

/**
 * A call expression, with what is needed to resolve its target later.
 *
 * @param callId the CALL node id
 * @param calleeName the callee as written
 * @param objectName the receiver of a member call, or null
 * @param methodName the property of a member call, or null
 * @param awaited whether the call is the operand of an await
 * @param insideTry whether a try block with a catch protects the call
 * @param scopeOwnerIds the enclosing function ids, innermost first,
 *        followed by the module id
 * @param enclosingClassName the class of the enclosing method, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CallSiteInfo(String callId, String calleeName,
        String objectName, String methodName, boolean awaited,
        boolean insideTry, List<String> scopeOwnerIds,
        String enclosingClassName) {

    public CallSiteInfo {
        scopeOwnerIds = List.copyOf(scopeOwnerIds);
    }

    public boolean isMemberCall() {
        return methodName != null;
    }

}

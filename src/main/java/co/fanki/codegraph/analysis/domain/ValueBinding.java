package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.graph.domain.EdgeType;

import java.util.Map;

/**
 * A value node reached from an owner: a literal passed as an argument, a
 * property value, an array element or a variable initializer.
 *
 * @param ownerId the call, literal or variable that owns the value
 * @param valueId the value node id
 * @param edgeType the relation from owner to value
 * @param metadata position facts such as the argument index
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ValueBinding(String ownerId, String valueId, EdgeType edgeType,
        Map<String, Object> metadata) {

    public ValueBinding {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

}

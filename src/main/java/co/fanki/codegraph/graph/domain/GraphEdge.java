package co.fanki.codegraph.graph.domain;

import co.fanki.codegraph.shared.Preconditions;
import co.fanki.codegraph.shared.ValueObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed, typed relation between two node ids.
 *
 * <p>The destination does not need to exist as a node: an edge may point
 * at an id that is only materialized when another file is analyzed.
 * Storage deduplicates edges by {@link #relationKey()}, which is type,
 * source and destination only. Record equality still compares the
 * metadata too.</p>
 *
 * @param type the edge type
 * @param src the source node id
 * @param dst the destination node id
 * @param metadata small typed facts about the relation
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphEdge(EdgeType type, String src, String dst,
        Map<String, Object> metadata) implements ValueObject {

    /** Creates an edge, copying the metadata. */
    public GraphEdge {
        Preconditions.requireNonNull(type, "Edge type is required");
        Preconditions.requireNonBlank(src, "Edge source is required");
        Preconditions.requireNonBlank(dst, "Edge destination is required");
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates an edge without metadata.
     *
     * @param type the edge type
     * @param src the source id
     * @param dst the destination id
     * @return the edge
     */
    public static GraphEdge of(final EdgeType type, final String src,
            final String dst) {
        return new GraphEdge(type, src, dst, Map.of());
    }

    /**
     * The identity of the relation, used for deduplication.
     *
     * @return a key built from type, source and destination
     */
    public String relationKey() {
        return type.name() + '|' + src + '|' + dst;
    }

}

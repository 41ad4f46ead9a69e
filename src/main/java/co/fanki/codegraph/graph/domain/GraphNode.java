package co.fanki.codegraph.graph.domain;

import co.fanki.codegraph.shared.Preconditions;
import co.fanki.codegraph.shared.ValueObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable graph vertex.
 *
 * <p>Nodes are created by the contracts in
 * {@code co.fanki.codegraph.graph.domain.nodes}, which own the id format of
 * each type. {@link #reconstitute} exists for storage backends that read
 * nodes back and must not be used to mint new ids.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphNode implements ValueObject {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final NodeType type;
    private final String name;
    private final String file;
    private final int line;
    private final int column;
    private final Map<String, Object> metadata;
    private final ControlFlowMetadata controlFlow;

    private GraphNode(
            final String theId,
            final NodeType theType,
            final String theName,
            final String theFile,
            final int theLine,
            final int theColumn,
            final Map<String, Object> theMetadata,
            final ControlFlowMetadata theControlFlow) {
        id = Preconditions.requireNonBlank(theId, "Node id is required");
        type = Preconditions.requireNonNull(theType, "Node type is required");
        name = Preconditions.requireNonNull(theName, "Node name is required");
        file = Preconditions.requireNonBlank(theFile, "Node file is required");
        line = theLine;
        column = theColumn;
        metadata = theMetadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(theMetadata));
        controlFlow = theControlFlow;
    }

    /**
     * Rebuilds a node that was previously created by a node contract.
     *
     * @param id the stored id
     * @param type the node type
     * @param name the node name
     * @param file the file the node belongs to
     * @param line the 1-based line, 0 when unknown
     * @param column the 0-based column
     * @param metadata type specific metadata, may be null
     * @param controlFlow the control flow summary, null unless FUNCTION
     * @return the node
     */
    public static GraphNode reconstitute(
            final String id,
            final NodeType type,
            final String name,
            final String file,
            final int line,
            final int column,
            final Map<String, Object> metadata,
            final ControlFlowMetadata controlFlow) {
        return new GraphNode(id, type, name, file, line, column, metadata,
                controlFlow);
    }

    /**
     * Returns a copy of this node with another control flow summary.
     *
     * @param theControlFlow the new summary
     * @return a new node with the same id
     */
    public GraphNode withControlFlow(final ControlFlowMetadata theControlFlow) {
        return new GraphNode(id, type, name, file, line, column, metadata,
                theControlFlow);
    }

    /**
     * Returns a copy of this node with one metadata entry set.
     *
     * @param key the metadata key
     * @param value the value, never null
     * @return a new node with the same id
     */
    public GraphNode withMetadata(final String key, final Object value) {
        final Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, Preconditions.requireNonNull(value,
                "Metadata value is required"));
        return new GraphNode(id, type, name, file, line, column, copy,
                controlFlow);
    }

    public String id() {
        return id;
    }

    public NodeType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public String file() {
        return file;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * Returns the control flow summary.
     *
     * @return the summary, null for nodes other than FUNCTION
     */
    public ControlFlowMetadata controlFlow() {
        return controlFlow;
    }

    /**
     * Reads a boolean flag from the metadata.
     *
     * @param key the metadata key
     * @return the flag, false when absent
     */
    public boolean flag(final String key) {
        return Boolean.TRUE.equals(metadata.get(key));
    }

    /**
     * Reads a string value from the metadata.
     *
     * @param key the metadata key
     * @return the value, null when absent
     */
    public String text(final String key) {
        final Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }

    /**
     * Reads a list of strings from the metadata.
     *
     * @param key the metadata key
     * @return the values, empty when absent
     */
    @SuppressWarnings("unchecked")
    public List<String> texts(final String key) {
        final Object value = metadata.get(key);
        if (value instanceof List<?> list) {
            return (List<String>) list;
        }
        return List.of();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GraphNode other)) {
            return false;
        }
        return line == other.line
                && column == other.column
                && id.equals(other.id)
                && type == other.type
                && name.equals(other.name)
                && file.equals(other.file)
                && metadata.equals(other.metadata)
                && Objects.equals(controlFlow, other.controlFlow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, name, file, line, column, metadata,
                controlFlow);
    }

    @Override
    public String toString() {
        return type + "[" + id + "]";
    }

}

package co.fanki.codegraph.graph.domain;

import co.fanki.codegraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Graph backend on PostgreSQL.
 *
 * <p>Nodes are upserted by id. Edges are keyed by {@code (type, src, dst)}
 * and inserted with {@code ON CONFLICT DO NOTHING}, so repeating a write
 * is harmless. Metadata and control flow are stored as JSONB.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
@ConditionalOnProperty(name = "graph.storage", havingValue = "postgres",
        matchIfMissing = true)
public class JdbiGraphBackend implements GraphBackend {

    private static final Logger LOG = LoggerFactory.getLogger(
            JdbiGraphBackend.class);

    /** Upsert a node. Uses: PK on id. */
    public static final String UPSERT_NODE = """
            INSERT INTO graph_nodes (
                id, type, name, file, line, col, metadata, control_flow
            ) VALUES (
                :id, :type, :name, :file, :line, :col,
                CAST(:metadata AS JSONB), CAST(:controlFlow AS JSONB)
            )
            ON CONFLICT (id) DO UPDATE SET
                type = EXCLUDED.type,
                name = EXCLUDED.name,
                file = EXCLUDED.file,
                line = EXCLUDED.line,
                col = EXCLUDED.col,
                metadata = EXCLUDED.metadata,
                control_flow = EXCLUDED.control_flow
            """;

    /** Insert an edge once. Uses: PK on (type, src, dst). */
    public static final String INSERT_EDGE = """
            INSERT INTO graph_edges (type, src, dst, metadata)
            VALUES (:type, :src, :dst, CAST(:metadata AS JSONB))
            ON CONFLICT (type, src, dst) DO NOTHING
            """;

    /** Find node by ID. Uses: PK index. */
    public static final String FIND_NODE_BY_ID =
            "SELECT * FROM graph_nodes WHERE id = :id";

    /** Existing ids among a list. Uses: PK index. */
    public static final String FIND_EXISTING_IDS =
            "SELECT id FROM graph_nodes WHERE id IN (<ids>)";

    private static final TypeReference<Map<String, Object>> MAP_TYPE =
            new TypeReference<>() {};

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;

    /**
     * Creates a new JdbiGraphBackend.
     *
     * @param theJdbi the JDBI instance
     * @param theObjectMapper the mapper used for JSONB columns
     */
    public JdbiGraphBackend(final Jdbi theJdbi,
            final ObjectMapper theObjectMapper) {
        this.jdbi = Preconditions.requireNonNull(theJdbi, "Jdbi is required");
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
    }

    @Override
    public void addNode(final GraphNode node) {
        Preconditions.requireNonNull(node, "Node is required");
        jdbi.useHandle(handle -> insertNodes(handle, List.of(node)));
    }

    @Override
    public void addEdges(final List<GraphEdge> edges,
            final boolean skipTargetValidation) {
        Preconditions.requireNonNull(edges, "Edges are required");
        if (edges.isEmpty()) {
            return;
        }
        jdbi.useTransaction(handle -> {
            if (!skipTargetValidation) {
                validateEndpoints(handle, edges);
            }
            insertEdges(handle, edges);
        });
    }

    /**
     * Writes the nodes and edges of one file in a single transaction.
     *
     * @param nodes the nodes, never null
     * @param edges the edges, never null
     */
    @Override
    public void writeUnit(final List<GraphNode> nodes,
            final List<GraphEdge> edges) {
        Preconditions.requireNonNull(nodes, "Nodes are required");
        Preconditions.requireNonNull(edges, "Edges are required");
        jdbi.useTransaction(handle -> {
            insertNodes(handle, nodes);
            insertEdges(handle, edges);
        });
        LOG.debug("Wrote {} nodes and {} edges", nodes.size(), edges.size());
    }

    @Override
    public Optional<GraphNode> getNode(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_NODE_BY_ID)
                .bind("id", id)
                .map(new GraphNodeRowMapper(objectMapper))
                .findOne());
    }

    @Override
    public List<GraphNode> queryNodes(final NodeQuery query) {
        Preconditions.requireNonNull(query, "Query is required");
        final StringBuilder sql = new StringBuilder(
                "SELECT * FROM graph_nodes WHERE 1 = 1");
        if (query.type() != null) {
            sql.append(" AND type = :type");
        }
        if (query.file() != null) {
            sql.append(" AND file = :file");
        }
        if (query.name() != null) {
            sql.append(" AND name = :name");
        }
        sql.append(" ORDER BY id");
        return jdbi.withHandle(handle -> {
            final Query statement = handle.createQuery(sql.toString());
            if (query.type() != null) {
                statement.bind("type", query.type().name());
            }
            if (query.file() != null) {
                statement.bind("file", query.file());
            }
            if (query.name() != null) {
                statement.bind("name", query.name());
            }
            return statement.map(new GraphNodeRowMapper(objectMapper)).list();
        });
    }

    @Override
    public List<GraphEdge> queryEdges(final EdgeQuery query) {
        Preconditions.requireNonNull(query, "Query is required");
        final StringBuilder sql = new StringBuilder(
                "SELECT * FROM graph_edges WHERE 1 = 1");
        if (query.type() != null) {
            sql.append(" AND type = :type");
        }
        if (query.src() != null) {
            sql.append(" AND src = :src");
        }
        if (query.dst() != null) {
            sql.append(" AND dst = :dst");
        }
        sql.append(" ORDER BY type, src, dst");
        return jdbi.withHandle(handle -> {
            final Query statement = handle.createQuery(sql.toString());
            if (query.type() != null) {
                statement.bind("type", query.type().name());
            }
            if (query.src() != null) {
                statement.bind("src", query.src());
            }
            if (query.dst() != null) {
                statement.bind("dst", query.dst());
            }
            return statement.map(new GraphEdgeRowMapper(objectMapper)).list();
        });
    }

    @Override
    public List<GraphEdge> getIncomingEdges(final String id,
            final Set<EdgeType> types) {
        return edgesAround("dst", id, types);
    }

    @Override
    public List<GraphEdge> getOutgoingEdges(final String id,
            final Set<EdgeType> types) {
        return edgesAround("src", id, types);
    }

    @Override
    public Map<NodeType, Long> countNodesByType() {
        final Map<NodeType, Long> counts = new EnumMap<>(NodeType.class);
        jdbi.useHandle(handle -> handle
                .createQuery("SELECT type, COUNT(*) AS total FROM graph_nodes"
                        + " GROUP BY type")
                .map((rs, ctx) -> Map.entry(
                        NodeType.valueOf(rs.getString("type")),
                        rs.getLong("total")))
                .forEach(entry -> counts.put(entry.getKey(),
                        entry.getValue())));
        return counts;
    }

    @Override
    public Map<EdgeType, Long> countEdgesByType() {
        final Map<EdgeType, Long> counts = new EnumMap<>(EdgeType.class);
        jdbi.useHandle(handle -> handle
                .createQuery("SELECT type, COUNT(*) AS total FROM graph_edges"
                        + " GROUP BY type")
                .map((rs, ctx) -> Map.entry(
                        EdgeType.valueOf(rs.getString("type")),
                        rs.getLong("total")))
                .forEach(entry -> counts.put(entry.getKey(),
                        entry.getValue())));
        return counts;
    }

    @Override
    public void clear() {
        jdbi.useTransaction(handle -> {
            handle.execute("DELETE FROM graph_edges");
            handle.execute("DELETE FROM graph_nodes");
        });
        LOG.info("Graph cleared");
    }

    private List<GraphEdge> edgesAround(final String column, final String id,
            final Set<EdgeType> types) {
        Preconditions.requireNonNull(types, "Edge types are required");
        final String sql = "SELECT * FROM graph_edges WHERE " + column
                + " = :id" + (types.isEmpty() ? "" : " AND type IN (<types>)")
                + " ORDER BY type, src, dst";
        return jdbi.withHandle(handle -> {
            final Query statement = handle.createQuery(sql).bind("id", id);
            if (!types.isEmpty()) {
                statement.bindList("types",
                        types.stream().map(EdgeType::name).toList());
            }
            return statement.map(new GraphEdgeRowMapper(objectMapper)).list();
        });
    }

    private void insertNodes(final Handle handle,
            final List<GraphNode> nodes) {
        if (nodes.isEmpty()) {
            return;
        }
        final PreparedBatch batch = handle.prepareBatch(UPSERT_NODE);
        for (final GraphNode node : nodes) {
            batch.bind("id", node.id())
                    .bind("type", node.type().name())
                    .bind("name", node.name())
                    .bind("file", node.file())
                    .bind("line", node.line())
                    .bind("col", node.column())
                    .bind("metadata", toJson(node.metadata()))
                    .bind("controlFlow", node.controlFlow() == null
                            ? null : toJson(node.controlFlow()))
                    .add();
        }
        batch.execute();
    }

    private void insertEdges(final Handle handle,
            final List<GraphEdge> edges) {
        if (edges.isEmpty()) {
            return;
        }
        final PreparedBatch batch = handle.prepareBatch(INSERT_EDGE);
        for (final GraphEdge edge : edges) {
            batch.bind("type", edge.type().name())
                    .bind("src", edge.src())
                    .bind("dst", edge.dst())
                    .bind("metadata", toJson(edge.metadata()))
                    .add();
        }
        batch.execute();
    }

    private void validateEndpoints(final Handle handle,
            final List<GraphEdge> edges) {
        final Set<String> ids = new HashSet<>();
        for (final GraphEdge edge : edges) {
            ids.add(edge.src());
            ids.add(edge.dst());
        }
        final Set<String> existing = new HashSet<>(handle
                .createQuery(FIND_EXISTING_IDS)
                .bindList("ids", new ArrayList<>(ids))
                .mapTo(String.class)
                .list());
        for (final GraphEdge edge : edges) {
            if (!existing.contains(edge.src())
                    || !existing.contains(edge.dst())) {
                throw new GraphStorageException("Edge " + edge.relationKey()
                        + " points at a missing node");
            }
        }
    }

    private String toJson(final Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new GraphStorageException("Cannot serialize " + value, e);
        }
    }

    private static Map<String, Object> readMap(final ObjectMapper mapper,
            final String json) throws SQLException {
        if (json == null) {
            return Collections.emptyMap();
        }
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (final JsonProcessingException e) {
            throw new SQLException("Invalid JSONB content", e);
        }
    }

    private static final class GraphNodeRowMapper
            implements RowMapper<GraphNode> {

        private final ObjectMapper objectMapper;

        GraphNodeRowMapper(final ObjectMapper theObjectMapper) {
            this.objectMapper = theObjectMapper;
        }

        @Override
        public GraphNode map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final String controlFlowJson = rs.getString("control_flow");
            ControlFlowMetadata controlFlow = null;
            if (controlFlowJson != null) {
                try {
                    controlFlow = objectMapper.readValue(controlFlowJson,
                            ControlFlowMetadata.class);
                } catch (final JsonProcessingException e) {
                    throw new SQLException("Invalid control flow content", e);
                }
            }
            return GraphNode.reconstitute(
                    rs.getString("id"),
                    NodeType.valueOf(rs.getString("type")),
                    rs.getString("name"),
                    rs.getString("file"),
                    rs.getInt("line"),
                    rs.getInt("col"),
                    readMap(objectMapper, rs.getString("metadata")),
                    controlFlow);
        }
    }

    private static final class GraphEdgeRowMapper
            implements RowMapper<GraphEdge> {

        private final ObjectMapper objectMapper;

        GraphEdgeRowMapper(final ObjectMapper theObjectMapper) {
            this.objectMapper = theObjectMapper;
        }

        @Override
        public GraphEdge map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return new GraphEdge(
                    EdgeType.valueOf(rs.getString("type")),
                    rs.getString("src"),
                    rs.getString("dst"),
                    readMap(objectMapper, rs.getString("metadata")));
        }
    }

}

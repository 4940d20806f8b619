package br.edu.ifba.journal.storage.impl;

import br.edu.ifba.journal.storage.GraphStorage;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite implementation of {@link GraphStorage}.
 *
 * <p>Nodes and edges live in two tables. Uniqueness is enforced by unique indexes and every write
 * is an {@code INSERT ... ON CONFLICT}, so a write replayed after a partial failure never adds
 * rows. Edge sub-types are overwritten by the latest write.</p>
 */
public class SQLiteGraphStorage implements GraphStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteGraphStorage.class);

    private static final List<String> CONSTRAINTS = List.of(
        "CREATE UNIQUE INDEX IF NOT EXISTS uq_graph_nodes_key ON graph_nodes (owner_id, label, name)",
        "CREATE UNIQUE INDEX IF NOT EXISTS uq_graph_edges_key ON graph_edges "
            + "(owner_id, src_label, src_name, edge_type, tgt_label, tgt_name)"
    );

    private final SQLiteConnectionManager connectionManager;

    public SQLiteGraphStorage(@NotNull SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        // upserts target the unique indexes, so they must exist before the first write
        return declareConstraints().thenRun(() -> LOG.debug("SQLiteGraphStorage initialized"));
    }

    @Override
    public CompletableFuture<Void> declareConstraints() {
        return CompletableFuture.runAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (Statement stmt = conn.createStatement()) {
                for (String ddl : CONSTRAINTS) {
                    stmt.execute(ddl);
                }
                LOG.debugf("Declared %d graph constraints", CONSTRAINTS.size());
            } catch (SQLException e) {
                throw new RuntimeException("Failed to declare graph constraints", e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Void> upsertNodes(@NotNull List<GraphNode> nodes) {
        return CompletableFuture.runAsync(() -> {
            if (nodes.isEmpty()) {
                return;
            }
            Connection conn = connectionManager.getWriteConnection();
            try {
                insertNodes(conn, nodes);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to upsert " + nodes.size() + " graph nodes", e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Void> upsertEdges(@NotNull List<GraphEdge> edges) {
        return CompletableFuture.runAsync(() -> {
            if (edges.isEmpty()) {
                return;
            }

            String sql = """
                INSERT INTO graph_edges (owner_id, src_label, src_name, edge_type, subtype, tgt_label, tgt_name)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(owner_id, src_label, src_name, edge_type, tgt_label, tgt_name)
                DO UPDATE SET subtype = excluded.subtype
                """;

            Set<GraphNode> endpoints = new LinkedHashSet<>();
            for (GraphEdge edge : edges) {
                endpoints.add(edge.source());
                endpoints.add(edge.target());
            }

            Connection conn = connectionManager.getWriteConnection();
            boolean autoCommit = true;
            try {
                autoCommit = conn.getAutoCommit();
                conn.setAutoCommit(false);
                insertNodes(conn, List.copyOf(endpoints));
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    for (GraphEdge edge : edges) {
                        stmt.setString(1, edge.ownerId());
                        stmt.setString(2, edge.source().label().name());
                        stmt.setString(3, edge.source().name());
                        stmt.setString(4, edge.type().name());
                        stmt.setString(5, edge.subtype());
                        stmt.setString(6, edge.target().label().name());
                        stmt.setString(7, edge.target().name());
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
                LOG.debugf("Upserted %d graph edges", edges.size());
            } catch (SQLException e) {
                rollbackQuietly(conn);
                throw new RuntimeException("Failed to upsert " + edges.size() + " graph edges", e);
            } finally {
                restoreAutoCommit(conn, autoCommit);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<GraphNode>> findNodesByName(@NotNull String ownerId, @NotNull List<String> names) {
        return CompletableFuture.supplyAsync(() -> {
            if (names.isEmpty()) {
                return List.of();
            }

            StringBuilder placeholders = new StringBuilder();
            for (int i = 0; i < names.size(); i++) {
                placeholders.append(i == 0 ? "?" : ", ?");
            }
            String sql = "SELECT owner_id, label, name, display_name FROM graph_nodes "
                + "WHERE owner_id = ? AND name IN (" + placeholders + ") ORDER BY label, name";

            List<GraphNode> result = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, ownerId);
                for (int i = 0; i < names.size(); i++) {
                    stmt.setString(i + 2, GraphNode.normalize(names.get(i)));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(new GraphNode(
                            rs.getString("owner_id"),
                            NodeLabel.valueOf(rs.getString("label")),
                            rs.getString("name"),
                            rs.getString("display_name")));
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to find graph nodes of owner: " + ownerId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<List<GraphEdge>> edgesOf(@NotNull GraphNode node) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                SELECT e.src_label, e.src_name, s.display_name AS src_display,
                       e.edge_type, e.subtype,
                       e.tgt_label, e.tgt_name, t.display_name AS tgt_display
                FROM graph_edges e
                JOIN graph_nodes s ON s.owner_id = e.owner_id AND s.label = e.src_label AND s.name = e.src_name
                JOIN graph_nodes t ON t.owner_id = e.owner_id AND t.label = e.tgt_label AND t.name = e.tgt_name
                WHERE e.owner_id = ?
                  AND ((e.src_label = ? AND e.src_name = ?) OR (e.tgt_label = ? AND e.tgt_name = ?))
                ORDER BY e.edge_type, e.subtype, e.src_name, e.tgt_name
                """;

            List<GraphEdge> result = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, node.ownerId());
                stmt.setString(2, node.label().name());
                stmt.setString(3, node.name());
                stmt.setString(4, node.label().name());
                stmt.setString(5, node.name());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        GraphNode source = new GraphNode(node.ownerId(),
                            NodeLabel.valueOf(rs.getString("src_label")), rs.getString("src_name"), rs.getString("src_display"));
                        GraphNode target = new GraphNode(node.ownerId(),
                            NodeLabel.valueOf(rs.getString("tgt_label")), rs.getString("tgt_name"), rs.getString("tgt_display"));
                        result.add(new GraphEdge(source, EdgeType.valueOf(rs.getString("edge_type")), target, rs.getString("subtype")));
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to read edges of node: " + node.key(), e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<GraphStats> getStats(@NotNull String ownerId) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try {
                return new GraphStats(
                    count(conn, "SELECT COUNT(*) FROM graph_nodes WHERE owner_id = ?", ownerId),
                    count(conn, "SELECT COUNT(*) FROM graph_edges WHERE owner_id = ?", ownerId));
            } catch (SQLException e) {
                throw new RuntimeException("Failed to compute graph stats for owner: " + ownerId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public void close() {
        LOG.debug("SQLiteGraphStorage closed");
    }

    private void insertNodes(Connection conn, List<GraphNode> nodes) throws SQLException {
        String sql = """
            INSERT INTO graph_nodes (owner_id, label, name, display_name)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(owner_id, label, name) DO NOTHING
            """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (GraphNode node : nodes) {
                stmt.setString(1, node.ownerId());
                stmt.setString(2, node.label().name());
                stmt.setString(3, node.name());
                stmt.setString(4, node.displayName());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private int count(Connection conn, String sql, String ownerId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, ownerId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.warn("Rollback of graph edge upsert failed", e);
        }
    }

    private void restoreAutoCommit(Connection conn, boolean autoCommit) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            LOG.warn("Could not restore auto-commit on write connection", e);
        }
    }
}

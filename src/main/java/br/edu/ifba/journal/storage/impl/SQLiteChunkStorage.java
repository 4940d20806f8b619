package br.edu.ifba.journal.storage.impl;

import br.edu.ifba.journal.core.Chunk;
import br.edu.ifba.journal.core.ScoredChunk;
import br.edu.ifba.journal.storage.ChunkStorage;
import br.edu.ifba.journal.utils.EmbeddingUtil;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite chunk storage with exact cosine search.
 *
 * <p>Candidates are selected by owner, embedding version and dimension in SQL; only those rows are
 * decoded and scored. Journals are small per user, so a full scan of one owner's chunks is
 * acceptable.</p>
 */
public class SQLiteChunkStorage implements ChunkStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteChunkStorage.class);

    private final SQLiteConnectionManager connectionManager;

    public SQLiteChunkStorage(@NotNull SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        LOG.debug("SQLiteChunkStorage initialized");
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> upsert(@NotNull List<Chunk> chunks) {
        return CompletableFuture.runAsync(() -> {
            if (chunks.isEmpty()) {
                return;
            }

            String sql = """
                INSERT INTO chunks (id, entry_id, owner_id, text, embedding, dimension, embedding_version, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    text = excluded.text,
                    embedding = excluded.embedding,
                    dimension = excluded.dimension
                WHERE chunks.owner_id = excluded.owner_id
                """;

            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (Chunk chunk : chunks) {
                    stmt.setString(1, chunk.id().toString());
                    stmt.setString(2, chunk.entryId().toString());
                    stmt.setString(3, chunk.ownerId());
                    stmt.setString(4, chunk.text());
                    stmt.setString(5, EmbeddingUtil.toBase64(chunk.embedding()));
                    stmt.setInt(6, chunk.embedding().length);
                    stmt.setString(7, chunk.embeddingVersion());
                    stmt.setString(8, chunk.createdAt().toString());
                    stmt.addBatch();
                }
                stmt.executeBatch();
                LOG.debugf("Upserted %d chunks", chunks.size());
            } catch (SQLException e) {
                throw new RuntimeException("Failed to upsert " + chunks.size() + " chunks", e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<ScoredChunk>> nearest(
            @NotNull String ownerId,
            @NotNull float[] queryVector,
            int k,
            @NotNull String embeddingVersion) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                SELECT id, entry_id, owner_id, text, embedding, embedding_version, created_at
                FROM chunks
                WHERE owner_id = ? AND embedding_version = ? AND dimension = ?
                """;

            List<ScoredChunk> scored = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, ownerId);
                stmt.setString(2, embeddingVersion);
                stmt.setInt(3, queryVector.length);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        Chunk chunk = mapRow(rs);
                        scored.add(new ScoredChunk(chunk, EmbeddingUtil.cosineSimilarity(queryVector, chunk.embedding())));
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to search chunks of owner: " + ownerId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }

            scored.sort(ScoredChunk.RANKING);
            return scored.size() > k ? List.copyOf(scored.subList(0, Math.max(0, k))) : List.copyOf(scored);
        });
    }

    @Override
    public CompletableFuture<Integer> deleteByEntry(@NotNull String ownerId, @NotNull UUID entryId) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM chunks WHERE owner_id = ? AND entry_id = ?")) {
                stmt.setString(1, ownerId);
                stmt.setString(2, entryId.toString());
                return stmt.executeUpdate();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to delete chunks of entry: " + entryId, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Integer> countByEntry(@NotNull String ownerId, @NotNull UUID entryId) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT COUNT(*) FROM chunks WHERE owner_id = ? AND entry_id = ?")) {
                stmt.setString(1, ownerId);
                stmt.setString(2, entryId.toString());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to count chunks of entry: " + entryId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public void close() {
        LOG.debug("SQLiteChunkStorage closed");
    }

    private Chunk mapRow(ResultSet rs) throws SQLException {
        return new Chunk(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("entry_id")),
            rs.getString("owner_id"),
            rs.getString("text"),
            EmbeddingUtil.fromBase64(rs.getString("embedding")),
            rs.getString("embedding_version"),
            Instant.parse(rs.getString("created_at"))
        );
    }
}

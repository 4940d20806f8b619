package br.edu.ifba.journal.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.journal.core.Entry;
import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.exception.EntryPersistenceException;
import br.edu.ifba.journal.storage.EntryStorage;

/**
 * SQLite implementation of {@link EntryStorage}. The transcript is stored as a JSON array.
 */
public class SQLiteEntryStorage implements EntryStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteEntryStorage.class);
    private static final TypeReference<List<Turn>> TRANSCRIPT_TYPE = new TypeReference<>() {};

    private final SQLiteConnectionManager connectionManager;
    private final ObjectMapper objectMapper;

    public SQLiteEntryStorage(@NotNull SQLiteConnectionManager connectionManager, @NotNull ObjectMapper objectMapper) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public void initialize() {
        LOG.debug("SQLiteEntryStorage initialized");
    }

    @Override
    public void save(@NotNull final Entry entry) {
        final String sql = """
                INSERT INTO entries (id, owner_id, summary, transcript, created_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    summary = excluded.summary,
                    transcript = excluded.transcript
                WHERE entries.owner_id = excluded.owner_id
                """;

        final Connection conn = connectionManager.getWriteConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, entry.id().toString());
            stmt.setString(2, entry.ownerId());
            stmt.setString(3, entry.summary());
            stmt.setString(4, objectMapper.writeValueAsString(entry.transcript()));
            stmt.setString(5, entry.createdAt().toString());
            stmt.executeUpdate();
            LOG.debugf("Saved entry %s for owner %s", entry.id(), entry.ownerId());
        } catch (SQLException | JsonProcessingException e) {
            throw new EntryPersistenceException("Failed to save entry: " + entry.id(), e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }

    @Override
    @NotNull
    public Optional<Entry> findById(@NotNull final String ownerId, @NotNull final UUID entryId) {
        final String sql = "SELECT id, owner_id, summary, transcript, created_at FROM entries WHERE id = ? AND owner_id = ?";

        final Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, entryId.toString());
            stmt.setString(2, ownerId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            throw new EntryPersistenceException("Failed to find entry by id: " + entryId, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
        return Optional.empty();
    }

    @Override
    @NotNull
    public List<Entry> findByOwner(@NotNull final String ownerId, final int limit) {
        final String sql = """
                SELECT id, owner_id, summary, transcript, created_at FROM entries
                WHERE owner_id = ?
                ORDER BY created_at DESC, id DESC
                LIMIT ?
                """;
        final List<Entry> entries = new ArrayList<>();

        final Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, ownerId);
            stmt.setInt(2, Math.max(0, limit));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            throw new EntryPersistenceException("Failed to list entries of owner: " + ownerId, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
        return entries;
    }

    @Override
    public boolean delete(@NotNull final String ownerId, @NotNull final UUID entryId) {
        final String sql = "DELETE FROM entries WHERE id = ? AND owner_id = ?";

        final Connection conn = connectionManager.getWriteConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, entryId.toString());
            stmt.setString(2, ownerId);
            final int rows = stmt.executeUpdate();
            if (rows > 0) {
                LOG.debugf("Deleted entry %s", entryId);
            }
            return rows > 0;
        } catch (SQLException e) {
            throw new EntryPersistenceException("Failed to delete entry: " + entryId, e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }

    @Override
    public void close() {
        LOG.debug("SQLiteEntryStorage closed");
    }

    private Entry mapRow(final ResultSet rs) throws SQLException {
        final List<Turn> transcript;
        try {
            transcript = objectMapper.readValue(rs.getString("transcript"), TRANSCRIPT_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt transcript for entry " + rs.getString("id"), e);
        }
        return new Entry(
            UUID.fromString(rs.getString("id")),
            rs.getString("owner_id"),
            rs.getString("summary"),
            transcript,
            Instant.parse(rs.getString("created_at"))
        );
    }
}

package br.edu.ifba.journal.storage.impl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the SQL migrations under {@code /db/migrations/} in version order.
 *
 * <p>Applied versions are recorded in {@code schema_version}; running the migrator again only
 * applies what is missing.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this.migrations = List.of(
            new Migration(1, "Journal entries, chunks and knowledge graph", MIGRATION_PATH + "V001__journal_schema.sql")
        );
    }

    /**
     * @return current schema version, 0 if the database is empty
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                int version = rs.getInt(1);
                if (!rs.wasNull()) {
                    return version;
                }
            }
        }
        return 0;
    }

    /**
     * Applies all pending migrations in one transaction.
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);

            try (Statement stmt = conn.createStatement()) {
                stmt.execute("""
                    CREATE TABLE IF NOT EXISTS schema_version (
                        version INTEGER PRIMARY KEY,
                        description TEXT NOT NULL,
                        applied_at TEXT NOT NULL DEFAULT (datetime('now'))
                    )""");
            }

            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%d: %s", migration.version(), migration.description());
                    executeStatements(conn, migration.load());
                    recordVersion(conn, migration);
                }
            }

            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    public int getLatestVersion() {
        return migrations.get(migrations.size() - 1).version();
    }

    private void recordVersion(Connection conn, Migration migration) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
            stmt.setInt(1, migration.version());
            stmt.setString(2, migration.description());
            stmt.executeUpdate();
        }
    }

    private void executeStatements(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String statement : splitStatements(sql)) {
                LOG.tracef("Executing: %s", statement.substring(0, Math.min(50, statement.length())));
                stmt.execute(statement);
            }
        }
    }

    /**
     * Splits a script on semicolons after dropping {@code --} comment lines. The journal
     * migrations keep string literals free of semicolons.
     */
    static List<String> splitStatements(String sql) {
        String cleaned = sql.lines()
            .filter(line -> !line.trim().startsWith("--"))
            .collect(Collectors.joining("\n"));

        List<String> statements = new ArrayList<>();
        for (String part : cleaned.split(";")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return statements;
    }

    private record Migration(int version, String description, String resourcePath) {

        String load() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }

            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }
    }
}

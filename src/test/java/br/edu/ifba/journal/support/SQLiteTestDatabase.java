package br.edu.ifba.journal.support;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

import br.edu.ifba.journal.storage.impl.SQLiteConnectionManager;
import br.edu.ifba.journal.storage.impl.SQLiteSchemaMigrator;

/**
 * Opens a migrated SQLite database in a temporary directory.
 */
public final class SQLiteTestDatabase {

    private SQLiteTestDatabase() {
    }

    public static SQLiteConnectionManager open(Path directory) throws SQLException {
        SQLiteConnectionManager manager = new SQLiteConnectionManager(directory.resolve("journal.db").toString());
        Connection conn = manager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } finally {
            manager.releaseWriteConnection(conn);
        }
        return manager;
    }
}

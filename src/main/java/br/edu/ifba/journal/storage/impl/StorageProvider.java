package br.edu.ifba.journal.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.journal.JournalConfig;
import br.edu.ifba.journal.storage.ChunkStorage;
import br.edu.ifba.journal.storage.EntryStorage;
import br.edu.ifba.journal.storage.GraphStorage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer that selects the storage implementations from {@code journal.storage.backend}
 * at runtime.
 *
 * <p>For the {@code sqlite} back end it opens the connection manager and runs schema migrations
 * before any storage is produced. The {@code memory} back end keeps everything in process and is
 * lost on restart.</p>
 */
@ApplicationScoped
public class StorageProvider {

    private static final Logger LOG = Logger.getLogger(StorageProvider.class);

    @Inject
    JournalConfig config;

    @Inject
    ObjectMapper objectMapper;

    private SQLiteConnectionManager connectionManager;

    @PostConstruct
    void initialize() {
        String backend = config.storage().backend();
        LOG.infof("Selecting journal storage for backend: %s", backend);

        if (isSqlite()) {
            JournalConfig.Storage.Sqlite sqlite = config.storage().sqlite();
            connectionManager = new SQLiteConnectionManager(
                sqlite.path(),
                Duration.ofMillis(sqlite.busyTimeoutMs()),
                sqlite.walMode(),
                sqlite.readPoolSize()
            );

            Connection conn = connectionManager.getWriteConnection();
            try {
                new SQLiteSchemaMigrator().migrateToLatest(conn);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to run SQLite schema migrations", e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
            LOG.infof("SQLite storage ready at %s", sqlite.path());
        }
    }

    @PreDestroy
    void shutdown() {
        if (connectionManager != null) {
            LOG.info("Closing SQLite connection manager");
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    public ChunkStorage produceChunkStorage() {
        ChunkStorage storage = isSqlite()
            ? new SQLiteChunkStorage(connectionManager)
            : new InMemoryChunkStorage();
        storage.initialize().join();
        LOG.infof("Created %s", storage.getClass().getSimpleName());
        return storage;
    }

    @Produces
    @ApplicationScoped
    public EntryStorage produceEntryStorage() {
        EntryStorage storage = isSqlite()
            ? new SQLiteEntryStorage(connectionManager, objectMapper)
            : new InMemoryEntryStorage();
        storage.initialize();
        LOG.infof("Created %s", storage.getClass().getSimpleName());
        return storage;
    }

    @Produces
    @ApplicationScoped
    public GraphStorage produceGraphStorage() {
        GraphStorage storage = isSqlite()
            ? new SQLiteGraphStorage(connectionManager)
            : new InMemoryGraphStorage();
        storage.initialize().join();
        LOG.infof("Created %s", storage.getClass().getSimpleName());
        return storage;
    }

    private boolean isSqlite() {
        return "sqlite".equalsIgnoreCase(config.storage().backend());
    }
}

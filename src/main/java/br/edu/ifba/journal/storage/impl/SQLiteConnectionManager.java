package br.edu.ifba.journal.storage.impl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

/**
 * Manages SQLite connections for the journal store.
 *
 * <p>WAL mode lets readers proceed while a write is in flight. Reads draw from a small pool;
 * all writes go through one connection guarded by a {@link ReentrantLock}, which serialises
 * entry saves, chunk upserts and graph merges.</p>
 *
 * <pre>
 * SQLiteConnectionManager manager = new SQLiteConnectionManager("data/journal.db");
 * Connection conn = manager.getWriteConnection();
 * try {
 *     // write
 * } finally {
 *     manager.releaseWriteConnection(conn);
 * }
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int DEFAULT_CACHE_SIZE = -2000; // 2MB

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock;

    private Connection writeConnection;
    private volatile boolean closed = false;

    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, true, DEFAULT_POOL_SIZE);
    }

    /**
     * @param databasePath path to the database file
     * @param busyTimeout how long to wait for locks
     * @param walMode whether to enable WAL mode
     * @param readPoolSize number of pooled read connections
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode, int readPoolSize) {
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(Math.max(1, readPoolSize));
        this.writeLock = new ReentrantLock();
    }

    /**
     * Opens a new configured connection.
     *
     * @throws IllegalStateException if the manager is closed
     */
    public Connection createConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        if (!databasePath.startsWith(":memory:")) {
            try {
                Path parentDir = Paths.get(databasePath).toAbsolutePath().getParent();
                if (parentDir != null && !Files.exists(parentDir)) {
                    Files.createDirectories(parentDir);
                    LOG.infof("Created database directory: %s", parentDir);
                }
            } catch (Exception e) {
                LOG.warnf("Could not create parent directory for %s: %s", databasePath, e.getMessage());
            }
        }

        try {
            SQLiteConfig config = new SQLiteConfig();
            config.enforceForeignKeys(true);
            config.setBusyTimeout((int) busyTimeout.toMillis());
            config.setCacheSize(DEFAULT_CACHE_SIZE);

            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            applyPragmas(conn);

            LOG.debugf("Created SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create SQLite connection to " + databasePath, e);
        }
    }

    /**
     * Takes a read connection from the pool, opening one if the pool is empty.
     * Return it with {@link #releaseReadConnection(Connection)}.
     */
    public Connection getReadConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Read connection was closed, creating new one", e);
            }
        }
        return createConnection();
    }

    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }

        try {
            if (!conn.isClosed() && !closed) {
                if (!readPool.offer(conn)) {
                    conn.close();
                }
            } else {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Locks and returns the single write connection. Always pair with
     * {@link #releaseWriteConnection(Connection)} in a finally block.
     */
    public Connection getWriteConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new RuntimeException("Failed to get write connection", e);
        }
    }

    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    private void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public boolean isWalModeEnabled() {
        return walMode;
    }

    @Override
    public void close() {
        closed = true;

        if (writeConnection != null) {
            try {
                writeConnection.close();
            } catch (SQLException e) {
                LOG.debug("Error closing write connection", e);
            }
            writeConnection = null;
        }

        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }

        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }
}

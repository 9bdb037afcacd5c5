package io.itemapi.server.core.storage;

import io.itemapi.server.spi.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single JDBC connection to the embedded SQLite store.
 *
 * <p>Every statement, read or write, runs while holding one exclusive lock, so all access to the
 * store is totally ordered. Query results are materialized before the lock is released. SQLite
 * allows a single writer, which makes this lock the one serialization point of the service.
 *
 * <p>Instances are created with {@link #open(Path)} and shared by all request threads.
 */
public final class StorageHandle implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(StorageHandle.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final String url;
    private final Connection connection;
    private boolean closed; // guarded by lock

    private StorageHandle(String url, Connection connection) {
        this.url = url;
        this.connection = connection;
    }

    /**
     * Opens the database file and verifies the connection is usable.
     *
     * @throws StorageException if the store cannot be opened or reached
     */
    public static StorageHandle open(Path databaseFile) {
        Objects.requireNonNull(databaseFile, "databaseFile");
        return open("jdbc:sqlite:" + databaseFile);
    }

    /**
     * Opens the given JDBC URL and verifies the connection is usable.
     *
     * @throws StorageException if the store cannot be opened or reached
     */
    public static StorageHandle open(String jdbcUrl) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        Connection connection;
        try {
            connection = DriverManager.getConnection(jdbcUrl);
        } catch (SQLException e) {
            throw new StorageException("Failed to open database: " + jdbcUrl, e);
        }

        StorageHandle handle = new StorageHandle(jdbcUrl, connection);
        try {
            handle.ping();
        } catch (StorageException e) {
            handle.close();
            throw e;
        }
        LOG.info("Connected to SQLite database: {}", jdbcUrl);
        return handle;
    }

    public String url() {
        return url;
    }

    /**
     * Round-trips a trivial query.
     *
     * @throws StorageException if the store cannot be reached
     */
    public void ping() {
        try {
            query("SELECT 1", row -> row.getInt(1));
        } catch (StorageException e) {
            throw new StorageException("Failed to connect to database: " + url, e.getCause());
        }
    }

    /**
     * Runs a data-changing statement.
     *
     * @param sql statement with {@code ?} placeholders
     * @param params values bound to the placeholders in order; null binds SQL NULL
     */
    public ExecResult execute(String sql, Object... params) {
        Objects.requireNonNull(sql, "sql");
        lock.lock();
        try {
            ensureOpen();
            long rows;
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                bind(ps, params);
                rows = ps.executeUpdate();
            }
            return new ExecResult(rows, lastInsertRowId());
        } catch (SQLException e) {
            throw new StorageException("Statement failed: " + sql, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a query and maps every row.
     *
     * @return the mapped rows, empty if none
     */
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(mapper, "mapper");
        lock.lock();
        try {
            ensureOpen();
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    List<T> out = new ArrayList<>();
                    while (rs.next()) {
                        out.add(mapper.map(rs));
                    }
                    return out;
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Query failed: " + sql, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the connection. Waits for an in-flight statement; later calls fail with
     * {@link StorageException}. Calling it again has no effect.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            connection.close();
            LOG.info("Closed SQLite database: {}", url);
        } catch (SQLException e) {
            LOG.warn("Error closing database {}", url, e);
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) throw new StorageException("Storage handle is closed: " + url);
    }

    private long lastInsertRowId() throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private static void bind(PreparedStatement ps, Object[] params) throws SQLException {
        if (params == null) return;
        for (int i = 0; i < params.length; i++) {
            Object v = params[i];
            if (v == null) {
                ps.setNull(i + 1, Types.NULL);
            } else {
                ps.setObject(i + 1, v);
            }
        }
    }
}

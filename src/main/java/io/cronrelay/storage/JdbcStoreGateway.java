package io.cronrelay.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JDBC-backed gateway. Transient connectivity failures are retried a bounded number of times
 * with a fixed delay; everything else surfaces immediately as {@link StoreException}.
 */
public final class JdbcStoreGateway implements StoreGateway {
    private static final Logger log = LoggerFactory.getLogger(JdbcStoreGateway.class);

    private static final List<String> TRANSIENT_HINTS = List.of(
            "connection timeout",
            "timeout expired",
            "connection reset",
            "network-related",
            "connection was closed",
            "connection is closed",
            "database is locked",
            "database table is locked",
            "sqlite_busy"
    );
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final ConnectionSource connections;
    private final int maxRetries;
    private final long retryDelayMs;

    public JdbcStoreGateway(ConnectionSource connections, int maxRetries, long retryDelayMs) {
        this.connections = connections;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryDelayMs = Math.max(0L, retryDelayMs);
    }

    public static JdbcStoreGateway forDatabase(Database database) {
        return new JdbcStoreGateway(
                database::openConnection,
                database.config().settings().storeMaxRetries(),
                database.config().settings().storeRetryDelayMs()
        );
    }

    @Override
    public List<Map<String, Object>> query(String sql, List<?> params) {
        return withRetry("query", () -> {
            try (Connection c = connections.open(); PreparedStatement ps = c.prepareStatement(sql)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    return readRows(rs);
                }
            }
        });
    }

    @Override
    public int execute(String sql, List<?> params) {
        return withRetry("execute", () -> {
            try (Connection c = connections.open(); PreparedStatement ps = c.prepareStatement(sql)) {
                bind(ps, params);
                return ps.executeUpdate();
            }
        });
    }

    private <T> T withRetry(String op, SqlCall<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.run();
            } catch (SQLException e) {
                if (!isTransient(e)) {
                    throw new StoreException("Store " + op + " failed: " + e.getMessage(), e);
                }
                if (attempt > maxRetries) {
                    throw new StoreTransientException(
                            "Store " + op + " failed after " + attempt + " attempts: " + e.getMessage(), attempt, e);
                }
                log.warn("Transient store failure on {} (attempt {}/{}), retrying in {} ms: {}",
                        op, attempt, maxRetries + 1, retryDelayMs, e.getMessage());
                sleep(retryDelayMs);
            }
        }
    }

    static boolean isTransient(SQLException e) {
        if (e instanceof SQLTransientException) {
            return true;
        }
        if (e.getErrorCode() == SQLITE_BUSY || e.getErrorCode() == SQLITE_LOCKED) {
            return true;
        }
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String hint : TRANSIENT_HINTS) {
            if (lower.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static void bind(PreparedStatement ps, List<?> params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private static void sleep(long ms) {
        if (ms <= 0L) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while waiting to retry store call", e);
        }
    }

    @FunctionalInterface
    public interface ConnectionSource {
        Connection open() throws SQLException;
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T run() throws SQLException;
    }
}

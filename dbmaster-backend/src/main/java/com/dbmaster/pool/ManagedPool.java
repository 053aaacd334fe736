package com.dbmaster.pool;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * A cached Hikari pool for one {@code host:port:database:user} key. Callers wait up to the acquire
 * timeout for a free connection unless the configured queue limit is already reached.
 */
@Slf4j
public class ManagedPool implements AutoCloseable {
    private static final int HEALTH_CHECK_TIMEOUT_SEC = 5;

    private final String key;
    private final HikariDataSource dataSource;
    private final PoolOptions options;

    ManagedPool(String key, HikariDataSource dataSource, PoolOptions options) {
        this.key = key;
        this.dataSource = dataSource;
        this.options = options;
    }

    public String getKey() {
        return key;
    }

    public PoolOptions getOptions() {
        return options;
    }

    Connection acquire() throws SQLException {
        int queueLimit = options.getQueueLimit();
        if (queueLimit > 0) {
            HikariPoolMXBean mx = dataSource.getHikariPoolMXBean();
            if (mx != null && mx.getIdleConnections() == 0 && mx.getThreadsAwaitingConnection() >= queueLimit) {
                throw new ConnectivityException("Connection queue limit reached for pool " + dataSource.getPoolName());
            }
        }
        return dataSource.getConnection();
    }

    /**
     * Runs {@code SELECT 1} through the pool.
     *
     * @return false if the pool is closed or the query failed
     */
    boolean healthCheck() {
        if (dataSource.isClosed()) {
            return false;
        }
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            st.setQueryTimeout(HEALTH_CHECK_TIMEOUT_SEC);
            st.execute("SELECT 1");
            return true;
        } catch (SQLException e) {
            log.warn("Pool health check failed: pool={}, sql_state={}, error={}", dataSource.getPoolName(), e.getSQLState(), e.getMessage());
            return false;
        }
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    public int activeConnections() {
        HikariPoolMXBean mx = dataSource.getHikariPoolMXBean();
        return mx != null ? mx.getActiveConnections() : 0;
    }

    public int idleConnections() {
        HikariPoolMXBean mx = dataSource.getHikariPoolMXBean();
        return mx != null ? mx.getIdleConnections() : 0;
    }

    public int maximumPoolSize() {
        return dataSource.getMaximumPoolSize();
    }

    /**
     * Closes the pool. Idempotent; close errors are logged only.
     */
    @Override
    public void close() {
        if (dataSource.isClosed()) {
            return;
        }
        try {
            dataSource.close();
            log.info("Closed connection pool: pool={}", dataSource.getPoolName());
        } catch (RuntimeException e) {
            log.error("Error closing connection pool: pool={}", dataSource.getPoolName(), e);
        }
    }
}

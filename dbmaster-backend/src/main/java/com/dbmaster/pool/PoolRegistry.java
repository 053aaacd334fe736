package com.dbmaster.pool;

import com.dbmaster.crypto.CredentialVault;
import com.dbmaster.crypto.EncryptionException;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.util.JdbcJsonSafe;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of connection pools keyed by {@code host:port:database:user}.
 *
 * <p>A cached pool is health-checked on every {@link #getPool} call and rebuilt when the check
 * fails. Every query helper releases its connection on all exit paths. Passwords are decrypted
 * only while a pool or a raw connection is being configured.
 */
@Slf4j
@Component
public class PoolRegistry implements AutoCloseable {

    private static final long KEEPALIVE_MS = 30_000L;

    private final Map<String, ManagedPool> pools = new ConcurrentHashMap<>();

    private final CredentialVault vault;
    private final DataSourceFactory dataSourceFactory;
    private final PoolOptions defaultOptions;
    private final Retrier connectRetrier;

    @Autowired
    public PoolRegistry(CredentialVault vault, DataSourceFactory dataSourceFactory, Environment environment) {
        this(vault, dataSourceFactory, PoolOptions.fromEnvironment(environment), Retrier.fromEnvironment(environment));
    }

    public PoolRegistry(CredentialVault vault, DataSourceFactory dataSourceFactory, PoolOptions defaultOptions, Retrier connectRetrier) {
        this.vault = vault;
        this.dataSourceFactory = dataSourceFactory;
        this.defaultOptions = defaultOptions != null ? defaultOptions.normalized() : PoolOptions.defaults();
        this.connectRetrier = connectRetrier != null ? connectRetrier : Retrier.defaults();
    }

    public PoolOptions getDefaultOptions() {
        return defaultOptions;
    }

    public ManagedPool getPool(ConnectionConfig config) {
        return getPool(config, null);
    }

    /**
     * Returns the cached pool for the connection, building one if none exists or the cached one
     * fails its health check. Options only apply when a pool is built.
     *
     * @param config stored connection settings
     * @param options pool options, null for the registry defaults
     * @return a usable pool
     */
    public ManagedPool getPool(ConnectionConfig config, PoolOptions options) {
        String key = config.poolKey();
        ManagedPool existing = pools.get(key);
        if (existing != null) {
            if (existing.healthCheck()) {
                return existing;
            }
            log.warn("Existing pool failed health check, creating new pool: pool_key={}", maskKey(key));
            pools.remove(key, existing);
            existing.close();
        }

        PoolOptions resolved = (options != null ? options : defaultOptions).normalized();
        return pools.computeIfAbsent(key, k -> buildPool(k, config, resolved));
    }

    public Optional<ManagedPool> findPool(ConnectionConfig config) {
        return Optional.ofNullable(pools.get(config.poolKey()));
    }

    public int poolCount() {
        return pools.size();
    }

    private ManagedPool buildPool(String key, ConnectionConfig config, PoolOptions options) {
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("dbmaster-" + config.getHost() + ":" + config.resolvedPort() + "/" + config.getDatabase());
        hc.setJdbcUrl(dataSourceFactory.jdbcUrl(config));
        hc.setUsername(config.getUser());
        hc.setPassword(decryptPassword(config));
        hc.setDataSourceProperties(dataSourceFactory.driverProperties(config, options));
        hc.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        hc.setMaximumPoolSize(options.getConnectionLimit());
        hc.setMinimumIdle(0);
        hc.setConnectionTimeout(options.getAcquireTimeoutMs());
        hc.setKeepaliveTime(KEEPALIVE_MS);
        // Connections are opened on first use, not while the registry holds the map entry.
        hc.setInitializationFailTimeout(-1);

        String initSql = dataSourceFactory.sessionInitSql(options);
        if (initSql != null && !initSql.isBlank()) {
            hc.setConnectionInitSql(initSql);
        }

        ManagedPool pool = new ManagedPool(key, new HikariDataSource(hc), options);
        log.info("Created new connection pool: pool_key={}, connection_limit={}", maskKey(key), options.getConnectionLimit());
        return pool;
    }

    /**
     * Opens a single-use connection with strict session settings, retrying transient connect
     * failures with backoff. The caller closes it with {@link #closeConnection(Connection)}.
     */
    public Connection createConnection(ConnectionConfig config) {
        return createConnection(config, defaultOptions);
    }

    public Connection createConnection(ConnectionConfig config, PoolOptions options) {
        PoolOptions resolved = (options != null ? options : defaultOptions).normalized();
        String url = dataSourceFactory.jdbcUrl(config);
        Properties props = dataSourceFactory.driverProperties(config, resolved);
        props.setProperty("user", config.getUser() != null ? config.getUser() : "");
        props.setProperty("password", decryptPassword(config));

        Connection conn;
        try {
            conn = connectRetrier.call(() -> DriverManager.getConnection(url, props), PoolRegistry::isTransientConnectFailure);
        } catch (SQLException e) {
            throw translateConnectFailure(config, e);
        }

        String initSql = dataSourceFactory.sessionInitSql(resolved);
        if (initSql != null && !initSql.isBlank()) {
            try (Statement st = conn.createStatement()) {
                st.execute(initSql);
            } catch (SQLException e) {
                closeConnection(conn);
                throw new ConnectivityException("Failed to initialise database session: " + e.getMessage(), e);
            }
        }
        return conn;
    }

    /**
     * Closes a single-use connection. Idempotent; close errors are logged only.
     */
    public void closeConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (!conn.isClosed()) {
                conn.close();
            }
        } catch (SQLException e) {
            log.error("Error closing database connection: sql_state={}, error={}", e.getSQLState(), e.getMessage());
        }
    }

    /**
     * Runs one statement on a pooled connection and releases the connection on every path.
     *
     * @throws ConnectivityException if no connection could be acquired
     * @throws QueryExecutionException if the statement failed
     */
    public QueryResult executeQuery(ManagedPool pool, String sql, List<?> params, int timeoutMs) {
        Connection conn = acquire(pool);
        try {
            return run(conn, sql, params, timeoutMs);
        } catch (SQLException e) {
            throw new QueryExecutionException(e.getMessage(), e);
        } finally {
            release(pool, conn);
        }
    }

    /**
     * Runs the statements in order inside one transaction, one result per statement. Any failure
     * rolls back before the error propagates; a failed rollback is logged and attached as suppressed.
     */
    public List<QueryResult> executeQueryInTransaction(ManagedPool pool, List<SqlStatement> statements, int timeoutMs) {
        Connection conn = acquire(pool);
        boolean previousAutoCommit = true;
        try {
            previousAutoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            List<QueryResult> results = new ArrayList<>(statements.size());
            for (SqlStatement statement : statements) {
                results.add(run(conn, statement.sql(), statement.params(), timeoutMs));
            }
            conn.commit();
            return results;
        } catch (SQLException e) {
            rollback(pool, conn, e);
            throw new QueryExecutionException(e.getMessage(), e);
        } catch (RuntimeException e) {
            rollback(pool, conn, e);
            throw e;
        } finally {
            try {
                conn.setAutoCommit(previousAutoCommit);
            } catch (SQLException e) {
                log.warn("Failed to restore auto-commit: pool={}, error={}", maskKey(pool.getKey()), e.getMessage());
            }
            release(pool, conn);
        }
    }

    private QueryResult run(Connection conn, String sql, List<?> params, int timeoutMs) throws SQLException {
        long start = System.nanoTime();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (timeoutMs > 0) {
                ps.setQueryTimeout((int) Math.max(1, (timeoutMs + 999L) / 1000L));
            }
            if (params != null) {
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
            }

            boolean hasResultSet = ps.execute();
            if (hasResultSet) {
                try (ResultSet rs = ps.getResultSet()) {
                    List<String> columns = JdbcJsonSafe.columnLabels(rs.getMetaData());
                    List<Map<String, Object>> rows = JdbcJsonSafe.readRows(rs);
                    return new QueryResult(columns, rows, rows.size(), elapsedMs(start));
                }
            }
            int updateCount = ps.getUpdateCount();
            return new QueryResult(List.of(), List.of(), Math.max(updateCount, 0), elapsedMs(start));
        }
    }

    private Connection acquire(ManagedPool pool) {
        try {
            return pool.acquire();
        } catch (SQLTransientConnectionException | SQLTimeoutException e) {
            throw new ConnectivityException("Timed out acquiring a database connection: " + e.getMessage(), e);
        } catch (SQLException e) {
            if (isAuthFailure(e)) {
                throw new CredentialException("Database rejected the stored credentials: " + e.getMessage(), e);
            }
            throw new ConnectivityException("Failed to acquire a database connection: " + e.getMessage(), e);
        }
    }

    private void release(ManagedPool pool, Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Error releasing pooled connection: pool={}, error={}", maskKey(pool.getKey()), e.getMessage());
        }
    }

    private void rollback(ManagedPool pool, Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            log.error("Rollback failed: pool={}, error={}", maskKey(pool.getKey()), rollbackError.getMessage());
            cause.addSuppressed(rollbackError);
        }
    }

    private String decryptPassword(ConnectionConfig config) {
        if (config.getEncryptedPassword() == null || config.getEncryptedPassword().isEmpty()) {
            throw new CredentialException("Connection " + config.getId() + " has no stored password");
        }
        try {
            return vault.decrypt(config.getEncryptedPassword());
        } catch (EncryptionException e) {
            throw new CredentialException("Failed to decrypt credentials for connection " + config.getId(), e);
        }
    }

    private RuntimeException translateConnectFailure(ConnectionConfig config, SQLException e) {
        if (isAuthFailure(e)) {
            return new CredentialException("Database rejected the stored credentials: " + e.getMessage(), e);
        }
        log.error("Failed to connect: host={}, port={}, database={}, sql_state={}, error_code={}",
                config.getHost(), config.resolvedPort(), config.getDatabase(), e.getSQLState(), e.getErrorCode());
        return new ConnectivityException("Failed to connect to database: " + e.getMessage(), e);
    }

    static boolean isTransientConnectFailure(SQLException e) {
        if (isAuthFailure(e)) {
            return false;
        }
        if (e instanceof SQLTransientConnectionException || e instanceof SQLTimeoutException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    static boolean isAuthFailure(SQLException e) {
        String state = e.getSQLState();
        // 1045: access denied for user
        return (state != null && state.startsWith("28")) || e.getErrorCode() == 1045;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static String maskKey(String key) {
        int lastColon = key.lastIndexOf(':');
        return lastColon > 0 ? key.substring(0, lastColon) + ":****" : key;
    }

    /**
     * Closes and forgets every pool. Idempotent; also runs when the application context shuts down.
     */
    public void closeAllPools() {
        for (String key : new ArrayList<>(pools.keySet())) {
            ManagedPool pool = pools.remove(key);
            if (pool != null) {
                pool.close();
            }
        }
    }

    @Override
    public void close() {
        closeAllPools();
    }
}

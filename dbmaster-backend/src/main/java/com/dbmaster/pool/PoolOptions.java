package com.dbmaster.pool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.core.env.Environment;

/**
 * Pool and session settings. Out-of-range connection limits are clamped, never rejected.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PoolOptions {
    public static final int DEFAULT_CONNECTION_LIMIT = 5;
    public static final int MAX_CONNECTION_LIMIT = 20;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_ACQUIRE_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_QUERY_TIMEOUT_MS = 60_000;

    @Builder.Default
    private int connectionLimit = DEFAULT_CONNECTION_LIMIT;

    @Builder.Default
    private int connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;

    @Builder.Default
    private int acquireTimeoutMs = DEFAULT_ACQUIRE_TIMEOUT_MS;

    /** Maximum number of callers waiting for a connection; 0 means unbounded. */
    @Builder.Default
    private int queueLimit = 0;

    @Builder.Default
    private int queryTimeoutMs = DEFAULT_QUERY_TIMEOUT_MS;

    public static PoolOptions defaults() {
        return PoolOptions.builder().build();
    }

    public PoolOptions normalized() {
        int limit = connectionLimit > 0 ? connectionLimit : DEFAULT_CONNECTION_LIMIT;
        return toBuilder()
                .connectionLimit(Math.min(Math.max(limit, 1), MAX_CONNECTION_LIMIT))
                .connectTimeoutMs(connectTimeoutMs > 0 ? connectTimeoutMs : DEFAULT_CONNECT_TIMEOUT_MS)
                .acquireTimeoutMs(acquireTimeoutMs > 0 ? acquireTimeoutMs : DEFAULT_ACQUIRE_TIMEOUT_MS)
                .queueLimit(Math.max(queueLimit, 0))
                .queryTimeoutMs(queryTimeoutMs > 0 ? queryTimeoutMs : DEFAULT_QUERY_TIMEOUT_MS)
                .build();
    }

    static PoolOptions fromEnvironment(Environment environment) {
        return PoolOptions.builder()
                .connectionLimit(environment.getProperty("dbmaster.pool.connection-limit", Integer.class, DEFAULT_CONNECTION_LIMIT))
                .connectTimeoutMs(environment.getProperty("dbmaster.pool.connect-timeout-ms", Integer.class, DEFAULT_CONNECT_TIMEOUT_MS))
                .acquireTimeoutMs(environment.getProperty("dbmaster.pool.acquire-timeout-ms", Integer.class, DEFAULT_ACQUIRE_TIMEOUT_MS))
                .queueLimit(environment.getProperty("dbmaster.pool.queue-limit", Integer.class, 0))
                .queryTimeoutMs(environment.getProperty("dbmaster.pool.query-timeout-ms", Integer.class, DEFAULT_QUERY_TIMEOUT_MS))
                .build()
                .normalized();
    }
}

package com.dbmaster.pool;

import com.dbmaster.model.ConnectionConfig;

import java.util.Properties;

/**
 * Supplies the driver-specific parts of a connection: URL, driver properties and the statement
 * run on every new session.
 */
public interface DataSourceFactory {

    String jdbcUrl(ConnectionConfig config);

    /**
     * Driver properties, excluding user and password.
     */
    Properties driverProperties(ConnectionConfig config, PoolOptions options);

    /**
     * Statement executed right after a physical connection is opened, or null for none.
     */
    String sessionInitSql(PoolOptions options);
}

package com.dbmaster.pool;

import com.dbmaster.model.ConnectionConfig;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Properties;

/**
 * MariaDB Connector/J settings: strict {@code sql_mode}, a per-session statement time limit and
 * single-statement execution.
 */
@Component
public class MariaDbDataSourceFactory implements DataSourceFactory {

    static final String STRICT_SQL_MODE =
            "STRICT_TRANS_TABLES,NO_ZERO_IN_DATE,NO_ZERO_DATE,ERROR_FOR_DIVISION_BY_ZERO,NO_ENGINE_SUBSTITUTION";

    @Override
    public String jdbcUrl(ConnectionConfig config) {
        String database = config.getDatabase() != null ? config.getDatabase() : "";
        return "jdbc:mariadb://" + config.getHost() + ":" + config.resolvedPort() + "/" + database;
    }

    @Override
    public Properties driverProperties(ConnectionConfig config, PoolOptions options) {
        Properties props = new Properties();
        props.setProperty("connectTimeout", String.valueOf(options.getConnectTimeoutMs()));
        props.setProperty("tcpKeepAlive", "true");
        props.setProperty("allowMultiQueries", "false");
        if (config.isSsl()) {
            // Self-signed server certificates are accepted.
            props.setProperty("sslMode", "trust");
        }
        return props;
    }

    @Override
    public String sessionInitSql(PoolOptions options) {
        double statementSeconds = options.getQueryTimeoutMs() / 1000.0d;
        return "SET SESSION sql_mode = '" + STRICT_SQL_MODE + "', max_statement_time = "
                + String.format(Locale.ROOT, "%.3f", statementSeconds);
    }
}

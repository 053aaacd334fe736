package com.dbmaster.service;

import com.dbmaster.api.ExecuteRequest;
import com.dbmaster.crypto.CredentialVault;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.model.ExecutionStatus;
import com.dbmaster.model.QueryLogEntry;
import com.dbmaster.pool.H2DataSourceFactory;
import com.dbmaster.pool.PoolRegistry;
import com.dbmaster.pool.QueryExecutionException;
import com.dbmaster.pool.QueryResult;
import com.dbmaster.repository.InMemoryConnectionRepository;
import com.dbmaster.repository.InMemoryQueryLogRepository;
import com.dbmaster.repository.InMemorySchemaSnapshotRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryServiceTest {

    private static final String OWNER = "u1";
    private static final Instant NOW = Instant.parse("2024-01-15T09:00:00Z");

    private static CredentialVault vault;

    private PoolRegistry poolRegistry;
    private InMemoryQueryLogRepository queryLog;
    private QueryService service;
    private ConnectionConfig connection;

    @BeforeAll
    static void initVault() {
        vault = new CredentialVault("query-test-secret", "query-test-salt");
    }

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        InMemoryConnectionRepository connections = new InMemoryConnectionRepository();
        poolRegistry = H2DataSourceFactory.registry(vault);
        queryLog = new InMemoryQueryLogRepository();
        ConnectionService connectionService = new ConnectionService(connections, new InMemorySchemaSnapshotRepository(),
                vault, poolRegistry, clock);
        service = new QueryService(connectionService, poolRegistry, queryLog, clock);

        connection = connections.save(H2DataSourceFactory.connection(vault, "c1",
                "query_" + UUID.randomUUID().toString().replace("-", ""), OWNER));
        poolRegistry.executeQuery(poolRegistry.getPool(connection),
                "CREATE TABLE metrics (metric VARCHAR(20), amount INT)", List.of(), 0);
        poolRegistry.executeQuery(poolRegistry.getPool(connection),
                "INSERT INTO metrics VALUES ('threads', 12), ('uptime', 3600)", List.of(), 0);
    }

    @AfterEach
    void tearDown() {
        poolRegistry.close();
    }

    private static ExecuteRequest execute(String sql, Object... params) {
        ExecuteRequest request = new ExecuteRequest();
        request.setSql(sql);
        request.setParams(new ArrayList<>(List.of(params)));
        return request;
    }

    @Test
    void executesAndLogsSuccess() {
        QueryResult result = service.execute(OWNER, "c1", execute("SELECT amount FROM metrics WHERE metric = ?", "threads"));

        assertThat(result.rows()).hasSize(1);
        assertThat(result.rows().get(0)).containsEntry("AMOUNT", 12);

        List<QueryLogEntry> history = service.history(OWNER, 0);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(history.get(0).getRowCount()).isEqualTo(1);
        assertThat(history.get(0).getExecutedAt()).isEqualTo(NOW);
    }

    @Test
    void failureIsLoggedAndRethrown() {
        assertThatThrownBy(() -> service.execute(OWNER, "c1", execute("SELECT nope FROM metrics")))
                .isInstanceOf(QueryExecutionException.class);

        QueryLogEntry entry = service.history(OWNER, 10).get(0);
        assertThat(entry.getStatus()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(entry.getError()).isNotBlank();
        assertThat(entry.getRowCount()).isNull();
    }

    @Test
    void foreignConnectionIsDeniedBeforeRunning() {
        assertThatThrownBy(() -> service.execute("intruder", "c1", execute("SELECT 1")))
                .isInstanceOf(AccessDeniedException.class);
        assertThat(service.history("intruder", 10)).isEmpty();
    }
}

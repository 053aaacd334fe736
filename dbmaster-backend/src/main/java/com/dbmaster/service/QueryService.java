package com.dbmaster.service;

import com.dbmaster.api.ExecuteRequest;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.model.ExecutionStatus;
import com.dbmaster.model.QueryLogEntry;
import com.dbmaster.pool.ManagedPool;
import com.dbmaster.pool.PoolRegistry;
import com.dbmaster.pool.QueryResult;
import com.dbmaster.repository.QueryLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Ad-hoc statements against an owned connection. Every run, successful or not, is appended to the
 * query log.
 */
@Slf4j
@Service
public class QueryService {

    private final ConnectionService connectionService;
    private final PoolRegistry poolRegistry;
    private final QueryLogRepository queryLogRepository;
    private final Clock clock;

    public QueryService(ConnectionService connectionService, PoolRegistry poolRegistry, QueryLogRepository queryLogRepository, Clock clock) {
        this.connectionService = connectionService;
        this.poolRegistry = poolRegistry;
        this.queryLogRepository = queryLogRepository;
        this.clock = clock;
    }

    public QueryResult execute(String ownerId, String connectionId, ExecuteRequest request) {
        ConnectionConfig config = connectionService.resolveForOwner(ownerId, connectionId);
        long start = System.nanoTime();
        try {
            ManagedPool pool = poolRegistry.getPool(config);
            int timeoutMs = request.getTimeoutMs() != null && request.getTimeoutMs() > 0
                    ? request.getTimeoutMs()
                    : pool.getOptions().getQueryTimeoutMs();
            QueryResult result = poolRegistry.executeQuery(pool, request.getSql(), request.getParams(), timeoutMs);
            connectionService.markUsed(connectionId);
            appendLog(ownerId, connectionId, request.getSql(), ExecutionStatus.SUCCESS, result.rows().size(), result.elapsedMs(), null);
            log.info("Query executed: connection_id={}, rows={}, elapsed_ms={}", connectionId, result.rows().size(), result.elapsedMs());
            return result;
        } catch (RuntimeException e) {
            long elapsed = (System.nanoTime() - start) / 1_000_000L;
            appendLog(ownerId, connectionId, request.getSql(), ExecutionStatus.ERROR, null, elapsed, e.getMessage());
            throw e;
        }
    }

    public List<QueryLogEntry> history(String ownerId, int limit) {
        return queryLogRepository.findByOwner(ownerId, limit > 0 ? limit : 50);
    }

    private void appendLog(String ownerId, String connectionId, String sql, ExecutionStatus status, Integer rows, long elapsedMs, String error) {
        queryLogRepository.append(QueryLogEntry.builder()
                .ownerId(ownerId)
                .connectionId(connectionId)
                .sql(sql)
                .status(status)
                .rowCount(rows)
                .executionTimeMs(elapsedMs)
                .error(error)
                .executedAt(clock.instant())
                .build());
    }
}

package com.dbmaster.service;

import com.dbmaster.api.RowMutationRequest;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.pool.ManagedPool;
import com.dbmaster.pool.PoolRegistry;
import com.dbmaster.pool.QueryResult;
import com.dbmaster.pool.SqlStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Single-row insert, update and delete on an owned connection. Identifiers are validated and
 * backtick-quoted; values are always bound as parameters.
 */
@Slf4j
@Service
public class TableRowService {
    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}\\p{N}_$]{1,64}");

    private final ConnectionService connectionService;
    private final PoolRegistry poolRegistry;

    public TableRowService(ConnectionService connectionService, PoolRegistry poolRegistry) {
        this.connectionService = connectionService;
        this.poolRegistry = poolRegistry;
    }

    public int insert(String ownerId, String connectionId, String table, RowMutationRequest request) {
        Map<String, Object> values = request.getValues();
        if (values == null || values.isEmpty()) {
            throw new ValidationException("No columns to insert");
        }
        StringJoiner columns = new StringJoiner(", ");
        StringJoiner placeholders = new StringJoiner(", ");
        List<Object> params = new ArrayList<>();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            columns.add(quote(e.getKey()));
            placeholders.add("?");
            params.add(e.getValue());
        }
        String sql = "INSERT INTO " + quote(table) + " (" + columns + ") VALUES (" + placeholders + ")";
        return run(ownerId, connectionId, new SqlStatement(sql, params));
    }

    /**
     * @throws NotFoundException if no row matched the primary key
     */
    public int update(String ownerId, String connectionId, String table, RowMutationRequest request) {
        Map<String, Object> key = requireKey(request);
        StringJoiner assignments = new StringJoiner(", ");
        List<Object> params = new ArrayList<>();
        if (request.getValues() != null) {
            for (Map.Entry<String, Object> e : request.getValues().entrySet()) {
                if (key.containsKey(e.getKey())) {
                    continue;
                }
                assignments.add(quote(e.getKey()) + " = ?");
                params.add(e.getValue());
            }
        }
        if (params.isEmpty()) {
            throw new ValidationException("No columns to update");
        }
        String sql = "UPDATE " + quote(table) + " SET " + assignments + " WHERE " + where(key, params);
        int affected = run(ownerId, connectionId, new SqlStatement(sql, params));
        if (affected == 0) {
            throw new NotFoundException("No rows were updated. The record may not exist.");
        }
        return affected;
    }

    /**
     * @throws NotFoundException if no row matched the primary key
     */
    public int delete(String ownerId, String connectionId, String table, RowMutationRequest request) {
        Map<String, Object> key = requireKey(request);
        List<Object> params = new ArrayList<>();
        String sql = "DELETE FROM " + quote(table) + " WHERE " + where(key, params);
        int affected = run(ownerId, connectionId, new SqlStatement(sql, params));
        if (affected == 0) {
            throw new NotFoundException("No rows were deleted. The record may not exist.");
        }
        return affected;
    }

    private int run(String ownerId, String connectionId, SqlStatement statement) {
        ConnectionConfig config = connectionService.resolveForOwner(ownerId, connectionId);
        ManagedPool pool = poolRegistry.getPool(config);
        List<QueryResult> results = poolRegistry.executeQueryInTransaction(pool, List.of(statement), pool.getOptions().getQueryTimeoutMs());
        connectionService.markUsed(connectionId);
        int affected = results.isEmpty() ? 0 : results.get(0).affectedRows();
        log.info("Row mutation executed: connection_id={}, affected_rows={}", connectionId, affected);
        return affected;
    }

    private static Map<String, Object> requireKey(RowMutationRequest request) {
        if (request.getPrimaryKey() == null || request.getPrimaryKey().isEmpty()) {
            throw new ValidationException("Primary key is required");
        }
        return request.getPrimaryKey();
    }

    private static String where(Map<String, Object> key, List<Object> params) {
        StringJoiner clause = new StringJoiner(" AND ");
        for (Map.Entry<String, Object> e : key.entrySet()) {
            if (e.getValue() == null) {
                throw new ValidationException("Primary key column '" + e.getKey() + "' has no value");
            }
            clause.add(quote(e.getKey()) + " = ?");
            params.add(e.getValue());
        }
        return clause.toString();
    }

    static String quote(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new ValidationException("Invalid identifier: " + identifier);
        }
        return "`" + identifier + "`";
    }
}

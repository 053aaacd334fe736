package com.dbmaster.controller;

import com.dbmaster.api.ConnectionRequest;
import com.dbmaster.api.ConnectionResponse;
import com.dbmaster.api.ConnectionTestResponse;
import com.dbmaster.api.CredentialMigrationResponse;
import com.dbmaster.api.ExecuteRequest;
import com.dbmaster.api.ExecuteResponse;
import com.dbmaster.api.RowMutationRequest;
import com.dbmaster.api.RowMutationResponse;
import com.dbmaster.model.QueryLogEntry;
import com.dbmaster.service.ConnectionService;
import com.dbmaster.service.QueryService;
import com.dbmaster.service.TableRowService;
import com.dbmaster.web.CurrentUser;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/v1")
public class ConnectionController {

    private static final Logger log = LoggerFactory.getLogger(ConnectionController.class);

    private final ConnectionService connectionService;
    private final QueryService queryService;
    private final TableRowService tableRowService;

    public ConnectionController(ConnectionService connectionService, QueryService queryService, TableRowService tableRowService) {
        this.connectionService = connectionService;
        this.queryService = queryService;
        this.tableRowService = tableRowService;
    }

    /**
     * GET /v1/connections
     */
    @GetMapping("/connections")
    public ResponseEntity<List<ConnectionResponse>> list(@CurrentUser String userId) {
        List<ConnectionResponse> connections = connectionService.listForOwner(userId).stream()
                .map(ConnectionResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(connections);
    }

    /**
     * POST /v1/connections
     */
    @PostMapping("/connections")
    public ResponseEntity<ConnectionResponse> create(@CurrentUser String userId, @Valid @RequestBody ConnectionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ConnectionResponse.from(connectionService.create(userId, request)));
    }

    @GetMapping("/connections/{connectionId}")
    public ResponseEntity<ConnectionResponse> get(@CurrentUser String userId, @PathVariable("connectionId") String connectionId) {
        return ResponseEntity.ok(ConnectionResponse.from(connectionService.resolveForOwner(userId, connectionId)));
    }

    /**
     * PUT /v1/connections/{connectionId}
     *
     * <p>A blank password keeps the stored credential.
     */
    @PutMapping("/connections/{connectionId}")
    public ResponseEntity<ConnectionResponse> update(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @Valid @RequestBody ConnectionRequest request) {
        return ResponseEntity.ok(ConnectionResponse.from(connectionService.update(userId, connectionId, request)));
    }

    @DeleteMapping("/connections/{connectionId}")
    public ResponseEntity<Void> delete(@CurrentUser String userId, @PathVariable("connectionId") String connectionId) {
        connectionService.delete(userId, connectionId);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /v1/connections/{connectionId}/test
     */
    @PostMapping("/connections/{connectionId}/test")
    public ResponseEntity<ConnectionTestResponse> test(@CurrentUser String userId, @PathVariable("connectionId") String connectionId) {
        return ResponseEntity.ok(connectionService.test(userId, connectionId));
    }

    /**
     * Re-encrypt the caller's stored legacy-format credentials.
     *
     * POST /v1/connections/migrate-credentials
     */
    @PostMapping("/connections/migrate-credentials")
    public ResponseEntity<CredentialMigrationResponse> migrateCredentials(@CurrentUser String userId) {
        log.info("Credential migration requested: user_id={}", userId);
        return ResponseEntity.ok(connectionService.migrateLegacyCredentials(userId));
    }

    /**
     * Execute an ad-hoc statement through the connection's pool.
     *
     * POST /v1/connections/{connectionId}/query
     */
    @PostMapping("/connections/{connectionId}/query")
    public ResponseEntity<ExecuteResponse> execute(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @Valid @RequestBody ExecuteRequest request) {
        return ResponseEntity.ok(ExecuteResponse.from(queryService.execute(userId, connectionId, request)));
    }

    @GetMapping("/query-history")
    public ResponseEntity<List<QueryLogEntry>> history(
            @CurrentUser String userId,
            @RequestParam(value = "limit", required = false, defaultValue = "50") int limit) {
        return ResponseEntity.ok(queryService.history(userId, limit));
    }

    /**
     * POST /v1/connections/{connectionId}/tables/{table}/rows
     */
    @PostMapping("/connections/{connectionId}/tables/{table}/rows")
    public ResponseEntity<RowMutationResponse> insertRow(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @PathVariable("table") String table,
            @RequestBody RowMutationRequest request) {
        int affected = tableRowService.insert(userId, connectionId, table, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(new RowMutationResponse(affected));
    }

    @PutMapping("/connections/{connectionId}/tables/{table}/rows")
    public ResponseEntity<RowMutationResponse> updateRow(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @PathVariable("table") String table,
            @RequestBody RowMutationRequest request) {
        return ResponseEntity.ok(new RowMutationResponse(tableRowService.update(userId, connectionId, table, request)));
    }

    @DeleteMapping("/connections/{connectionId}/tables/{table}/rows")
    public ResponseEntity<RowMutationResponse> deleteRow(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @PathVariable("table") String table,
            @RequestBody RowMutationRequest request) {
        return ResponseEntity.ok(new RowMutationResponse(tableRowService.delete(userId, connectionId, table, request)));
    }
}

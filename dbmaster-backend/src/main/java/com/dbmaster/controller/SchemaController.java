package com.dbmaster.controller;

import com.dbmaster.api.SchemaVersionSummary;
import com.dbmaster.model.SchemaDiff;
import com.dbmaster.model.SchemaPage;
import com.dbmaster.model.TableSchema;
import com.dbmaster.schema.SchemaService;
import com.dbmaster.web.CurrentUser;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/v1/connections/{connectionId}/schema")
public class SchemaController {

    private final SchemaService schemaService;

    public SchemaController(SchemaService schemaService) {
        this.schemaService = schemaService;
    }

    /**
     * One page of the connection's schema, served from the snapshot cache unless stale or
     * {@code refresh=true}.
     *
     * GET /v1/connections/{connectionId}/schema
     */
    @GetMapping
    public ResponseEntity<SchemaPage> getSchema(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @RequestParam(value = "refresh", required = false, defaultValue = "false") boolean refresh,
            @RequestParam(value = "page", required = false, defaultValue = "1") int page,
            @RequestParam(value = "page_size", required = false) Integer pageSize) {
        return ResponseEntity.ok(schemaService.getSchema(userId, connectionId, refresh, page, pageSize));
    }

    @GetMapping("/versions")
    public ResponseEntity<List<SchemaVersionSummary>> listVersions(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @RequestParam(value = "limit", required = false, defaultValue = "20") int limit) {
        return ResponseEntity.ok(schemaService.listVersions(userId, connectionId, limit).stream()
                .map(SchemaVersionSummary::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/versions/{versionId}")
    public ResponseEntity<SchemaPage> getVersion(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @PathVariable("versionId") String versionId,
            @RequestParam(value = "page", required = false, defaultValue = "1") int page,
            @RequestParam(value = "page_size", required = false) Integer pageSize) {
        return ResponseEntity.ok(schemaService.getVersion(userId, connectionId, versionId, page, pageSize));
    }

    /**
     * GET /v1/connections/{connectionId}/schema/changes?from=..&to=..
     */
    @GetMapping("/changes")
    public ResponseEntity<SchemaDiff> getChanges(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @RequestParam("from") String fromVersionId,
            @RequestParam("to") String toVersionId) {
        return ResponseEntity.ok(schemaService.getChanges(userId, connectionId, fromVersionId, toVersionId));
    }

    @GetMapping("/search")
    public ResponseEntity<List<TableSchema>> search(
            @CurrentUser String userId,
            @PathVariable("connectionId") String connectionId,
            @RequestParam("q") String term) {
        return ResponseEntity.ok(schemaService.searchTables(userId, connectionId, term));
    }
}

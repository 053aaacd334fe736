package com.dbmaster.controller;

import com.dbmaster.api.ConnectionRequest;
import com.dbmaster.api.CredentialMigrationResponse;
import com.dbmaster.api.ExecuteRequest;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.pool.QueryExecutionException;
import com.dbmaster.pool.QueryResult;
import com.dbmaster.service.AccessDeniedException;
import com.dbmaster.service.ConnectionService;
import com.dbmaster.service.NotFoundException;
import com.dbmaster.service.QueryService;
import com.dbmaster.service.TableRowService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConnectionController.class)
class ConnectionControllerTest {

    private static final String USER_HEADER = "X-User-Id";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConnectionService connectionService;

    @MockBean
    private QueryService queryService;

    @MockBean
    private TableRowService tableRowService;

    private static ConnectionConfig stored() {
        return ConnectionConfig.builder()
                .id("c1")
                .name("reporting")
                .host("db.internal")
                .port(3307)
                .database("sales")
                .user("report")
                .encryptedPassword("aa:bb:cc")
                .ownerId("u1")
                .createdAt(Instant.parse("2024-01-15T09:00:00Z"))
                .build();
    }

    @Test
    void missingUserHeaderIsUnauthenticated() throws Exception {
        mockMvc.perform(get("/v1/connections"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"))
                .andExpect(header().exists("X-Request-Id"));
        verify(connectionService, never()).listForOwner(any());
    }

    @Test
    void listNeverExposesTheCredential() throws Exception {
        when(connectionService.listForOwner("u1")).thenReturn(List.of(stored()));

        mockMvc.perform(get("/v1/connections").header(USER_HEADER, "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("c1"))
                .andExpect(jsonPath("$[0].port").value(3307))
                .andExpect(jsonPath("$[0].encryptedPassword").doesNotExist())
                .andExpect(jsonPath("$[0].password").doesNotExist());
    }

    @Test
    void createReturns201() throws Exception {
        when(connectionService.create(eq("u1"), any(ConnectionRequest.class))).thenReturn(stored());

        mockMvc.perform(post("/v1/connections")
                        .header(USER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"reporting\",\"host\":\"db.internal\",\"port\":3307,"
                                + "\"database\":\"sales\",\"user\":\"report\",\"password\":\"pw\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("reporting"));
    }

    @Test
    void invalidBodyIsRejectedBeforeTheService() throws Exception {
        mockMvc.perform(post("/v1/connections")
                        .header(USER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\",\"host\":\"db.internal\",\"port\":70000,\"database\":\"sales\",\"user\":\"report\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
        verify(connectionService, never()).create(any(), any());
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/connections")
                        .header(USER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void credentialMigrationIsScopedToTheCaller() throws Exception {
        when(connectionService.migrateLegacyCredentials("u1")).thenReturn(new CredentialMigrationResponse(2, 1, 0));

        mockMvc.perform(post("/v1/connections/migrate-credentials").header(USER_HEADER, "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.migrated").value(2));
        verify(connectionService).migrateLegacyCredentials("u1");
    }

    @Test
    void unknownConnectionIs404() throws Exception {
        when(connectionService.resolveForOwner("u1", "missing")).thenThrow(new NotFoundException("Connection not found: missing"));

        mockMvc.perform(get("/v1/connections/missing").header(USER_HEADER, "u1").header("X-Request-Id", "trace-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.traceId").value("trace-1"));
    }

    @Test
    void foreignConnectionIs403() throws Exception {
        when(connectionService.resolveForOwner("u2", "c1")).thenThrow(new AccessDeniedException("Connection belongs to another user"));

        mockMvc.perform(get("/v1/connections/c1").header(USER_HEADER, "u2"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PERMISSION_DENIED"));
    }

    @Test
    void executeReturnsRowsAndCounts() throws Exception {
        QueryResult result = new QueryResult(List.of("n"), List.of(Map.of("n", 1), Map.of("n", 2)), 2, 7);
        when(queryService.execute(eq("u1"), eq("c1"), any(ExecuteRequest.class))).thenReturn(result);

        mockMvc.perform(post("/v1/connections/c1/query")
                        .header(USER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\":\"SELECT n FROM t WHERE n > ?\",\"params\":[0]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowCount").value(2))
                .andExpect(jsonPath("$.rows[1].n").value(2))
                .andExpect(jsonPath("$.executionTimeMs").value(7));
    }

    @Test
    void failedStatementIs422WithSqlState() throws Exception {
        when(queryService.execute(eq("u1"), eq("c1"), any(ExecuteRequest.class)))
                .thenThrow(new QueryExecutionException("Unknown column", new SQLException("Unknown column", "42S22", 1054)));

        mockMvc.perform(post("/v1/connections/c1/query")
                        .header(USER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\":\"SELECT nope FROM t\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("QUERY_FAILED"))
                .andExpect(jsonPath("$.details").value("sql_state=42S22, error_code=1054"));
    }
}

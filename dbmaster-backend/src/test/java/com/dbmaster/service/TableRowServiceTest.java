package com.dbmaster.service;

import com.dbmaster.api.RowMutationRequest;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.pool.ManagedPool;
import com.dbmaster.pool.PoolOptions;
import com.dbmaster.pool.PoolRegistry;
import com.dbmaster.pool.QueryResult;
import com.dbmaster.pool.SqlStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TableRowServiceTest {

    private static final String OWNER = "u1";

    private PoolRegistry poolRegistry;
    private ManagedPool pool;
    private ConnectionService connectionService;
    private TableRowService service;

    @BeforeEach
    void setUp() {
        poolRegistry = mock(PoolRegistry.class);
        pool = mock(ManagedPool.class);
        connectionService = mock(ConnectionService.class);
        ConnectionConfig config = ConnectionConfig.builder().id("c1").ownerId(OWNER).build();
        when(connectionService.resolveForOwner(OWNER, "c1")).thenReturn(config);
        when(poolRegistry.getPool(config)).thenReturn(pool);
        when(pool.getOptions()).thenReturn(PoolOptions.defaults());
        service = new TableRowService(connectionService, poolRegistry);
    }

    private void affects(int rows) {
        when(poolRegistry.executeQueryInTransaction(eq(pool), any(), anyInt()))
                .thenReturn(List.of(new QueryResult(List.of(), List.of(), rows, 1L)));
    }

    @SuppressWarnings("unchecked")
    private SqlStatement executedStatement() {
        ArgumentCaptor<List<SqlStatement>> captor = ArgumentCaptor.forClass(List.class);
        verify(poolRegistry).executeQueryInTransaction(eq(pool), captor.capture(), eq(PoolOptions.DEFAULT_QUERY_TIMEOUT_MS));
        assertThat(captor.getValue()).hasSize(1);
        return captor.getValue().get(0);
    }

    private static RowMutationRequest mutation() {
        return new RowMutationRequest();
    }

    @Test
    void insertQuotesIdentifiersAndBindsValues() {
        affects(1);
        RowMutationRequest request = mutation();
        request.getValues().put("email", "a@example.com");
        request.getValues().put("name", "Ann");

        int affected = service.insert(OWNER, "c1", "users", request);

        assertThat(affected).isEqualTo(1);
        SqlStatement statement = executedStatement();
        assertThat(statement.sql()).isEqualTo("INSERT INTO `users` (`email`, `name`) VALUES (?, ?)");
        assertThat(statement.params()).containsExactly("a@example.com", "Ann");
        verify(connectionService).markUsed("c1");
    }

    @Test
    void updateSkipsKeyColumnsInSetClause() {
        affects(1);
        RowMutationRequest request = mutation();
        request.getValues().put("id", 7);
        request.getValues().put("name", "Bob");
        request.getPrimaryKey().put("id", 7);

        service.update(OWNER, "c1", "users", request);

        SqlStatement statement = executedStatement();
        assertThat(statement.sql()).isEqualTo("UPDATE `users` SET `name` = ? WHERE `id` = ?");
        assertThat(statement.params()).containsExactly("Bob", 7);
    }

    @Test
    void deleteMatchesCompositeKey() {
        affects(1);
        RowMutationRequest request = mutation();
        request.getPrimaryKey().put("order_id", 1);
        request.getPrimaryKey().put("line_no", 2);

        service.delete(OWNER, "c1", "order_lines", request);

        SqlStatement statement = executedStatement();
        assertThat(statement.sql()).isEqualTo("DELETE FROM `order_lines` WHERE `order_id` = ? AND `line_no` = ?");
        assertThat(statement.params()).containsExactly(1, 2);
    }

    @Test
    void missingRowIsNotFound() {
        affects(0);
        RowMutationRequest request = mutation();
        request.getPrimaryKey().put("id", 99);

        assertThatThrownBy(() -> service.delete(OWNER, "c1", "users", request)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void updateWithoutKeyOrValuesIsRejected() {
        RowMutationRequest noKey = mutation();
        noKey.getValues().put("name", "x");
        RowMutationRequest onlyKey = mutation();
        onlyKey.getValues().put("id", 1);
        onlyKey.getPrimaryKey().put("id", 1);

        assertThatThrownBy(() -> service.update(OWNER, "c1", "users", noKey)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.update(OWNER, "c1", "users", onlyKey)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(poolRegistry);
    }

    @Test
    void nullKeyValueIsRejected() {
        RowMutationRequest request = mutation();
        request.getPrimaryKey().put("id", null);

        assertThatThrownBy(() -> service.delete(OWNER, "c1", "users", request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("id");
    }

    @Test
    void injectionAttemptsInIdentifiersAreRejected() {
        RowMutationRequest request = mutation();
        request.getValues().put("name", "x");

        assertThatThrownBy(() -> service.insert(OWNER, "c1", "users`; DROP TABLE users; --", request))
                .isInstanceOf(ValidationException.class);
        assertThat(TableRowService.quote("order_2024")).isEqualTo("`order_2024`");
        assertThatThrownBy(() -> TableRowService.quote("a b")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> TableRowService.quote("")).isInstanceOf(ValidationException.class);
    }
}

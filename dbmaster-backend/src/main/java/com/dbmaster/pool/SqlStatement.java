package com.dbmaster.pool;

import java.util.Arrays;
import java.util.List;

/**
 * A statement plus positional parameters, used for transactional batches.
 */
public record SqlStatement(String sql, List<Object> params) {
    public SqlStatement {
        params = params != null ? params : List.of();
    }

    public static SqlStatement of(String sql, Object... params) {
        return new SqlStatement(sql, params != null ? Arrays.asList(params) : List.of());
    }
}

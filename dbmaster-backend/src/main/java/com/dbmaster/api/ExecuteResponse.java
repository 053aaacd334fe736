package com.dbmaster.api;

import com.dbmaster.pool.QueryResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class ExecuteResponse {
    private List<String> columns;
    private List<Map<String, Object>> rows;
    private int rowCount;
    private int affectedRows;
    private long executionTimeMs;

    public static ExecuteResponse from(QueryResult result) {
        return ExecuteResponse.builder()
                .columns(result.columns())
                .rows(result.rows())
                .rowCount(result.rows().size())
                .affectedRows(result.affectedRows())
                .executionTimeMs(result.elapsedMs())
                .build();
    }
}

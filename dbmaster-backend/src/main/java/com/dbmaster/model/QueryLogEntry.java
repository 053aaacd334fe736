package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryLogEntry {
    private String id;
    private String ownerId;
    private String connectionId;
    private String sql;
    private ExecutionStatus status;
    private Integer rowCount;
    private Long executionTimeMs;
    private String error;
    private Instant executedAt;
}

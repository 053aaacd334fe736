package com.dbmaster.pool;

import java.util.List;
import java.util.Map;

/**
 * Result of one statement. Row values are JSON-safe; temporal values are rendered as strings.
 *
 * @param columns column labels in select order, empty for update statements
 * @param rows result rows keyed by column label, empty for update statements
 * @param affectedRows update count, or the number of rows read
 * @param elapsedMs wall-clock execution time
 */
public record QueryResult(List<String> columns, List<Map<String, Object>> rows, int affectedRows, long elapsedMs) {
    public QueryResult {
        columns = columns != null ? List.copyOf(columns) : List.of();
        rows = rows != null ? rows : List.of();
    }
}

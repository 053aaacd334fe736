package com.dbmaster.model;

import java.util.List;
import java.util.Map;

/**
 * Result of one query execution as seen by the alert evaluator.
 */
public interface QueryOutcome {

    record Rows(List<Map<String, Object>> rows) implements QueryOutcome {
        public Rows {
            rows = rows != null ? rows : List.of();
        }

        public int count() {
            return rows.size();
        }
    }

    record Failure(String message) implements QueryOutcome {
    }
}

package com.dbmaster.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One column as reported by {@code information_schema.COLUMNS}.
 */
public record ColumnSchema(
        String name,
        String dataType,
        boolean nullable,
        @JsonProperty("default") String defaultValue,
        String comment,
        String extra,
        String keyFlag) {
}

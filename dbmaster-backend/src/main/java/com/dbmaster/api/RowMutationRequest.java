package com.dbmaster.api;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single-row change. {@code values} holds the columns to write; {@code primaryKey} identifies the
 * row for update and delete.
 */
@Data
public class RowMutationRequest {
    private Map<String, Object> values = new LinkedHashMap<>();
    private Map<String, Object> primaryKey = new LinkedHashMap<>();
}

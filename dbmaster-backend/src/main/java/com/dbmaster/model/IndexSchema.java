package com.dbmaster.model;

import java.util.List;

/**
 * An index with its columns in sequence-in-index order.
 */
public record IndexSchema(String name, List<String> columns, boolean unique, String type) {
    public IndexSchema {
        columns = columns != null ? List.copyOf(columns) : List.of();
    }
}

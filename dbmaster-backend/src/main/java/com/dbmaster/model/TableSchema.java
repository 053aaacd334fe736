package com.dbmaster.model;

import java.util.List;

public record TableSchema(
        String name,
        String type,
        String comment,
        List<ColumnSchema> columns,
        List<String> primaryKey,
        List<ForeignKeySchema> foreignKeys,
        List<IndexSchema> indexes) {

    public TableSchema {
        columns = columns != null ? List.copyOf(columns) : List.of();
        primaryKey = primaryKey != null ? List.copyOf(primaryKey) : List.of();
        foreignKeys = foreignKeys != null ? List.copyOf(foreignKeys) : List.of();
        indexes = indexes != null ? List.copyOf(indexes) : List.of();
    }
}

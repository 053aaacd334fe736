package com.dbmaster.model;

public record ForeignKeySchema(String name, String column, String referenceTable, String referenceColumn) {
}

package com.dbmaster.model;

import java.util.List;

/**
 * One page of tables plus the paging metadata needed to fetch the rest. Pages are 1-based.
 */
public record SchemaPage(
        String versionId,
        List<TableSchema> tables,
        int page,
        int pageSize,
        int totalTables,
        int totalPages) {

    public SchemaPage {
        tables = tables != null ? List.copyOf(tables) : List.of();
    }

    public boolean hasMore() {
        return page < totalPages;
    }
}

package com.dbmaster.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Difference between two snapshots. Tables without any change are absent from {@code modifiedTables}.
 */
public record SchemaDiff(
        String oldVersionId,
        String newVersionId,
        List<String> addedTables,
        List<String> removedTables,
        Map<String, TableDiff> modifiedTables) {

    public SchemaDiff {
        addedTables = addedTables != null ? List.copyOf(addedTables) : List.of();
        removedTables = removedTables != null ? List.copyOf(removedTables) : List.of();
        modifiedTables = modifiedTables != null
                ? Collections.unmodifiableMap(new TreeMap<>(modifiedTables))
                : Collections.emptyMap();
    }

    public boolean isEmpty() {
        return addedTables.isEmpty() && removedTables.isEmpty() && modifiedTables.isEmpty();
    }

    public static String key(String oldVersionId, String newVersionId) {
        return oldVersionId + "_to_" + newVersionId;
    }
}

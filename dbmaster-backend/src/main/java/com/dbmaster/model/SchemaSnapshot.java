package com.dbmaster.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structural snapshot of one database, tables keyed and ordered by name.
 */
public record SchemaSnapshot(String versionId, Instant updatedAt, Map<String, TableSchema> tables) {

    public SchemaSnapshot {
        tables = tables != null
                ? Collections.unmodifiableMap(new TreeMap<>(tables))
                : Collections.emptyMap();
    }

    public int tableCount() {
        return tables.size();
    }
}

package com.dbmaster.api;

import com.dbmaster.model.SchemaVersion;

import java.time.Instant;

public record SchemaVersionSummary(String versionId, Instant createdAt, int tableCount) {
    public static SchemaVersionSummary from(SchemaVersion version) {
        return new SchemaVersionSummary(version.versionId(), version.createdAt(), version.tableCount());
    }
}

package com.dbmaster.model;

import java.time.Instant;

/**
 * Immutable entry of the schema version history for one (owner, connection) pair.
 */
public record SchemaVersion(
        String versionId,
        String ownerId,
        String connectionId,
        Instant createdAt,
        int tableCount,
        SchemaSnapshot snapshot) {
}

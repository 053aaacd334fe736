package com.dbmaster.repository;

import com.dbmaster.model.SchemaDiff;
import com.dbmaster.model.SchemaSnapshot;
import com.dbmaster.model.SchemaVersion;

import java.util.List;
import java.util.Optional;

/**
 * Current snapshot, version history and stored diffs per (owner, connection) pair.
 */
public interface SchemaSnapshotRepository {

    Optional<SchemaSnapshot> findCurrent(String ownerId, String connectionId);

    /**
     * Replaces the current snapshot, appends the version and stores the diff (when not null) as one
     * atomic write. Readers never observe a partial update.
     */
    void saveBaseline(String ownerId, String connectionId, SchemaSnapshot current, SchemaVersion version, SchemaDiff diff);

    /**
     * Newest first.
     */
    List<SchemaVersion> listVersions(String ownerId, String connectionId, int limit);

    Optional<SchemaVersion> findVersion(String ownerId, String connectionId, String versionId);

    Optional<SchemaDiff> findDiff(String ownerId, String connectionId, String oldVersionId, String newVersionId);

    void saveDiff(String ownerId, String connectionId, SchemaDiff diff);

    void deleteByConnection(String ownerId, String connectionId);
}

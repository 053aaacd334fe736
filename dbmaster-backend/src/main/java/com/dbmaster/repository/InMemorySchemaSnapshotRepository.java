package com.dbmaster.repository;

import com.dbmaster.model.SchemaDiff;
import com.dbmaster.model.SchemaSnapshot;
import com.dbmaster.model.SchemaVersion;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one immutable {@link SchemaState} per (owner, connection) and swaps it atomically, so a
 * baseline write is never observed half-applied.
 */
@Repository
public class InMemorySchemaSnapshotRepository implements SchemaSnapshotRepository {

    private final Map<String, SchemaState> states = new ConcurrentHashMap<>();

    private record SchemaState(SchemaSnapshot current, List<SchemaVersion> versions, Map<String, SchemaDiff> diffs) {
        static SchemaState empty() {
            return new SchemaState(null, List.of(), Map.of());
        }

        SchemaState withDiff(SchemaDiff diff) {
            Map<String, SchemaDiff> nextDiffs = new LinkedHashMap<>(diffs);
            nextDiffs.put(SchemaDiff.key(diff.oldVersionId(), diff.newVersionId()), diff);
            return new SchemaState(current, versions, Collections.unmodifiableMap(nextDiffs));
        }
    }

    @Override
    public Optional<SchemaSnapshot> findCurrent(String ownerId, String connectionId) {
        SchemaState state = states.get(key(ownerId, connectionId));
        return state != null ? Optional.ofNullable(state.current()) : Optional.empty();
    }

    @Override
    public void saveBaseline(String ownerId, String connectionId, SchemaSnapshot current, SchemaVersion version, SchemaDiff diff) {
        states.compute(key(ownerId, connectionId), (k, existing) -> {
            SchemaState base = existing != null ? existing : SchemaState.empty();
            List<SchemaVersion> versions = new ArrayList<>(base.versions());
            versions.add(version);
            SchemaState next = new SchemaState(current, Collections.unmodifiableList(versions), base.diffs());
            return diff != null ? next.withDiff(diff) : next;
        });
    }

    @Override
    public List<SchemaVersion> listVersions(String ownerId, String connectionId, int limit) {
        SchemaState state = states.get(key(ownerId, connectionId));
        if (state == null) {
            return List.of();
        }
        List<SchemaVersion> newestFirst = new ArrayList<>(state.versions());
        Collections.reverse(newestFirst);
        if (limit > 0 && newestFirst.size() > limit) {
            return List.copyOf(newestFirst.subList(0, limit));
        }
        return newestFirst;
    }

    @Override
    public Optional<SchemaVersion> findVersion(String ownerId, String connectionId, String versionId) {
        SchemaState state = states.get(key(ownerId, connectionId));
        if (state == null) {
            return Optional.empty();
        }
        return state.versions().stream().filter(v -> v.versionId().equals(versionId)).findFirst();
    }

    @Override
    public Optional<SchemaDiff> findDiff(String ownerId, String connectionId, String oldVersionId, String newVersionId) {
        SchemaState state = states.get(key(ownerId, connectionId));
        if (state == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(state.diffs().get(SchemaDiff.key(oldVersionId, newVersionId)));
    }

    @Override
    public void saveDiff(String ownerId, String connectionId, SchemaDiff diff) {
        states.compute(key(ownerId, connectionId), (k, existing) ->
                (existing != null ? existing : SchemaState.empty()).withDiff(diff));
    }

    @Override
    public void deleteByConnection(String ownerId, String connectionId) {
        states.remove(key(ownerId, connectionId));
    }

    private static String key(String ownerId, String connectionId) {
        return ownerId + "/" + connectionId;
    }
}

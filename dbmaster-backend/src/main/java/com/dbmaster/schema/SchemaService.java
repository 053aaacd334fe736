package com.dbmaster.schema;

import com.dbmaster.model.ColumnSchema;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.model.SchemaDiff;
import com.dbmaster.model.SchemaPage;
import com.dbmaster.model.SchemaSnapshot;
import com.dbmaster.model.SchemaVersion;
import com.dbmaster.model.TableSchema;
import com.dbmaster.repository.SchemaSnapshotRepository;
import com.dbmaster.service.ConnectionService;
import com.dbmaster.service.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cached schema snapshots with version history.
 *
 * <p>Reads are served from the current snapshot while it is younger than the cache TTL. A refresh
 * captures every table, stores it as the new baseline and records the diff against the previous
 * baseline when there is one.
 */
@Slf4j
@Service
public class SchemaService {

    private final SchemaSnapshotter snapshotter;
    private final SchemaDiffer differ;
    private final SchemaSnapshotRepository repository;
    private final ConnectionService connectionService;
    private final Clock clock;
    private final Duration cacheTtl;
    private final int defaultPageSize;

    private final Map<String, Object> refreshLocks = new ConcurrentHashMap<>();

    public SchemaService(
            SchemaSnapshotter snapshotter,
            SchemaDiffer differ,
            SchemaSnapshotRepository repository,
            ConnectionService connectionService,
            Clock clock,
            @Value("${dbmaster.schema.cache-ttl-minutes:60}") long cacheTtlMinutes,
            @Value("${dbmaster.schema.default-page-size:50}") int defaultPageSize
    ) {
        this.snapshotter = snapshotter;
        this.differ = differ;
        this.repository = repository;
        this.connectionService = connectionService;
        this.clock = clock;
        this.cacheTtl = Duration.ofMinutes(cacheTtlMinutes > 0 ? cacheTtlMinutes : 60);
        this.defaultPageSize = defaultPageSize > 0 ? defaultPageSize : SchemaSnapshotter.DEFAULT_PAGE_SIZE;
    }

    /**
     * Returns one page of the connection's schema, refreshing the baseline when the cached one is
     * stale, missing or {@code forceRefresh} is set.
     */
    public SchemaPage getSchema(String ownerId, String connectionId, boolean forceRefresh, int page, Integer pageSize) {
        ConnectionConfig config = connectionService.resolveForOwner(ownerId, connectionId);
        int size = pageSize != null && pageSize > 0 ? pageSize : defaultPageSize;

        if (!forceRefresh) {
            Optional<SchemaSnapshot> cached = repository.findCurrent(ownerId, connectionId);
            if (cached.isPresent() && isFresh(cached.get())) {
                log.debug("Serving cached schema: connection_id={}, version_id={}", connectionId, cached.get().versionId());
                return pageOf(cached.get(), page, size);
            }
        }

        SchemaSnapshot snapshot = refresh(ownerId, config, size);
        return pageOf(snapshot, page, size);
    }

    private SchemaSnapshot refresh(String ownerId, ConnectionConfig config, int pageSize) {
        Object lock = refreshLocks.computeIfAbsent(ownerId + "/" + config.getId(), k -> new Object());
        synchronized (lock) {
            Map<String, TableSchema> tables = snapshotter.captureAll(config, pageSize);
            connectionService.markUsed(config.getId());
            return persistBaseline(ownerId, config.getId(), tables);
        }
    }

    SchemaSnapshot persistBaseline(String ownerId, String connectionId, Map<String, TableSchema> tables) {
        Optional<SchemaSnapshot> prior = repository.findCurrent(ownerId, connectionId);
        Instant now = clock.instant();
        String versionId = nextVersionId(prior.map(SchemaSnapshot::versionId).orElse(null), now);

        SchemaSnapshot snapshot = new SchemaSnapshot(versionId, now, tables);
        SchemaDiff diff = prior.map(previous -> differ.diff(previous, snapshot)).orElse(null);
        SchemaVersion version = new SchemaVersion(versionId, ownerId, connectionId, now, snapshot.tableCount(), snapshot);
        repository.saveBaseline(ownerId, connectionId, snapshot, version, diff);

        log.info("Stored schema baseline: connection_id={}, version_id={}, tables={}, changed={}",
                connectionId, versionId, snapshot.tableCount(), diff != null && !diff.isEmpty());
        return snapshot;
    }

    /**
     * Version ids are epoch milliseconds, bumped past the previous id so they stay strictly increasing.
     */
    static String nextVersionId(String previous, Instant now) {
        long candidate = now.toEpochMilli();
        if (previous != null) {
            long prev = Long.parseLong(previous);
            if (candidate <= prev) {
                candidate = prev + 1;
            }
        }
        return Long.toString(candidate);
    }

    public Optional<SchemaSnapshot> getCachedSnapshot(String ownerId, String connectionId) {
        connectionService.resolveForOwner(ownerId, connectionId);
        return repository.findCurrent(ownerId, connectionId);
    }

    public List<SchemaVersion> listVersions(String ownerId, String connectionId, int limit) {
        connectionService.resolveForOwner(ownerId, connectionId);
        return repository.listVersions(ownerId, connectionId, limit > 0 ? limit : 20);
    }

    public SchemaPage getVersion(String ownerId, String connectionId, String versionId, int page, Integer pageSize) {
        connectionService.resolveForOwner(ownerId, connectionId);
        SchemaVersion version = repository.findVersion(ownerId, connectionId, versionId)
                .orElseThrow(() -> new NotFoundException("Schema version not found: " + versionId));
        return pageOf(version.snapshot(), page, pageSize != null && pageSize > 0 ? pageSize : defaultPageSize);
    }

    /**
     * Returns the stored diff between two versions, computing and storing it when absent.
     */
    public SchemaDiff getChanges(String ownerId, String connectionId, String oldVersionId, String newVersionId) {
        connectionService.resolveForOwner(ownerId, connectionId);
        Optional<SchemaDiff> stored = repository.findDiff(ownerId, connectionId, oldVersionId, newVersionId);
        if (stored.isPresent()) {
            return stored.get();
        }

        SchemaVersion older = repository.findVersion(ownerId, connectionId, oldVersionId)
                .orElseThrow(() -> new NotFoundException("Schema version not found: " + oldVersionId));
        SchemaVersion newer = repository.findVersion(ownerId, connectionId, newVersionId)
                .orElseThrow(() -> new NotFoundException("Schema version not found: " + newVersionId));

        SchemaDiff diff = differ.diff(older.snapshot(), newer.snapshot());
        repository.saveDiff(ownerId, connectionId, diff);
        return diff;
    }

    /**
     * Case-insensitive match on table name, table comment and column names of the cached snapshot.
     * Returns nothing when no snapshot has been captured yet.
     */
    public List<TableSchema> searchTables(String ownerId, String connectionId, String term) {
        Optional<SchemaSnapshot> snapshot = getCachedSnapshot(ownerId, connectionId);
        if (snapshot.isEmpty() || term == null || term.isBlank()) {
            return List.of();
        }
        String needle = term.trim().toLowerCase(Locale.ROOT);
        List<TableSchema> matches = new ArrayList<>();
        for (TableSchema table : snapshot.get().tables().values()) {
            if (contains(table.name(), needle) || contains(table.comment(), needle) || anyColumnMatches(table, needle)) {
                matches.add(table);
            }
        }
        return matches;
    }

    private boolean isFresh(SchemaSnapshot snapshot) {
        return snapshot.updatedAt() != null
                && Duration.between(snapshot.updatedAt(), clock.instant()).compareTo(cacheTtl) < 0;
    }

    static SchemaPage pageOf(SchemaSnapshot snapshot, int page, int pageSize) {
        int resolvedPage = Math.max(page, 1);
        List<TableSchema> all = new ArrayList<>(snapshot.tables().values());
        int total = all.size();
        int from = Math.min((resolvedPage - 1) * pageSize, total);
        int to = Math.min(from + pageSize, total);
        return new SchemaPage(snapshot.versionId(), all.subList(from, to), resolvedPage, pageSize,
                total, SchemaSnapshotter.totalPages(total, pageSize));
    }

    private static boolean anyColumnMatches(TableSchema table, String needle) {
        for (ColumnSchema column : table.columns()) {
            if (contains(column.name(), needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}

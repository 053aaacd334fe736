package com.dbmaster.repository;

import com.dbmaster.model.ExecutionRecord;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryExecutionRecordRepository implements ExecutionRecordRepository {
    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ExecutionRecord> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(id)).map(r -> r.toBuilder().build());
    }

    @Override
    public ExecutionRecord save(ExecutionRecord record) {
        ExecutionRecord stored = record.toBuilder().build();
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(UUID.randomUUID().toString());
        }
        records.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public List<ExecutionRecord> findBySchedule(String scheduledQueryId, int limit) {
        return records.values().stream()
                .filter(r -> scheduledQueryId.equals(r.getScheduledQueryId()))
                .sorted(Comparator.comparing(ExecutionRecord::getExecutionTime, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .map(r -> r.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findIdsExecutedBefore(String scheduledQueryId, Instant cutoff, int limit) {
        return records.values().stream()
                .filter(r -> scheduledQueryId.equals(r.getScheduledQueryId()))
                .filter(r -> r.getExecutionTime() != null && r.getExecutionTime().isBefore(cutoff))
                .sorted(Comparator.comparing(ExecutionRecord::getExecutionTime))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .map(ExecutionRecord::getId)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteAll(Collection<String> ids) {
        int removed = 0;
        for (String id : ids) {
            if (records.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int deleteBySchedule(String scheduledQueryId) {
        List<String> ids = records.values().stream()
                .filter(r -> scheduledQueryId.equals(r.getScheduledQueryId()))
                .map(ExecutionRecord::getId)
                .collect(Collectors.toList());
        return deleteAll(ids);
    }
}

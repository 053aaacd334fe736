package com.dbmaster.repository;

import com.dbmaster.model.ExecutionStatus;
import com.dbmaster.model.ScheduledQuery;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Default schedule store. Returns copies so callers cannot mutate stored state.
 */
@Repository
public class InMemoryScheduledQueryRepository implements ScheduledQueryRepository {
    private final Map<String, ScheduledQuery> queries = new ConcurrentHashMap<>();

    @Override
    public Optional<ScheduledQuery> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(queries.get(id)).map(InMemoryScheduledQueryRepository::copy);
    }

    @Override
    public List<ScheduledQuery> findActive() {
        return select(ScheduledQuery::isActive);
    }

    @Override
    public List<ScheduledQuery> findAll() {
        return select(q -> true);
    }

    @Override
    public List<ScheduledQuery> findByOwner(String ownerId) {
        return select(q -> Objects.equals(ownerId, q.getOwnerId()));
    }

    @Override
    public ScheduledQuery save(ScheduledQuery query) {
        ScheduledQuery stored = copy(query);
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(UUID.randomUUID().toString());
        }
        queries.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public void updateLastExecution(String id, Instant executedAt, ExecutionStatus status) {
        queries.computeIfPresent(id, (k, existing) -> {
            ScheduledQuery updated = copy(existing);
            updated.setLastExecutionAt(executedAt);
            updated.setLastExecutionStatus(status);
            return updated;
        });
    }

    @Override
    public boolean delete(String id) {
        return id != null && queries.remove(id) != null;
    }

    private List<ScheduledQuery> select(Predicate<ScheduledQuery> filter) {
        return queries.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(ScheduledQuery::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .map(InMemoryScheduledQueryRepository::copy)
                .collect(Collectors.toList());
    }

    private static ScheduledQuery copy(ScheduledQuery q) {
        return q.toBuilder().build();
    }
}

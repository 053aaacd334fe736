package com.dbmaster.repository;

import com.dbmaster.model.ExecutionStatus;
import com.dbmaster.model.ScheduledQuery;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduledQueryRepository {

    Optional<ScheduledQuery> findById(String id);

    List<ScheduledQuery> findActive();

    List<ScheduledQuery> findAll();

    List<ScheduledQuery> findByOwner(String ownerId);

    /**
     * Inserts or replaces the schedule, assigning an id when it has none.
     */
    ScheduledQuery save(ScheduledQuery query);

    void updateLastExecution(String id, Instant executedAt, ExecutionStatus status);

    boolean delete(String id);
}

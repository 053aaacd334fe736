package com.dbmaster.repository;

import com.dbmaster.model.ExecutionRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Execution history, indexed by (scheduledQueryId, executionTime).
 */
public interface ExecutionRecordRepository {

    Optional<ExecutionRecord> findById(String id);

    ExecutionRecord save(ExecutionRecord record);

    /**
     * Newest first.
     */
    List<ExecutionRecord> findBySchedule(String scheduledQueryId, int limit);

    /**
     * Ids of records of the schedule with {@code executionTime} strictly before {@code cutoff},
     * oldest first, at most {@code limit}.
     */
    List<String> findIdsExecutedBefore(String scheduledQueryId, Instant cutoff, int limit);

    /**
     * @return number of records removed
     */
    int deleteAll(Collection<String> ids);

    int deleteBySchedule(String scheduledQueryId);
}

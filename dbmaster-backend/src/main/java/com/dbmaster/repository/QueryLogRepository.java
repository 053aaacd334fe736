package com.dbmaster.repository;

import com.dbmaster.model.QueryLogEntry;

import java.util.List;

/**
 * Append-only audit of ad-hoc query runs.
 */
public interface QueryLogRepository {

    QueryLogEntry append(QueryLogEntry entry);

    /**
     * Newest first.
     */
    List<QueryLogEntry> findByOwner(String ownerId, int limit);
}

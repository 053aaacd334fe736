package com.dbmaster.repository;

import com.dbmaster.model.QueryLogEntry;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryQueryLogRepository implements QueryLogRepository {
    private final List<QueryLogEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public QueryLogEntry append(QueryLogEntry entry) {
        if (entry.getId() == null || entry.getId().isBlank()) {
            entry.setId(UUID.randomUUID().toString());
        }
        entries.add(entry);
        return entry;
    }

    @Override
    public List<QueryLogEntry> findByOwner(String ownerId, int limit) {
        List<QueryLogEntry> out = new ArrayList<>();
        for (int i = entries.size() - 1; i >= 0 && (limit <= 0 || out.size() < limit); i--) {
            QueryLogEntry entry = entries.get(i);
            if (Objects.equals(ownerId, entry.getOwnerId())) {
                out.add(entry);
            }
        }
        return out;
    }
}

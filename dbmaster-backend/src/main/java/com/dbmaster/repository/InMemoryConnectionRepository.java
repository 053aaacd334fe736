package com.dbmaster.repository;

import com.dbmaster.model.ConnectionConfig;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryConnectionRepository implements ConnectionRepository {
    private final Map<String, ConnectionConfig> connections = new ConcurrentHashMap<>();

    @Override
    public Optional<ConnectionConfig> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connections.get(id)).map(c -> c.toBuilder().build());
    }

    @Override
    public List<ConnectionConfig> findByOwner(String ownerId) {
        return connections.values().stream()
                .filter(c -> Objects.equals(ownerId, c.getOwnerId()))
                .sorted(Comparator.comparing(ConnectionConfig::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(c -> c.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public List<ConnectionConfig> findAll() {
        return connections.values().stream().map(c -> c.toBuilder().build()).collect(Collectors.toList());
    }

    @Override
    public ConnectionConfig save(ConnectionConfig config) {
        ConnectionConfig stored = config.toBuilder().build();
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(UUID.randomUUID().toString());
        }
        connections.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public boolean delete(String id) {
        return id != null && connections.remove(id) != null;
    }

    @Override
    public void touch(String id, Instant usedAt) {
        connections.computeIfPresent(id, (k, existing) -> existing.toBuilder().lastUsedAt(usedAt).build());
    }
}

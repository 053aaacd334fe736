package com.dbmaster.repository;

import com.dbmaster.model.Notification;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryNotificationRepository implements NotificationRepository {
    private final Map<String, Notification> notifications = new ConcurrentHashMap<>();

    @Override
    public Notification save(Notification notification) {
        Notification stored = notification.toBuilder().build();
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(UUID.randomUUID().toString());
        }
        notifications.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public Optional<Notification> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(notifications.get(id)).map(n -> n.toBuilder().build());
    }

    @Override
    public List<Notification> findByOwner(String ownerId, int limit) {
        return notifications.values().stream()
                .filter(n -> Objects.equals(ownerId, n.getOwnerId()))
                .sorted(Comparator.comparing(Notification::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .map(n -> n.toBuilder().build())
                .collect(Collectors.toList());
    }
}

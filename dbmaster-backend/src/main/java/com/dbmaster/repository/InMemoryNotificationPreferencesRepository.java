package com.dbmaster.repository;

import com.dbmaster.model.NotificationPreferences;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryNotificationPreferencesRepository implements NotificationPreferencesRepository {
    private final Map<String, NotificationPreferences> preferences = new ConcurrentHashMap<>();

    @Override
    public Optional<NotificationPreferences> findByOwner(String ownerId) {
        if (ownerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(preferences.get(ownerId)).map(p -> p.toBuilder().build());
    }

    @Override
    public NotificationPreferences save(NotificationPreferences prefs) {
        NotificationPreferences stored = prefs.toBuilder().build();
        preferences.put(stored.getOwnerId(), stored);
        return stored.toBuilder().build();
    }
}

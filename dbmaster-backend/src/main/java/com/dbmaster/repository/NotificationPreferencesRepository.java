package com.dbmaster.repository;

import com.dbmaster.model.NotificationPreferences;

import java.util.Optional;

public interface NotificationPreferencesRepository {

    Optional<NotificationPreferences> findByOwner(String ownerId);

    NotificationPreferences save(NotificationPreferences preferences);
}

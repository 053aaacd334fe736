package com.dbmaster.repository;

import com.dbmaster.model.Notification;

import java.util.List;
import java.util.Optional;

public interface NotificationRepository {

    Notification save(Notification notification);

    Optional<Notification> findById(String id);

    /**
     * Newest first.
     */
    List<Notification> findByOwner(String ownerId, int limit);
}

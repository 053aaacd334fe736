package com.dbmaster.repository;

import com.dbmaster.model.ConnectionConfig;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ConnectionRepository {

    Optional<ConnectionConfig> findById(String id);

    List<ConnectionConfig> findByOwner(String ownerId);

    List<ConnectionConfig> findAll();

    ConnectionConfig save(ConnectionConfig config);

    boolean delete(String id);

    void touch(String id, Instant usedAt);
}

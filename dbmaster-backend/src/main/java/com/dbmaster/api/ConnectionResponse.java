package com.dbmaster.api;

import com.dbmaster.model.ConnectionConfig;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A stored connection as returned to clients. Never carries the credential.
 */
@Data
@Builder
public class ConnectionResponse {
    private String id;
    private String name;
    private String host;
    private int port;
    private String database;
    private String user;
    private boolean ssl;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUsedAt;

    public static ConnectionResponse from(ConnectionConfig config) {
        return ConnectionResponse.builder()
                .id(config.getId())
                .name(config.getName())
                .host(config.getHost())
                .port(config.resolvedPort())
                .database(config.getDatabase())
                .user(config.getUser())
                .ssl(config.isSsl())
                .createdAt(config.getCreatedAt())
                .updatedAt(config.getUpdatedAt())
                .lastUsedAt(config.getLastUsedAt())
                .build();
    }
}

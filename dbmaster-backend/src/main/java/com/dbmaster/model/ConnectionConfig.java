package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Stored connection settings. The password only ever exists here in encrypted form.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionConfig {
    public static final int DEFAULT_PORT = 3306;

    private String id;
    private String name;
    private String host;
    private Integer port;
    private String database;
    private String user;

    @ToString.Exclude
    private String encryptedPassword;

    private boolean ssl;
    private String ownerId;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUsedAt;

    public int resolvedPort() {
        return port != null && port > 0 ? port : DEFAULT_PORT;
    }

    /**
     * Pool cache key, {@code host:port:database:user}.
     */
    public String poolKey() {
        return host + ":" + resolvedPort() + ":" + (database != null ? database : "") + ":" + user;
    }
}

package com.dbmaster.service;

import com.dbmaster.api.ConnectionRequest;
import com.dbmaster.api.ConnectionTestResponse;
import com.dbmaster.api.CredentialMigrationResponse;
import com.dbmaster.crypto.CredentialVault;
import com.dbmaster.crypto.EncryptionException;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.pool.ConnectivityException;
import com.dbmaster.pool.CredentialException;
import com.dbmaster.pool.PoolRegistry;
import com.dbmaster.repository.ConnectionRepository;
import com.dbmaster.repository.SchemaSnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Stored connection settings with encrypted credentials.
 */
@Slf4j
@Service
public class ConnectionService {
    private static final int VALIDITY_TIMEOUT_SEC = 5;

    private final ConnectionRepository connectionRepository;
    private final SchemaSnapshotRepository schemaSnapshotRepository;
    private final CredentialVault vault;
    private final PoolRegistry poolRegistry;
    private final Clock clock;

    public ConnectionService(
            ConnectionRepository connectionRepository,
            SchemaSnapshotRepository schemaSnapshotRepository,
            CredentialVault vault,
            PoolRegistry poolRegistry,
            Clock clock
    ) {
        this.connectionRepository = connectionRepository;
        this.schemaSnapshotRepository = schemaSnapshotRepository;
        this.vault = vault;
        this.poolRegistry = poolRegistry;
        this.clock = clock;
    }

    public ConnectionConfig create(String ownerId, ConnectionRequest request) {
        if (isBlank(request.getPassword())) {
            throw new ValidationException("Password is required");
        }
        Instant now = clock.instant();
        ConnectionConfig saved = connectionRepository.save(ConnectionConfig.builder()
                .name(request.getName())
                .host(request.getHost())
                .port(request.getPort())
                .database(request.getDatabase())
                .user(request.getUser())
                .encryptedPassword(vault.encrypt(request.getPassword()))
                .ssl(request.isSsl())
                .ownerId(ownerId)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Connection created: connection_id={}, owner_id={}", saved.getId(), ownerId);
        return saved;
    }

    /**
     * Updates a stored connection. A blank password keeps the existing ciphertext.
     */
    public ConnectionConfig update(String ownerId, String connectionId, ConnectionRequest request) {
        ConnectionConfig existing = resolveForOwner(ownerId, connectionId);
        String encrypted = isBlank(request.getPassword())
                ? existing.getEncryptedPassword()
                : vault.encrypt(request.getPassword());

        ConnectionConfig updated = existing.toBuilder()
                .name(request.getName())
                .host(request.getHost())
                .port(request.getPort())
                .database(request.getDatabase())
                .user(request.getUser())
                .encryptedPassword(encrypted)
                .ssl(request.isSsl())
                .updatedAt(clock.instant())
                .build();
        return connectionRepository.save(updated);
    }

    public List<ConnectionConfig> listForOwner(String ownerId) {
        return connectionRepository.findByOwner(ownerId);
    }

    /**
     * Returns the owner's connection.
     *
     * @throws NotFoundException if no such connection exists
     * @throws AccessDeniedException if it belongs to another owner
     */
    public ConnectionConfig resolveForOwner(String ownerId, String connectionId) {
        ConnectionConfig config = connectionRepository.findById(connectionId)
                .orElseThrow(() -> new NotFoundException("Connection not found: " + connectionId));
        if (!Objects.equals(ownerId, config.getOwnerId())) {
            throw new AccessDeniedException("Connection belongs to another user");
        }
        return config;
    }

    public void delete(String ownerId, String connectionId) {
        resolveForOwner(ownerId, connectionId);
        connectionRepository.delete(connectionId);
        schemaSnapshotRepository.deleteByConnection(ownerId, connectionId);
        log.info("Connection deleted: connection_id={}, owner_id={}", connectionId, ownerId);
    }

    public void markUsed(String connectionId) {
        connectionRepository.touch(connectionId, clock.instant());
    }

    /**
     * Opens a single-use connection and checks it is valid. Connectivity and credential failures
     * are reported in the response rather than thrown.
     */
    public ConnectionTestResponse test(String ownerId, String connectionId) {
        ConnectionConfig config = resolveForOwner(ownerId, connectionId);
        long start = System.nanoTime();
        Connection conn = null;
        try {
            conn = poolRegistry.createConnection(config);
            boolean valid = conn.isValid(VALIDITY_TIMEOUT_SEC);
            long elapsed = (System.nanoTime() - start) / 1_000_000L;
            markUsed(connectionId);
            return new ConnectionTestResponse(valid, valid ? "Connection successful" : "Connection is not valid", elapsed);
        } catch (ConnectivityException | CredentialException e) {
            long elapsed = (System.nanoTime() - start) / 1_000_000L;
            log.warn("Connection test failed: connection_id={}, error={}", connectionId, e.getMessage());
            return new ConnectionTestResponse(false, e.getMessage(), elapsed);
        } catch (SQLException e) {
            long elapsed = (System.nanoTime() - start) / 1_000_000L;
            log.warn("Connection validity check failed: connection_id={}, sql_state={}", connectionId, e.getSQLState());
            return new ConnectionTestResponse(false, e.getMessage(), elapsed);
        } finally {
            poolRegistry.closeConnection(conn);
        }
    }

    /**
     * Re-encrypts the owner's stored credentials still in the legacy format. Other owners'
     * connections are not touched.
     */
    public CredentialMigrationResponse migrateLegacyCredentials(String ownerId) {
        int migrated = 0;
        int skipped = 0;
        int failed = 0;
        for (ConnectionConfig config : connectionRepository.findByOwner(ownerId)) {
            String encrypted = config.getEncryptedPassword();
            if (encrypted == null || !vault.isLegacyFormat(encrypted)) {
                skipped++;
                continue;
            }
            try {
                connectionRepository.save(config.toBuilder()
                        .encryptedPassword(vault.reEncrypt(encrypted))
                        .updatedAt(clock.instant())
                        .build());
                migrated++;
            } catch (EncryptionException e) {
                failed++;
                log.error("Failed to migrate credential: connection_id={}, error={}", config.getId(), e.getMessage());
            }
        }
        log.info("Credential migration finished: owner_id={}, migrated={}, skipped={}, failed={}", ownerId, migrated, skipped, failed);
        return new CredentialMigrationResponse(migrated, skipped, failed);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

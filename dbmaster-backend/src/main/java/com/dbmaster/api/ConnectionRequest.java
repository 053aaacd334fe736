package com.dbmaster.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Create or update a stored connection. On update a blank password keeps the stored credential.
 */
@Data
public class ConnectionRequest {
    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Host is required")
    private String host;

    @Min(value = 1, message = "Port must be between 1 and 65535")
    @Max(value = 65535, message = "Port must be between 1 and 65535")
    private Integer port;

    @NotBlank(message = "Database is required")
    private String database;

    @NotBlank(message = "User is required")
    private String user;

    private String password;

    private boolean ssl = false;
}

package com.dbmaster.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ExecuteRequest {
    @NotBlank(message = "SQL is required")
    private String sql;

    /** Positional parameters bound to {@code ?} placeholders. */
    private List<Object> params = new ArrayList<>();

    private Integer timeoutMs;
}

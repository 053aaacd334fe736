package com.dbmaster.api;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ToggleActiveRequest {
    @NotNull(message = "Active flag is required")
    private Boolean active;
}

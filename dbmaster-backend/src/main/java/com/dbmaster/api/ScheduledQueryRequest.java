package com.dbmaster.api;

import com.dbmaster.model.NotificationSettings;
import com.dbmaster.model.QueryParameter;
import com.dbmaster.model.Recurrence;
import com.dbmaster.model.ScheduleWindow;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ScheduledQueryRequest {
    @NotBlank(message = "Name is required")
    private String name;

    private String description;

    @NotBlank(message = "Connection id is required")
    private String connectionId;

    @NotBlank(message = "SQL is required")
    private String sql;

    private List<QueryParameter> parameters = new ArrayList<>();

    @NotNull(message = "Recurrence is required")
    private Recurrence recurrence;

    private ScheduleWindow window;

    private NotificationSettings notifications;

    private Integer maxHistoryRetention;

    private Boolean active;
}

package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Active window of a schedule and the time zone its wall-clock fields are read in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleWindow {
    private Instant startTime;
    private Instant endTime;
    private String timezone;

    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        return ZoneId.of(timezone.trim());
    }
}

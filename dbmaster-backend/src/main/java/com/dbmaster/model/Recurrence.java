package com.dbmaster.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * When a scheduled query fires. Each frequency carries only the fields it uses; the JSON form is
 * discriminated by {@code frequency}.
 *
 * <pre>
 * {"frequency": "WEEKLY", "daysOfWeek": [1, 3], "hour": 9, "minute": 30}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "frequency")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Recurrence.Once.class, name = "ONCE"),
        @JsonSubTypes.Type(value = Recurrence.Hourly.class, name = "HOURLY"),
        @JsonSubTypes.Type(value = Recurrence.Daily.class, name = "DAILY"),
        @JsonSubTypes.Type(value = Recurrence.Weekly.class, name = "WEEKLY"),
        @JsonSubTypes.Type(value = Recurrence.Monthly.class, name = "MONTHLY"),
        @JsonSubTypes.Type(value = Recurrence.Custom.class, name = "CUSTOM")
})
public interface Recurrence {

    @JsonIgnore
    Frequency getFrequency();

    record Once() implements Recurrence {
        @Override
        public Frequency getFrequency() {
            return Frequency.ONCE;
        }
    }

    record Hourly(Integer minute) implements Recurrence {
        public Hourly {
            minute = checkRange("minute", minute, 0, 59, 0);
        }

        @Override
        public Frequency getFrequency() {
            return Frequency.HOURLY;
        }
    }

    record Daily(Integer hour, Integer minute) implements Recurrence {
        public Daily {
            hour = checkRange("hour", hour, 0, 23, 0);
            minute = checkRange("minute", minute, 0, 59, 0);
        }

        @Override
        public Frequency getFrequency() {
            return Frequency.DAILY;
        }
    }

    /**
     * Days of week use 0 for Sunday through 6 for Saturday.
     */
    record Weekly(Set<Integer> daysOfWeek, Integer hour, Integer minute) implements Recurrence {
        public Weekly {
            if (daysOfWeek == null || daysOfWeek.isEmpty()) {
                throw new IllegalArgumentException("daysOfWeek must not be empty");
            }
            for (Integer day : daysOfWeek) {
                checkRange("daysOfWeek", day, 0, 6, null);
            }
            daysOfWeek = Collections.unmodifiableSet(new TreeSet<>(daysOfWeek));
            hour = checkRange("hour", hour, 0, 23, 0);
            minute = checkRange("minute", minute, 0, 59, 0);
        }

        @Override
        public Frequency getFrequency() {
            return Frequency.WEEKLY;
        }
    }

    record Monthly(Integer dayOfMonth, Integer hour, Integer minute) implements Recurrence {
        public Monthly {
            dayOfMonth = checkRange("dayOfMonth", dayOfMonth, 1, 31, 1);
            hour = checkRange("hour", hour, 0, 23, 0);
            minute = checkRange("minute", minute, 0, 59, 0);
        }

        @Override
        public Frequency getFrequency() {
            return Frequency.MONTHLY;
        }
    }

    record Custom(String cronExpression) implements Recurrence {
        public Custom {
            if (cronExpression == null || cronExpression.isBlank()) {
                throw new IllegalArgumentException("cronExpression is required for CUSTOM schedules");
            }
            cronExpression = cronExpression.trim();
        }

        @Override
        public Frequency getFrequency() {
            return Frequency.CUSTOM;
        }
    }

    private static Integer checkRange(String field, Integer value, int min, int max, Integer defaultValue) {
        if (value == null) {
            if (defaultValue == null) {
                throw new IllegalArgumentException(field + " is required");
            }
            return defaultValue;
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + max + ": " + value);
        }
        return value;
    }
}

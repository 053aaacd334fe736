package com.dbmaster.model;

public enum NotificationPriority {
    LOW,
    MEDIUM,
    HIGH
}

package com.dbmaster.model;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED
}

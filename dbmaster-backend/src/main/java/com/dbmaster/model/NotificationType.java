package com.dbmaster.model;

public enum NotificationType {
    QUERY_EXECUTION_SUCCESS,
    QUERY_EXECUTION_ALERT,
    QUERY_EXECUTION_ERROR
}

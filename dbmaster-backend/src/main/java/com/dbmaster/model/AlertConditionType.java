package com.dbmaster.model;

public enum AlertConditionType {
    ALWAYS,
    NO_RESULTS,
    ERROR,
    ROWS_COUNT,
    CUSTOM_CONDITION
}

package com.dbmaster.model;

public enum ExecutionStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    ERROR;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR;
    }
}

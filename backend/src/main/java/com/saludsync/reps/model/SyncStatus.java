package com.saludsync.reps.model;

public enum SyncStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    ROLLED_BACK,
    CRITICAL_ERROR;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}

package com.saludsync.reps.model;

public enum CapacityImportStatus {
    STARTED,
    PROCESSING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED
}

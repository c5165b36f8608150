package com.saludsync.reps.model;

public enum HabilitationStatus {
    ENABLED,
    IN_PROGRESS,
    SUSPENDED,
    CANCELLED,
    EXPIRED
}

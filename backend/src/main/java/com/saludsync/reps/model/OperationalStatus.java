package com.saludsync.reps.model;

public enum OperationalStatus {
    ACTIVE,
    INACTIVE,
    TEMPORARILY_CLOSED,
    PERMANENTLY_CLOSED,
    UNDER_CONSTRUCTION
}

package com.saludsync.reps.model;

public enum ServiceStatus {
    ACTIVE,
    SUSPENDED,
    CANCELLED,
    EXPIRED
}

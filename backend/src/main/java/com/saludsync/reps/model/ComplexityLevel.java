package com.saludsync.reps.model;

public enum ComplexityLevel {
    LOW,
    MEDIUM,
    HIGH
}

package com.saludsync.reps.model;

/**
 * Three-valued flag used by the REPS export for modality columns.
 * The code is what the registry itself prints: SI, NO or SD (sin dato).
 */
public enum YesNo {
    YES("SI"),
    NO("NO"),
    UNKNOWN("SD");

    private final String code;

    YesNo(String code) { this.code = code; }

    public String getCode() { return code; }
}

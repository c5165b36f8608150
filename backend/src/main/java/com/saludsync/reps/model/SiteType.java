package com.saludsync.reps.model;

public enum SiteType {
    PRINCIPAL,
    SATELLITE,
    MOBILE,
    DOMICILIARY,
    TELEMEDICINE
}

package com.saludsync.reps.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Supplies the user name written into created_by/updated_by. Authentication lives outside this service,
 * so the caller's claim is taken as given.
 */
@Component
public class AuditContext {

    @Value("${reps.sync.default-user:system}")
    private String defaultUser = "system";

    public String actingUser(String requested) {
        if (requested == null || requested.isBlank()) return defaultUser;
        String u = requested.strip();
        return u.length() > 100 ? u.substring(0, 100) : u;
    }
}

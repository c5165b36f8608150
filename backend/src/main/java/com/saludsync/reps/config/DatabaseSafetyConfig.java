package com.saludsync.reps.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Refuses to start when Hibernate would drop or recreate the registry schema outside a test profile.
 * Facility and service rows are the organization's official REPS data, so schema changes go through Flyway.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    private final Environment environment;

    @Value("${spring.jpa.hibernate.ddl-auto:validate}")
    private String ddlAuto;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    @Value("${reps.sync.keep-backups:false}")
    private boolean keepBackups;

    public DatabaseSafetyConfig(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void verifySchemaSafety() {
        check(String.join(",", environment.getActiveProfiles()), ddlAuto, datasourceUrl);
        log.info("[DB_SAFETY] registry backups are {} after successful runs", keepBackups ? "kept" : "discarded");
    }

    static void check(String activeProfiles, String ddlAuto, String datasourceUrl) {
        String profiles = safeLower(activeProfiles);
        String ddl = safeLower(ddlAuto).replace('_', '-');
        String dsUrl = datasourceUrl == null ? "" : datasourceUrl;

        log.info("[DB_SAFETY] profiles='{}', ddl-auto='{}', datasource='{}'", activeProfiles, ddlAuto, dsUrl);

        boolean destructive = "create".equals(ddl) || "create-drop".equals(ddl);
        if (destructive && !profiles.contains("test")) {
            throw new IllegalStateException("ddl-auto=" + ddl + " is only allowed under a test profile; refusing to start");
        }
        if (dsUrl.toLowerCase().contains("mem:")) {
            log.warn("[DB_SAFETY] in-memory datasource, synchronized registry data will be lost on restart");
        }
    }

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase();
    }
}

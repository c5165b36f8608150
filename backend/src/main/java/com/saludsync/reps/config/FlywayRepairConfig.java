package com.saludsync.reps.config;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    @Value("${reps.flyway.repair-on-migrate:true}")
    private boolean repairOnMigrate;

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> migrate(flyway, repairOnMigrate);
    }

    static void migrate(Flyway flyway, boolean repair) {
        if (repair) {
            try {
                log.info("Running Flyway repair before migrating the registry schema");
                flyway.repair();
            } catch (Exception ex) {
                log.warn("Flyway repair failed or not needed: {}", ex.getMessage());
            }
        }
        flyway.migrate();
    }
}

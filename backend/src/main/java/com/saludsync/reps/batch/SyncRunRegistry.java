package com.saludsync.reps.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process guard that keeps two synchronizations of the same organization from overlapping.
 * Only one application instance is expected; this is not a distributed lock.
 */
@Component
@EnableScheduling
public class SyncRunRegistry {

    private static final Logger log = LoggerFactory.getLogger(SyncRunRegistry.class);

    private static final Duration STALE_AFTER = Duration.ofHours(6);

    private final Map<Long, Instant> running = new ConcurrentHashMap<>();

    /** @return false when the organization already has a run in progress */
    public boolean tryAcquire(Long organizationId) {
        return running.putIfAbsent(organizationId, Instant.now()) == null;
    }

    public void release(Long organizationId) {
        running.remove(organizationId);
    }

    boolean isRunning(Long organizationId) {
        return running.containsKey(organizationId);
    }

    Optional<Instant> runningSince(Long organizationId) {
        return Optional.ofNullable(running.get(organizationId));
    }

    @Scheduled(cron = "0 0 * * * *") // hourly
    public void releaseStale() {
        Instant cutoff = Instant.now().minus(STALE_AFTER);
        running.entrySet().removeIf(e -> {
            boolean stale = e.getValue().isBefore(cutoff);
            if (stale) log.warn("[REPS_SYNC] releasing stale run guard for org={} held since {}", e.getKey(), e.getValue());
            return stale;
        });
    }
}

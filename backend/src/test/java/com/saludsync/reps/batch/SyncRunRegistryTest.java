package com.saludsync.reps.batch;

import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyncRunRegistryTest {

    private final SyncRunRegistry registry = new SyncRunRegistry();

    @Test
    void secondAcquireForSameOrganizationFailsUntilReleased() {
        assertThat(registry.tryAcquire(1L)).isTrue();
        assertThat(registry.tryAcquire(1L)).isFalse();
        assertThat(registry.tryAcquire(2L)).isTrue();
        assertThat(registry.isRunning(1L)).isTrue();
        assertThat(registry.runningSince(1L)).isPresent();

        registry.release(1L);

        assertThat(registry.isRunning(1L)).isFalse();
        assertThat(registry.tryAcquire(1L)).isTrue();
    }

    @Test
    void onlyOneOfManyConcurrentCallersWins() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < 32; i++) calls.add(() -> registry.tryAcquire(42L));
            int winners = 0;
            for (Future<Boolean> f : pool.invokeAll(calls)) {
                if (f.get()) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void freshGuardsSurviveStaleSweep() {
        registry.tryAcquire(5L);
        registry.releaseStale();
        assertThat(registry.isRunning(5L)).isTrue();
    }
}

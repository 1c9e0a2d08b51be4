package com.automaker.core.state;

import com.automaker.core.errors.FeatureAlreadyRunningException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RunningFeatureRegistryTest {

    private final RunningFeatureRegistry registry = new RunningFeatureRegistry();

    @Test
    @DisplayName("a second registration for the same feature is rejected")
    void rejectsDuplicate() {
        registry.register("F1", "/p", true);

        var error = assertThrows(FeatureAlreadyRunningException.class, () -> registry.register("F1", "/p", false));
        assertTrue(error.getMessage().contains("already running"));
    }

    @Test
    @DisplayName("concurrent registrations admit exactly one")
    void concurrentAdmission() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            attempts.add(pool.submit(() -> {
                go.await();
                try {
                    registry.register("F1", "/p", true);
                    return true;
                } catch (FeatureAlreadyRunningException e) {
                    return false;
                }
            }));
        }
        go.countDown();

        int admitted = 0;
        for (Future<Boolean> attempt : attempts) {
            if (attempt.get(5, TimeUnit.SECONDS)) {
                admitted++;
            }
        }
        pool.shutdownNow();

        assertEquals(1, admitted);
    }

    @Test
    @DisplayName("release only removes the matching entry")
    void releaseMatchesEntry() {
        RunningFeature first = registry.register("F1", "/p", true);
        assertTrue(registry.release(first));
        RunningFeature second = registry.register("F1", "/p", true);

        assertFalse(registry.release(first));
        assertTrue(registry.isRunning("F1"));
        assertTrue(registry.release(second));
        assertFalse(registry.isRunning("F1"));
    }

    @Test
    @DisplayName("counts and lists per project")
    void perProject() {
        registry.register("F2", "/a", true);
        registry.register("F1", "/a", false);
        registry.register("F3", "/b", true);

        assertEquals(2, registry.countForProject("/a"));
        assertEquals(List.of("F1", "F2"), registry.idsForProject("/a"));
        assertEquals(3, registry.all().size());
        assertEquals(0, registry.countForProject("/c"));
    }
}

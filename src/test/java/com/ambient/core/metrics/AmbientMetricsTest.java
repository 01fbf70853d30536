package com.ambient.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AmbientMetricsTest {

    private SimpleMeterRegistry registry;
    private AmbientMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AmbientMetrics(registry);
    }

    @Test
    @DisplayName("recordPhaseTransition counts per phase")
    void recordPhaseTransition() {
        metrics.recordPhaseTransition("Running");
        metrics.recordPhaseTransition("Running");
        metrics.recordPhaseTransition("Failed");

        var running = registry.find("ambient.sessions.transitions").tag("phase", "Running").counter();
        var failed = registry.find("ambient.sessions.transitions").tag("phase", "Failed").counter();

        assertNotNull(running);
        assertNotNull(failed);
        assertEquals(2.0, running.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordJobCreation tags success and failure separately")
    void recordJobCreation() {
        metrics.recordJobCreation(true);
        metrics.recordJobCreation(false);
        metrics.recordJobCreation(false);

        assertEquals(1.0, registry.find("ambient.jobs.created").tag("result", "success").counter().count());
        assertEquals(2.0, registry.find("ambient.jobs.created").tag("result", "failure").counter().count());
    }

    @Test
    @DisplayName("recordReconcileDuration creates a timer")
    void recordReconcileDuration() {
        metrics.recordReconcileDuration(120);
        var timer = registry.find("ambient.reconcile.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordWatchRestart tags by kind")
    void recordWatchRestart() {
        metrics.recordWatchRestart("AgenticSession");
        assertEquals(1.0, registry.find("ambient.watch.restarts").tag("kind", "AgenticSession").counter().count());
    }
}

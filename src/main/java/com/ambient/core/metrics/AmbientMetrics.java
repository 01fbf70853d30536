package com.ambient.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for session orchestration.
 */
@Service
public class AmbientMetrics {

    private final MeterRegistry registry;

    public AmbientMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSessionCreated() {
        Counter.builder("ambient.sessions.created")
                .register(registry)
                .increment();
    }

    /**
     * Records a phase written by the controller or by a lifecycle operation.
     *
     * @param phase wire name of the phase, e.g. {@code Running}
     */
    public void recordPhaseTransition(String phase) {
        Counter.builder("ambient.sessions.transitions")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordJobCreation(boolean success) {
        Counter.builder("ambient.jobs.created")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordReconcileDuration(long ms) {
        Timer.builder("ambient.reconcile.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordWatchRestart(String kind) {
        Counter.builder("ambient.watch.restarts")
                .description("Watch streams re-established after closing or failing")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordProvisioningFailure(String step) {
        Counter.builder("ambient.credentials.failures")
                .tag("step", step)
                .register(registry)
                .increment();
    }

    public void recordContentProxyCall(String operation, boolean success) {
        Counter.builder("ambient.content.calls")
                .tag("operation", operation)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordPermissionChange(String action) {
        Counter.builder("ambient.permissions.changes")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    /** Time from job creation until the supervisor saw it finish. */
    public void recordSupervisedJob(Duration duration, String outcome) {
        Timer.builder("ambient.jobs.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }
}

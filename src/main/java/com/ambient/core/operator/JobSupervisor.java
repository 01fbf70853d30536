package com.ambient.core.operator;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.ClusterException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.logging.MdcContext;
import com.ambient.core.metrics.AmbientMetrics;
import com.ambient.core.model.SessionPhase;
import com.ambient.core.session.SessionStateException;
import com.ambient.core.session.SessionStatusWriter;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Polls a session's job until it succeeds or exhausts its retry budget, then writes the
 * terminal phase onto the session.
 */
@Component
public class JobSupervisor {

    private static final Logger log = LoggerFactory.getLogger(JobSupervisor.class);

    static final String TRUNCATION_MARKER = "...";

    private final SupervisionRegistry registry;
    private final SessionStatusWriter statusWriter;
    private final AmbientProperties properties;
    private final AmbientMetrics metrics;
    private final Clock clock;

    public JobSupervisor(SupervisionRegistry registry, SessionStatusWriter statusWriter,
                         AmbientProperties properties, AmbientMetrics metrics, Clock clock) {
        this.registry = registry;
        this.statusWriter = statusWriter;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Starts supervising {@code jobName} for the session. */
    public void supervise(ClusterClients clients, String namespace, String sessionName, String jobName) {
        Instant started = clock.instant();
        boolean scheduled = registry.schedule(namespace, sessionName,
                properties.getOperator().getPollIntervalSeconds(),
                () -> poll(clients, namespace, sessionName, jobName, started));
        if (scheduled) {
            log.info("Supervising job {} for session {}/{}", jobName, namespace, sessionName);
        }
    }

    /**
     * One supervision round.
     *
     * @return {@code true} when supervision is over
     */
    boolean poll(ClusterClients clients, String namespace, String sessionName, String jobName, Instant started) {
        MdcContext.setSession(namespace, sessionName);
        try {
            if (clients.sessions().find(namespace, sessionName).isEmpty()) {
                log.info("Session {}/{} no longer exists, ending supervision of {}", namespace, sessionName, jobName);
                return true;
            }
            Optional<V1Job> job = clients.workloads().findJob(namespace, jobName);
            if (job.isEmpty()) {
                log.info("Job {}/{} not found, ending supervision", namespace, jobName);
                return true;
            }
            V1JobStatus status = job.get().getStatus();
            int succeeded = status == null || status.getSucceeded() == null ? 0 : status.getSucceeded();
            int failed = status == null || status.getFailed() == null ? 0 : status.getFailed();

            if (succeeded > 0) {
                log.info("Job {} completed successfully", jobName);
                finish(clients, namespace, sessionName, SessionPhase.COMPLETED, "Job completed successfully");
                metrics.recordSupervisedJob(Duration.between(started, clock.instant()), "completed");
                return true;
            }
            if (failed >= retryLimit(job.get())) {
                log.info("Job {} failed after {} attempts", jobName, failed);
                finish(clients, namespace, sessionName, SessionPhase.FAILED,
                        failureMessage(clients, namespace, jobName));
                metrics.recordSupervisedJob(Duration.between(started, clock.instant()), "failed");
                return true;
            }
            return false;
        } catch (SessionStateException e) {
            log.info("Session {}/{} left Running before its job finished ({}), ending supervision",
                    namespace, sessionName, e.getCurrent());
            return true;
        } catch (ClusterException e) {
            log.warn("Supervision poll for {}/{} failed: {}", namespace, sessionName, e.getMessage());
            return false;
        } finally {
            MdcContext.clear();
        }
    }

    private void finish(ClusterClients clients, String namespace, String sessionName,
                        SessionPhase phase, String message) {
        String now = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
        statusWriter.transition(clients.sessions(), namespace, sessionName, phase, message,
                s -> s.withCompletionTime(now));
    }

    private int retryLimit(V1Job job) {
        Integer limit = job.getSpec() == null ? null : job.getSpec().getBackoffLimit();
        return limit != null ? limit : properties.getOperator().getJobBackoffLimit();
    }

    /** {@code Job failed: <log>} capped at the configured length, with a truncation marker. */
    String failureMessage(ClusterClients clients, String namespace, String jobName) {
        Optional<String> logs;
        try {
            logs = clients.workloads().firstPodLog(namespace, jobName, logByteLimit());
        } catch (ClusterException e) {
            log.warn("Could not read logs of failed job {}/{}: {}", namespace, jobName, e.getMessage());
            logs = Optional.empty();
        }
        if (logs.isEmpty()) {
            return "Job failed";
        }
        return truncate("Job failed: " + logs.get(), properties.getOperator().getFailureMessageLimit());
    }

    /** Enough bytes to fill the message limit even when every character takes four bytes in UTF-8. */
    int logByteLimit() {
        return properties.getOperator().getFailureMessageLimit() * 4;
    }

    static String truncate(String message, int limit) {
        if (message.length() <= limit) {
            return message;
        }
        return message.substring(0, limit) + TRUNCATION_MARKER;
    }
}

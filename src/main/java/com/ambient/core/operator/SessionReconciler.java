package com.ambient.core.operator;

import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.cluster.ClusterException;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.logging.MdcContext;
import com.ambient.core.metrics.AmbientMetrics;
import com.ambient.core.model.ProjectSettings;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPhase;
import com.ambient.core.session.SessionStateException;
import com.ambient.core.session.SessionStatusWriter;
import io.kubernetes.client.openapi.models.V1Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Turns a {@code Pending} session into exactly one job and hands it to the
 * {@link JobSupervisor}.
 */
@Component
public class SessionReconciler {

    private static final Logger log = LoggerFactory.getLogger(SessionReconciler.class);

    public enum Outcome {
        /** The session no longer exists. */
        GONE,
        /** The session is not {@code Pending}. */
        NOT_PENDING,
        /** The session's job already exists. */
        ALREADY_SCHEDULED,
        SCHEDULED,
        /** Job creation failed; the session is in {@code Error}. */
        FAILED
    }

    private final RunnerJobFactory jobFactory;
    private final JobSupervisor supervisor;
    private final SessionStatusWriter statusWriter;
    private final AmbientProperties properties;
    private final AmbientMetrics metrics;
    private final Clock clock;

    public SessionReconciler(RunnerJobFactory jobFactory, JobSupervisor supervisor,
                             SessionStatusWriter statusWriter, AmbientProperties properties,
                             AmbientMetrics metrics, Clock clock) {
        this.jobFactory = jobFactory;
        this.supervisor = supervisor;
        this.statusWriter = statusWriter;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Reconciles the session from a fresh read; the watch event payload is never trusted.
     */
    public Outcome reconcile(ClusterClients clients, String namespace, String name) {
        long startMs = System.currentTimeMillis();
        MdcContext.setSession(namespace, name);
        try {
            Optional<Session> fresh = statusWriter.initialize(clients.sessions(), namespace, name);
            if (fresh.isEmpty()) {
                log.debug("Session {}/{} no longer exists, skipping", namespace, name);
                return Outcome.GONE;
            }
            Session session = fresh.get();
            if (session.phase() != SessionPhase.PENDING) {
                return Outcome.NOT_PENDING;
            }

            String jobName = Session.jobNameFor(name);
            if (clients.workloads().findJob(namespace, jobName).isPresent()) {
                log.info("Job {} already exists for session {}/{}", jobName, namespace, name);
                return Outcome.ALREADY_SCHEDULED;
            }

            if (statusWriter.transition(clients.sessions(), namespace, name, SessionPhase.CREATING,
                    "Creating Kubernetes job", s -> s).isEmpty()) {
                return Outcome.GONE;
            }

            // an unbuildable job (e.g. an unparseable resource quantity) fails the session like a rejected one
            try {
                V1Job job = jobFactory.build(session, runnerSecretName(clients, namespace));
                clients.workloads().createJob(namespace, job);
            } catch (RuntimeException e) {
                log.error("Failed to create job {} for session {}/{}: {}", jobName, namespace, name, e.getMessage());
                metrics.recordJobCreation(false);
                statusWriter.transition(clients.sessions(), namespace, name, SessionPhase.ERROR,
                        JobSupervisor.truncate("Failed to create job: " + e.getMessage(),
                                properties.getOperator().getFailureMessageLimit()),
                        s -> s);
                return Outcome.FAILED;
            }
            metrics.recordJobCreation(true);
            log.info("Created job {} for session {}/{}", jobName, namespace, name);

            String now = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
            try {
                if (statusWriter.transition(clients.sessions(), namespace, name, SessionPhase.RUNNING,
                        "Job created and running", s -> s.withStartTime(now).withJobName(jobName)).isEmpty()) {
                    // the owner reference lets the cluster collect the job
                    return Outcome.GONE;
                }
            } catch (SessionStateException e) {
                log.info("Session {}/{} moved to {} while job {} was being created, deleting the job",
                        namespace, name, e.getCurrent(), jobName);
                deleteOrphanedJob(clients, namespace, jobName);
                return Outcome.NOT_PENDING;
            }
            supervisor.supervise(clients, namespace, name, jobName);
            return Outcome.SCHEDULED;
        } catch (SessionStateException e) {
            log.info("Session {}/{} changed phase during reconcile ({}), leaving it", namespace, name, e.getCurrent());
            return Outcome.NOT_PENDING;
        } finally {
            metrics.recordReconcileDuration(System.currentTimeMillis() - startMs);
            MdcContext.clear();
        }
    }

    /**
     * Resumes supervision of a session found {@code Running} with its job still present, as
     * after a controller restart.
     */
    public boolean resume(ClusterClients clients, Session session) {
        if (session.phase() != SessionPhase.RUNNING) {
            return false;
        }
        String jobName = session.status().jobName() != null
                ? session.status().jobName() : Session.jobNameFor(session.name());
        if (clients.workloads().findJob(session.namespace(), jobName).isEmpty()) {
            return false;
        }
        supervisor.supervise(clients, session.namespace(), session.name(), jobName);
        return true;
    }

    private static void deleteOrphanedJob(ClusterClients clients, String namespace, String jobName) {
        try {
            clients.workloads().deleteJob(namespace, jobName);
        } catch (NotFoundException e) {
            log.debug("Job {}/{} already gone", namespace, jobName);
        } catch (ClusterException e) {
            log.warn("Failed to delete job {}/{} of a stopped session: {}", namespace, jobName, e.getMessage());
        }
    }

    private static String runnerSecretName(ClusterClients clients, String namespace) {
        return clients.projectSettings().find(namespace, ProjectSettings.SINGLETON_NAME)
                .map(ProjectSettings::runnerSecretsName)
                .orElse(null);
    }
}

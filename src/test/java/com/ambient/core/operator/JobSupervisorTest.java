package com.ambient.core.operator;

import com.ambient.core.cluster.ClusterException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.metrics.AmbientMetrics;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPhase;
import com.ambient.core.session.SessionStatusWriter;
import com.ambient.support.ClusterMocks;
import com.ambient.support.Fixtures;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobSpec;
import io.kubernetes.client.openapi.models.V1JobStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class JobSupervisorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private ClusterMocks cluster;
    private SupervisionRegistry registry;
    private SimpleMeterRegistry meters;
    private AmbientProperties properties;
    private JobSupervisor supervisor;

    @BeforeEach
    void setUp() {
        cluster = new ClusterMocks();
        registry = mock(SupervisionRegistry.class);
        meters = new SimpleMeterRegistry();
        properties = new AmbientProperties();
        AmbientMetrics metrics = new AmbientMetrics(meters);
        supervisor = new JobSupervisor(registry, new SessionStatusWriter(metrics), properties, metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(cluster.sessions.replaceStatus(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    private static V1Job job(Integer succeeded, Integer failed, Integer backoffLimit) {
        return new V1Job()
                .spec(new V1JobSpec().backoffLimit(backoffLimit))
                .status(new V1JobStatus().succeeded(succeeded).failed(failed));
    }

    private boolean poll() {
        return supervisor.poll(cluster.clients(), "team-a", "s1", "s1-job", NOW.minusSeconds(30));
    }

    private Session written() {
        ArgumentCaptor<Session> captor = ArgumentCaptor.forClass(Session.class);
        verify(cluster.sessions).replaceStatus(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("supervise registers a poll at the configured interval")
    void superviseSchedules() {
        when(registry.schedule(eq("team-a"), eq("s1"), anyLong(), any())).thenReturn(true);

        supervisor.supervise(cluster.clients(), "team-a", "s1", "s1-job");

        verify(registry).schedule(eq("team-a"), eq("s1"), eq(10L), any());
    }

    @Nested
    @DisplayName("poll")
    class Poll {

        @Test
        @DisplayName("ends when the session is gone")
        void sessionGone() {
            assertTrue(poll());
            verify(cluster.workloads, never()).findJob(any(), any());
        }

        @Test
        @DisplayName("ends when the job is gone")
        void jobGone() {
            cluster.givenSession(Fixtures.session("team-a", "s1", SessionPhase.RUNNING));

            assertTrue(poll());
            verify(cluster.sessions, never()).replaceStatus(any());
        }

        @Test
        @DisplayName("keeps going while the job is active")
        void stillActive() {
            cluster.givenSession(Fixtures.session("team-a", "s1", SessionPhase.RUNNING));
            when(cluster.workloads.findJob("team-a", "s1-job")).thenReturn(Optional.of(job(null, 1, 3)));

            assertFalse(poll());
            verify(cluster.sessions, never()).replaceStatus(any());
        }

        @Test
        @DisplayName("marks the session Completed on success")
        void completes() {
            cluster.givenSession(Fixtures.session("team-a", "s1", SessionPhase.RUNNING));
            when(cluster.workloads.findJob("team-a", "s1-job")).thenReturn(Optional.of(job(1, null, 3)));

            assertTrue(poll());

            Session session = written();
            assertEquals(SessionPhase.COMPLETED, session.phase());
            assertEquals("Job completed successfully", session.status().message());
            assertEquals("2025-03-01T12:00:00Z", session.status().completionTime());
            assertEquals(1L, meters.get("ambient.jobs.duration").tag("outcome", "completed").timer().count());
        }

        @Test
        @DisplayName("marks the session Failed with the pod log once retries are spent")
        void failsWithLogs() {
            cluster.givenSession(Fixtures.session("team-a", "s1", SessionPhase.RUNNING));
            when(cluster.workloads.findJob("team-a", "s1-job")).thenReturn(Optional.of(job(null, 2, 2)));
            when(cluster.workloads.firstPodLog("team-a", "s1-job", 2000)).thenReturn(Optional.of("boom"));

            assertTrue(poll());

            Session session = written();
            assertEquals(SessionPhase.FAILED, session.phase());
            assertEquals("Job failed: boom", session.status().message());
        }

        @Test
        @DisplayName("falls back to the configured retry budget when the job carries none")
        void configuredBudget() {
            cluster.givenSession(Fixtures.session("team-a", "s1", SessionPhase.RUNNING));
            when(cluster.workloads.findJob("team-a", "s1-job")).thenReturn(Optional.of(job(null, 2, null)));

            assertFalse(poll());
        }

        @Test
        @DisplayName("a transient cluster error is retried next round")
        void transientError() {
            cluster.givenSession(Fixtures.session("team-a", "s1", SessionPhase.RUNNING));
            when(cluster.workloads.findJob("team-a", "s1-job")).thenThrow(new ClusterException("timeout", 503));

            assertFalse(poll());
        }

        @Test
        @DisplayName("ends when the session already left Running")
        void sessionStopped() {
            cluster.givenSession(Fixtures.session("team-a", "s1", SessionPhase.STOPPED));
            when(cluster.workloads.findJob("team-a", "s1-job")).thenReturn(Optional.of(job(1, null, 3)));

            assertTrue(poll());
            verify(cluster.sessions, never()).replaceStatus(any());
        }
    }

    @Nested
    @DisplayName("failure message")
    class FailureMessage {

        @Test
        @DisplayName("without logs it is the bare prefix")
        void noLogs() {
            assertEquals("Job failed", supervisor.failureMessage(cluster.clients(), "team-a", "s1-job"));
        }

        @Test
        @DisplayName("unreadable logs are tolerated")
        void unreadableLogs() {
            when(cluster.workloads.firstPodLog("team-a", "s1-job", 2000)).thenThrow(new ClusterException("forbidden", 403));

            assertEquals("Job failed", supervisor.failureMessage(cluster.clients(), "team-a", "s1-job"));
        }

        @Test
        @DisplayName("long logs are cut at the limit and marked")
        void truncates() {
            when(cluster.workloads.firstPodLog("team-a", "s1-job", 2000)).thenReturn(Optional.of("x".repeat(2000)));

            String message = supervisor.failureMessage(cluster.clients(), "team-a", "s1-job");

            assertEquals(503, message.length());
            assertTrue(message.startsWith("Job failed: xxx"));
            assertTrue(message.endsWith("..."));
        }

        @Test
        @DisplayName("reads only as much log as the message can hold")
        void boundedRead() {
            properties.getOperator().setFailureMessageLimit(100);

            supervisor.failureMessage(cluster.clients(), "team-a", "s1-job");

            verify(cluster.workloads).firstPodLog("team-a", "s1-job", 400);
        }

        @Test
        @DisplayName("short messages pass through")
        void shortPassesThrough() {
            assertEquals("abc", JobSupervisor.truncate("abc", 500));
        }
    }
}

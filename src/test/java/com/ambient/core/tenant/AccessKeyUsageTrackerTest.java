package com.ambient.core.tenant;

import com.ambient.core.cluster.ClusterClientFactory;
import com.ambient.core.resource.MetadataKeys;
import com.ambient.support.ClusterMocks;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1ServiceAccount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AccessKeyUsageTrackerTest {

    private ClusterMocks serviceCluster;
    private AccessKeyUsageTracker tracker;

    @BeforeEach
    void setUp() {
        serviceCluster = new ClusterMocks();
        ClusterClientFactory factory = mock(ClusterClientFactory.class);
        when(factory.serviceIdentity()).thenReturn(serviceCluster.clients());
        tracker = new AccessKeyUsageTracker(factory,
                Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
    }

    private static String jwt(String sub) {
        Base64.Encoder enc = Base64.getUrlEncoder().withoutPadding();
        String header = enc.encodeToString("{\"alg\":\"RS256\"}".getBytes(StandardCharsets.UTF_8));
        String payload = enc.encodeToString(("{\"sub\":\"" + sub + "\"}").getBytes(StandardCharsets.UTF_8));
        return header + "." + payload + ".sig";
    }

    @Test
    @DisplayName("decodes the service account from the token subject")
    void decodesSubject() {
        var ref = tracker.serviceAccountOf(jwt("system:serviceaccount:team-a:ambient-key-ci-1")).orElseThrow();

        assertEquals("team-a", ref.namespace());
        assertEquals("ambient-key-ci-1", ref.name());
    }

    @Test
    @DisplayName("ignores user tokens and opaque strings")
    void ignoresOthers() {
        assertTrue(tracker.serviceAccountOf(jwt("alice")).isEmpty());
        assertTrue(tracker.serviceAccountOf("sha256~opaque").isEmpty());
        assertTrue(tracker.serviceAccountOf("a.!!!.c").isEmpty());
        assertTrue(tracker.serviceAccountOf(null).isEmpty());
    }

    @Test
    @DisplayName("stamps the last-used time on an access key")
    void stampsAccessKey() {
        var account = new V1ServiceAccount().metadata(new V1ObjectMeta().name("ambient-key-ci-1")
                .labels(Map.of("app", "ambient-access-key")));
        when(serviceCluster.rbac.findServiceAccount("team-a", "ambient-key-ci-1")).thenReturn(Optional.of(account));

        tracker.touch(new AccessKeyUsageTracker.ServiceAccountRef("team-a", "ambient-key-ci-1"));

        var captor = ArgumentCaptor.forClass(V1ServiceAccount.class);
        verify(serviceCluster.rbac).replaceServiceAccount(eq("team-a"), captor.capture());
        assertEquals("2023-11-14T22:13:20Z",
                captor.getValue().getMetadata().getAnnotations().get(MetadataKeys.KEY_LAST_USED_ANNOTATION));
    }

    @Test
    @DisplayName("leaves accounts that are not access keys alone")
    void skipsOtherAccounts() {
        var account = new V1ServiceAccount().metadata(new V1ObjectMeta().name("ambient-session-s1")
                .labels(Map.of("app", "ambient-runner")));
        when(serviceCluster.rbac.findServiceAccount("team-a", "ambient-session-s1")).thenReturn(Optional.of(account));

        tracker.touch(new AccessKeyUsageTracker.ServiceAccountRef("team-a", "ambient-session-s1"));

        verify(serviceCluster.rbac, never()).replaceServiceAccount(any(), any());
    }

    @Test
    @DisplayName("update failures are swallowed after logging")
    void failureIsTolerated() {
        when(serviceCluster.rbac.findServiceAccount(any(), any())).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> tracker.touch(new AccessKeyUsageTracker.ServiceAccountRef("team-a", "k")));
    }
}

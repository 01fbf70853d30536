package com.ambient.core.operator;

import com.ambient.core.cluster.WatchEvent;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.model.ProjectSettings;
import com.ambient.support.ClusterMocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ProjectSettingsWatcherTest {

    private ClusterMocks cluster;
    private ProjectSettingsReconciler reconciler;
    private ProjectSettingsWatcher watcher;

    @BeforeEach
    void setUp() {
        cluster = new ClusterMocks();
        reconciler = mock(ProjectSettingsReconciler.class);
        when(reconciler.reconcile(any(), any(), any())).thenReturn(Optional.of(0));
        AmbientProperties properties = new AmbientProperties();
        properties.getOperator().setEventSettleDelayMs(0);
        watcher = new ProjectSettingsWatcher(reconciler, properties);
    }

    @Test
    void reconcilesAddedAndModified() {
        watcher.handle(cluster.clients(), new WatchEvent<>(WatchEvent.Type.ADDED, ProjectSettings.defaults("team-a")));
        watcher.handle(cluster.clients(), new WatchEvent<>(WatchEvent.Type.MODIFIED, ProjectSettings.defaults("team-a")));

        verify(reconciler, times(2)).reconcile(any(), eq("team-a"), eq("projectsettings"));
    }

    @Test
    void ignoresDeletion() {
        watcher.handle(cluster.clients(), new WatchEvent<>(WatchEvent.Type.DELETED, ProjectSettings.defaults("team-a")));

        verifyNoInteractions(reconciler);
    }
}

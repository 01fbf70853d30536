package com.ambient.core.operator;

import com.ambient.core.cluster.ClusterClientFactory;
import com.ambient.core.cluster.ClusterClients;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.metrics.AmbientMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Starts the controller's three watch loops once the application is ready. Active only when
 * {@code ambient.mode=operator}.
 */
@Component
@ConditionalOnProperty(name = "ambient.mode", havingValue = "operator")
public class OperatorRunner {

    private static final Logger log = LoggerFactory.getLogger(OperatorRunner.class);

    private final ClusterClientFactory clientFactory;
    private final SessionWatcher sessionWatcher;
    private final NamespaceWatcher namespaceWatcher;
    private final ProjectSettingsWatcher settingsWatcher;
    private final SupervisionRegistry registry;
    private final AmbientProperties properties;
    private final AmbientMetrics metrics;

    private final List<ResubscribingWatchLoop<?>> loops = new ArrayList<>();

    public OperatorRunner(ClusterClientFactory clientFactory, SessionWatcher sessionWatcher,
                          NamespaceWatcher namespaceWatcher, ProjectSettingsWatcher settingsWatcher,
                          SupervisionRegistry registry, AmbientProperties properties, AmbientMetrics metrics) {
        this.clientFactory = clientFactory;
        this.sessionWatcher = sessionWatcher;
        this.namespaceWatcher = namespaceWatcher;
        this.settingsWatcher = settingsWatcher;
        this.registry = registry;
        this.properties = properties;
        this.metrics = metrics;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!loops.isEmpty()) {
            return;
        }
        ClusterClients clients = clientFactory.serviceIdentity();
        long retry = properties.getOperator().getWatchRetryDelayMs();
        long restart = properties.getOperator().getWatchRestartDelayMs();

        launch(new ResubscribingWatchLoop<>("AgenticSession", () -> clients.sessions().watch(),
                event -> sessionWatcher.handle(clients, event), retry, restart, metrics));
        launch(new ResubscribingWatchLoop<>("Namespace", () -> clients.namespaces().watchManaged(),
                event -> namespaceWatcher.handle(clients, event), retry, restart, metrics));
        launch(new ResubscribingWatchLoop<>("ProjectSettings", () -> clients.projectSettings().watch(),
                event -> settingsWatcher.handle(clients, event), retry, restart, metrics));

        log.info("Agentic session controller started; runner image {}", properties.getOperator().getRunnerImage());
    }

    @PreDestroy
    public synchronized void stop() {
        loops.forEach(ResubscribingWatchLoop::stop);
        loops.clear();
        registry.cancelAll();
        log.info("Agentic session controller stopped");
    }

    int loopCount() {
        return loops.size();
    }

    private void launch(ResubscribingWatchLoop<?> loop) {
        loops.add(loop);
        Thread thread = new Thread(loop, "watch-" + (loops.size()));
        thread.setDaemon(true);
        thread.start();
    }
}

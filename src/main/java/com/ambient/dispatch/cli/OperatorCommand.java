package com.ambient.dispatch.cli;

import com.ambient.core.config.AmbientProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: ambient operator
 * <p>
 * Runs the reconciliation controller. Its watch loops are started by
 * {@link com.ambient.core.operator.OperatorRunner}; the embedded server only carries the
 * actuator endpoints.
 */
@Command(name = "operator", mixinStandardHelpOptions = true,
        description = "Run the agentic session controller")
@Component
public class OperatorCommand implements Runnable {

    private final AmbientProperties properties;

    @Value("${server.port:8080}")
    private int port;

    public OperatorCommand(AmbientProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        printBanner(port, properties.getOperator().getRunnerImage());
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        if ("operator".equals(properties.getMode())) {
            printBanner(event.getWebServer().getPort(), properties.getOperator().getRunnerImage());
        }
    }

    private static void printBanner(int port, String runnerImage) {
        ConsoleOutput.modeStarted("Ambient controller", port,
                "Runner:   " + runnerImage,
                "Metrics:  http://localhost:{port}/actuator/prometheus");
    }
}

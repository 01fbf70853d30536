package com.ambient.dispatch.cli;

import com.ambient.core.config.AmbientProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: ambient content
 * <p>
 * Serves one tenant's workspace volume over {@code /content}. Tenant bootstrap deploys the
 * image with {@code CONTENT_SERVICE_MODE=true}, which selects this mode without arguments.
 */
@Command(name = "content", mixinStandardHelpOptions = true,
        description = "Serve a tenant workspace volume over HTTP")
@Component
public class ContentCommand implements Runnable {

    private final AmbientProperties properties;

    @Value("${server.port:8080}")
    private int port;

    public ContentCommand(AmbientProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        printBanner(port, properties.getContent().getStateBaseDir());
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        if ("content".equals(properties.getMode())) {
            printBanner(event.getWebServer().getPort(), properties.getContent().getStateBaseDir());
        }
    }

    private static void printBanner(int port, String stateDir) {
        ConsoleOutput.modeStarted("Ambient content service", port,
                "Root:     " + stateDir,
                "Content:  http://localhost:{port}/content/list?path=/");
    }
}

package com.ambient.dispatch.cli;

import com.ambient.core.config.AmbientProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: ambient serve
 * <p>
 * Starts the session lifecycle API. The web server is enabled by
 * {@link com.ambient.AmbientApplication#main} detecting the mode in args; {@link CliRunner}
 * then skips picocli and the banner is printed once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 ambient serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the session lifecycle API server")
@Component
public class ServeCommand implements Runnable {

    private final AmbientProperties properties;

    @Value("${server.port:8080}")
    private int port;

    public ServeCommand(AmbientProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        if ("serve".equals(properties.getMode())) {
            printBanner(event.getWebServer().getPort());
        }
    }

    private static void printBanner(int port) {
        ConsoleOutput.modeStarted("Ambient API server", port,
                "API:      http://localhost:{port}/api/projects",
                "Health:   http://localhost:{port}/actuator/health");
    }
}

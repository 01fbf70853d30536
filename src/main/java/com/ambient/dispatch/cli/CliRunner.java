package com.ambient.dispatch.cli;

import com.ambient.AmbientApplication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle. Long-running modes are served by the
 * embedded web server and skip picocli entirely.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AmbientCommand ambientCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AmbientCommand ambientCommand, IFactory factory) {
        this.ambientCommand = ambientCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // picocli's execute() would return at once and let main() exit before Tomcat is ready
        if (AmbientApplication.serverMode(args) != null) {
            return;
        }
        exitCode = new CommandLine(ambientCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

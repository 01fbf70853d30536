package com.ambient.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. The three long-running modes share one binary:
 * {@code serve} (the lifecycle API), {@code operator} (the reconciliation controller) and
 * {@code content} (the per-tenant content service).
 */
@Command(
        name = "ambient",
        mixinStandardHelpOptions = true,
        version = "Ambient 0.1.0",
        description = "Multi-tenant agentic session platform for Kubernetes",
        subcommands = {
                ServeCommand.class,
                OperatorCommand.class,
                ContentCommand.class,
                AgentsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AmbientCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

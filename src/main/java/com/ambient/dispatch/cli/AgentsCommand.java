package com.ambient.dispatch.cli;

import com.ambient.core.agents.AgentCatalog;
import com.ambient.core.agents.AgentSummary;
import com.ambient.core.cluster.NotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: ambient agents [persona]
 * <p>
 * Lists the persona catalog, or prints one persona's rendered agent markdown.
 */
@Command(name = "agents", mixinStandardHelpOptions = true,
        description = "List agent personas or render one as markdown")
@Component
public class AgentsCommand implements Runnable {

    private final AgentCatalog catalog;

    @Parameters(index = "0", arity = "0..1", description = "Persona to render")
    private String persona;

    public AgentsCommand(AgentCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        if (persona != null) {
            try {
                System.out.print(catalog.renderMarkdown(persona));
            } catch (NotFoundException e) {
                ConsoleOutput.error(e.getMessage());
            }
            return;
        }
        ConsoleOutput.printBanner();
        List<AgentSummary> agents = catalog.summaries();
        if (agents.isEmpty()) {
            ConsoleOutput.info("No agent personas found.");
            return;
        }
        for (AgentSummary agent : agents) {
            ConsoleOutput.persona(agent.persona(), agent.name(), agent.role());
        }
    }
}

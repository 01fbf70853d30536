package com.ambient.dispatch.cli;

import com.ambient.AmbientApplication;
import com.ambient.core.agents.AgentCatalog;
import com.ambient.core.agents.AgentSummary;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.config.AmbientProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private CommandLine.IFactory createFactory(AgentCatalog catalog, AmbientProperties properties) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AgentsCommand.class) {
                    return (K) new AgentsCommand(catalog);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand(properties);
                }
                if (cls == OperatorCommand.class) {
                    return (K) new OperatorCommand(properties);
                }
                if (cls == ContentCommand.class) {
                    return (K) new ContentCommand(properties);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(AgentCatalog catalog, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AmbientCommand(),
                    createFactory(catalog, new AmbientProperties()));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult execute(String... args) {
        return execute(mock(AgentCatalog.class), args);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every mode and command")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("serve"), "Help should list 'serve'");
            assertTrue(output.contains("operator"), "Help should list 'operator'");
            assertTrue(output.contains("content"), "Help should list 'content'");
            assertTrue(output.contains("agents"), "Help should list 'agents'");
            assertTrue(output.contains("help"), "Help should list 'help'");
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Ambient 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints the banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("AMBIENT v0.1.0"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("an unknown command fails")
        void unknownCommand() {
            assertNotEquals(0, execute("launch").exitCode());
        }
    }

    @Nested
    @DisplayName("agents")
    class AgentsTests {

        @Test
        @DisplayName("lists personas with name and role")
        void listsPersonas() {
            AgentCatalog catalog = mock(AgentCatalog.class);
            when(catalog.summaries()).thenReturn(List.of(
                    new AgentSummary("archie", "Archie", "Architect", List.of()),
                    new AgentSummary("stella", "Stella", "Staff Engineer", List.of())));

            CliResult result = execute(catalog, "agents");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("archie"));
            assertTrue(result.output().contains("Stella (Staff Engineer)"));
        }

        @Test
        @DisplayName("an empty catalog says so")
        void emptyCatalog() {
            AgentCatalog catalog = mock(AgentCatalog.class);
            when(catalog.summaries()).thenReturn(List.of());

            assertTrue(execute(catalog, "agents").output().contains("No agent personas found."));
        }

        @Test
        @DisplayName("renders one persona's markdown")
        void rendersPersona() {
            AgentCatalog catalog = mock(AgentCatalog.class);
            when(catalog.renderMarkdown("archie")).thenReturn("---\nname: Archie\n---\n");

            CliResult result = execute(catalog, "agents", "archie");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("name: Archie"));
        }

        @Test
        @DisplayName("an unknown persona is reported")
        void unknownPersona() {
            AgentCatalog catalog = mock(AgentCatalog.class);
            when(catalog.renderMarkdown("nobody")).thenThrow(new NotFoundException("Agent nobody not found"));

            assertTrue(execute(catalog, "agents", "nobody").output().contains("Agent nobody not found"));
        }
    }

    @Nested
    @DisplayName("Server modes")
    class ModeTests {

        @Test
        @DisplayName("the first argument selects a long-running mode")
        void serverModes() {
            assertEquals("serve", AmbientApplication.serverMode("serve"));
            assertEquals("operator", AmbientApplication.serverMode("operator", "--debug"));
            assertEquals("content", AmbientApplication.serverMode("content"));
        }

        @Test
        @DisplayName("CLI commands are not server modes")
        void cliCommands() {
            assertNull(AmbientApplication.serverMode());
            assertNull(AmbientApplication.serverMode("agents"));
            assertNull(AmbientApplication.serverMode("agents", "serve"));
        }
    }
}

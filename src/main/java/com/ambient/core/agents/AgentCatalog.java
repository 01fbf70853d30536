package com.ambient.core.agents;

import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.config.AmbientProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Persona definitions loaded from YAML files in the configured agents directory, and their
 * rendering as agent markdown with YAML front matter.
 */
@Service
public class AgentCatalog {

    private static final Logger log = LoggerFactory.getLogger(AgentCatalog.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    static final String DEFAULT_TOOLS = "Read, Write, Edit, Bash, Glob, Grep, WebSearch";

    private final AmbientProperties properties;

    public AgentCatalog(AmbientProperties properties) {
        this.properties = properties;
    }

    /**
     * Reads every {@code *.yaml} persona definition. Files that cannot be parsed or carry no
     * persona are skipped with a warning.
     */
    public List<AgentDefinition> definitions() {
        Path dir = Path.of(properties.getAgents().getDir());
        List<AgentDefinition> result = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.sorted(Comparator.comparing(Path::getFileName)).toList()) {
                String fileName = file.getFileName().toString();
                if (Files.isDirectory(file) || !fileName.endsWith(".yaml")
                        || fileName.startsWith("agent-schema") || fileName.equals("README.yaml")) {
                    continue;
                }
                try {
                    AgentDefinition definition = YAML.readValue(file.toFile(), AgentDefinition.class);
                    if (definition != null && definition.persona() != null && !definition.persona().isBlank()) {
                        result.add(definition);
                    }
                } catch (IOException e) {
                    log.warn("Skipping unreadable agent definition {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read agents from " + dir, e);
        }
        return result;
    }

    public List<AgentSummary> summaries() {
        return definitions().stream().map(AgentSummary::of).toList();
    }

    public Optional<AgentDefinition> find(String persona) {
        if (persona == null || persona.isBlank()) {
            return Optional.empty();
        }
        return definitions().stream()
                .filter(d -> d.persona().equalsIgnoreCase(persona.trim()))
                .findFirst();
    }

    /**
     * @throws NotFoundException if no definition has the given persona
     */
    public String renderMarkdown(String persona) {
        AgentDefinition agent = find(persona)
                .orElseThrow(() -> new NotFoundException("persona not found"));
        return render(agent);
    }

    static String render(AgentDefinition agent) {
        String prettyPersona = titleCase(agent.persona());
        String displayName = agent.name() == null || agent.name().isBlank() ? prettyPersona : agent.name();

        var sb = new StringBuilder();
        sb.append("---\n");
        sb.append("name: ").append(displayName).append(" (").append(prettyPersona).append(")\n");
        sb.append("description: ").append(describe(agent, displayName)).append("\n");
        sb.append("tools: ").append(DEFAULT_TOOLS).append("\n");
        sb.append("---\n\n");

        sb.append("# ").append(agent.name() == null ? "" : agent.name())
                .append(" (").append(agent.persona()).append(")\n\n");
        if (agent.role() != null && !agent.role().isEmpty()) {
            sb.append("- Role: ").append(agent.role()).append("\n");
        }
        if (!agent.expertiseOrEmpty().isEmpty()) {
            sb.append("- Expertise:\n");
            for (String item : agent.expertiseOrEmpty()) {
                sb.append("  - ").append(item).append("\n");
            }
        }
        if (agent.systemMessage() != null && !agent.systemMessage().isEmpty()) {
            sb.append("\n## System message\n\n").append(agent.systemMessage()).append("\n");
        }
        return sb.toString();
    }

    private static String describe(AgentDefinition agent, String displayName) {
        if (!agent.expertiseOrEmpty().isEmpty()) {
            return displayName + " Agent focused on " + String.join(", ", agent.expertiseOrEmpty()) + ".";
        }
        if (agent.role() != null && !agent.role().isBlank()) {
            return displayName + " Agent focused on " + agent.role() + ".";
        }
        if (agent.systemMessage() != null && !agent.systemMessage().isBlank()) {
            return agent.systemMessage().trim().split("\n", 2)[0];
        }
        return displayName + " Agent.";
    }

    /** {@code ENGINEERING_MANAGER} or {@code engineering manager} to {@code Engineering Manager}. */
    static String titleCase(String value) {
        String words = value.trim().toLowerCase(Locale.ROOT).replace('_', ' ');
        return Arrays.stream(words.split("\\s+"))
                .filter(w -> !w.isEmpty())
                .map(w -> Character.toUpperCase(w.charAt(0)) + w.substring(1))
                .collect(Collectors.joining(" "));
    }
}

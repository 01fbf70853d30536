package com.ambient.core.agents;

import com.ambient.core.content.ContentServiceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes rendered persona markdown into a workspace so agent definitions are visible as soon as
 * a session or workflow exists. Best-effort: each failure is logged and skipped.
 */
@Service
public class PersonaSeeder {

    private static final Logger log = LoggerFactory.getLogger(PersonaSeeder.class);

    public static final String PERSONAS_VARIABLE = "AGENT_PERSONAS";
    public static final String PERSONA_VARIABLE = "AGENT_PERSONA";

    private final AgentCatalog catalog;
    private final ContentServiceClient content;

    public PersonaSeeder(AgentCatalog catalog, ContentServiceClient content) {
        this.catalog = catalog;
        this.content = content;
    }

    /**
     * Personas requested through a session's environment variables: {@value #PERSONAS_VARIABLE}
     * (comma separated) or, failing that, {@value #PERSONA_VARIABLE}.
     */
    public static List<String> requestedPersonas(Map<String, String> environment) {
        if (environment == null) {
            return List.of();
        }
        String csv = environment.get(PERSONAS_VARIABLE);
        if (csv == null || csv.isBlank()) {
            csv = environment.get(PERSONA_VARIABLE);
        }
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    /**
     * Renders each persona to {@code {workspaceRoot}/.claude/agents/{persona}.md}.
     *
     * @return number of personas written
     */
    public int seed(String namespace, String token, String workspaceRoot, Collection<String> personas) {
        int written = 0;
        for (String persona : personas) {
            String path = workspaceRoot + "/.claude/agents/" + persona + ".md";
            try {
                content.write(namespace, token, path, catalog.renderMarkdown(persona));
                written++;
            } catch (RuntimeException e) {
                log.warn("Persona seeding skipped {} in {}: {}", persona, namespace, e.getMessage());
            }
        }
        return written;
    }
}

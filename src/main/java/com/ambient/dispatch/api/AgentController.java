package com.ambient.dispatch.api;

import com.ambient.core.agents.AgentCatalog;
import com.ambient.core.agents.AgentSummary;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectName}/agents")
@ConditionalOnProperty(name = "ambient.mode", havingValue = "serve", matchIfMissing = true)
public class AgentController {

    private final AgentCatalog catalog;

    public AgentController(AgentCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<AgentSummary> list(@PathVariable String projectName) {
        return catalog.summaries();
    }

    @GetMapping("/{persona}/markdown")
    public ResponseEntity<String> markdown(@PathVariable String projectName, @PathVariable String persona) {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_MARKDOWN)
                .body(catalog.renderMarkdown(persona));
    }
}

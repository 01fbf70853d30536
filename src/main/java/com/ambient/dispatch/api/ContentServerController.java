package com.ambient.dispatch.api;

import com.ambient.core.config.AmbientProperties;
import com.ambient.core.content.ContentEntry;
import com.ambient.core.content.LocalContentStore;
import com.ambient.core.model.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * The per-tenant content service: reads and writes files under the shared workspace volume.
 * Active only when {@code ambient.mode=content}.
 */
@RestController
@RequestMapping("/content")
@ConditionalOnProperty(name = "ambient.mode", havingValue = "content")
public class ContentServerController {

    private static final Logger log = LoggerFactory.getLogger(ContentServerController.class);

    private final LocalContentStore store;

    public ContentServerController(AmbientProperties properties) {
        this.store = new LocalContentStore(Path.of(properties.getContent().getStateBaseDir()));
    }

    @PostMapping("/write")
    public Map<String, String> write(@RequestBody WriteRequest request) {
        store.write(request.path(), decode(request));
        log.debug("Wrote {}", request.path());
        return Map.of("message", "ok");
    }

    @GetMapping("/file")
    public ResponseEntity<byte[]> file(@RequestParam(required = false) String path) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(store.read(path));
    }

    @GetMapping("/list")
    public Map<String, List<ContentEntry>> list(@RequestParam(required = false) String path) {
        return Map.of("items", store.list(path));
    }

    static byte[] decode(WriteRequest request) {
        String content = request.content() == null ? "" : request.content();
        String encoding = request.encoding() == null ? "utf8" : request.encoding();
        if (encoding.equalsIgnoreCase("base64")) {
            try {
                return Base64.getDecoder().decode(content);
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("invalid base64 content");
            }
        }
        return content.getBytes(StandardCharsets.UTF_8);
    }

    public record WriteRequest(String path, String content, String encoding) {
    }
}

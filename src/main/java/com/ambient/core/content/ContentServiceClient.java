package com.ambient.core.content;

import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.config.AmbientProperties;
import com.ambient.core.metrics.AmbientMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * HTTP client for the per-tenant content service.
 *
 * <p>Every call forwards the caller's own bearer token, so the content service sees the
 * same identity the API authorized. The API process never touches workspace files itself.
 */
@Service
public class ContentServiceClient {

    private static final Logger log = LoggerFactory.getLogger(ContentServiceClient.class);

    private final AmbientProperties properties;
    private final AmbientMetrics metrics;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ContentServiceClient(AmbientProperties properties, AmbientMetrics metrics) {
        this(properties, metrics, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getContent().getTimeoutSeconds()))
                .build());
    }

    ContentServiceClient(AmbientProperties properties, AmbientMetrics metrics, HttpClient httpClient) {
        this.properties = properties;
        this.metrics = metrics;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Writes {@code data} to {@code path} in the tenant's content root, creating parent
     * directories as needed.
     */
    public void write(String namespace, String token, String path, byte[] data) {
        String normalized = ContentPaths.normalize(path);
        ObjectNode body = objectMapper.createObjectNode();
        body.put("path", normalized);
        body.put("content", Base64.getEncoder().encodeToString(data));
        body.put("encoding", "base64");

        HttpRequest request = requestBuilder(namespace, token, "/content/write")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        HttpResponse<byte[]> response = send("write", request);
        expectSuccess("write", normalized, response);
        log.debug("Wrote {} bytes to {}:{}", data.length, namespace, normalized);
    }

    public void write(String namespace, String token, String path, String text) {
        write(namespace, token, path, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws NotFoundException if no file exists at {@code path}
     */
    public byte[] read(String namespace, String token, String path) {
        String normalized = ContentPaths.normalize(path);
        HttpRequest request = requestBuilder(namespace, token, "/content/file?path=" + encode(normalized))
                .GET()
                .build();
        HttpResponse<byte[]> response = send("read", request);
        expectSuccess("read", normalized, response);
        return response.body();
    }

    /**
     * Lists the directory at {@code path}. Listing a file yields that file's single entry.
     *
     * @throws NotFoundException if nothing exists at {@code path}
     */
    public List<ContentEntry> list(String namespace, String token, String path) {
        String normalized = ContentPaths.normalize(path);
        HttpRequest request = requestBuilder(namespace, token, "/content/list?path=" + encode(normalized))
                .GET()
                .build();
        HttpResponse<byte[]> response = send("list", request);
        expectSuccess("list", normalized, response);
        try {
            JsonNode root = objectMapper.readTree(response.body());
            List<ContentEntry> entries = new ArrayList<>();
            for (JsonNode item : root.path("items")) {
                entries.add(objectMapper.treeToValue(item, ContentEntry.class));
            }
            return entries;
        } catch (IOException e) {
            throw new ContentServiceException("Malformed listing from content service: " + e.getMessage(), e);
        }
    }

    private HttpRequest.Builder requestBuilder(String namespace, String token, String pathAndQuery) {
        String base = properties.getContent().serviceUrlFor(namespace);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(base + pathAndQuery))
                .timeout(Duration.ofSeconds(properties.getContent().getTimeoutSeconds()));
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private HttpResponse<byte[]> send(String operation, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            metrics.recordContentProxyCall(operation, false);
            throw new ContentServiceException("Content service " + operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordContentProxyCall(operation, false);
            throw new ContentServiceException("Interrupted during content service " + operation, e);
        }
    }

    private void expectSuccess(String operation, String path, HttpResponse<byte[]> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            metrics.recordContentProxyCall(operation, true);
            return;
        }
        metrics.recordContentProxyCall(operation, false);
        if (status == 404) {
            throw new NotFoundException("Content not found: " + path);
        }
        throw new ContentServiceException("Content service %s %s failed (HTTP %d)"
                .formatted(operation, path, status), status);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The subset of object metadata the orchestrator reads and writes.
 * <p>
 * {@code resourceVersion} is carried through every read-modify-write so the
 * store's optimistic concurrency rejects stale updates.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceMeta(
    String name,
    String namespace,
    String uid,
    String resourceVersion,
    String creationTimestamp,
    Map<String, String> labels,
    Map<String, String> annotations
) {

    public static ResourceMeta named(String namespace, String name) {
        return new ResourceMeta(name, namespace, null, null, null, Map.of(), Map.of());
    }

    public ResourceMeta withName(String newName) {
        return new ResourceMeta(newName, namespace, uid, resourceVersion, creationTimestamp, labels, annotations);
    }

    public ResourceMeta withLabels(Map<String, String> newLabels) {
        return new ResourceMeta(name, namespace, uid, resourceVersion, creationTimestamp, newLabels, annotations);
    }

    public ResourceMeta withAnnotations(Map<String, String> newAnnotations) {
        return new ResourceMeta(name, namespace, uid, resourceVersion, creationTimestamp, labels, newAnnotations);
    }

    public ResourceMeta withAnnotation(String key, String value) {
        var merged = new LinkedHashMap<String, String>();
        if (annotations != null) {
            merged.putAll(annotations);
        }
        merged.put(key, value);
        return withAnnotations(merged);
    }

    /** Copy suitable for creating a new object: server-assigned fields cleared. */
    public ResourceMeta forCreate(String targetNamespace, String targetName) {
        return new ResourceMeta(targetName, targetNamespace, null, null, null, labels, annotations);
    }

    public String annotation(String key) {
        return annotations == null ? null : annotations.get(key);
    }

    public String label(String key) {
        return labels == null ? null : labels.get(key);
    }
}

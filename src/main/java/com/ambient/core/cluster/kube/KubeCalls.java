package com.ambient.core.cluster.kube;

import com.ambient.core.cluster.AlreadyExistsException;
import com.ambient.core.cluster.ClusterException;
import com.ambient.core.cluster.ConflictException;
import com.ambient.core.cluster.ForbiddenException;
import com.ambient.core.cluster.NotFoundException;
import io.kubernetes.client.openapi.ApiException;

import java.util.Optional;

/**
 * Runs client-java calls and translates {@link ApiException} into the
 * {@link ClusterException} hierarchy. A 409 means "already exists" on create and
 * "stale resourceVersion" everywhere else.
 */
final class KubeCalls {

    private KubeCalls() {}

    @FunctionalInterface
    interface ApiCall<T> {
        T execute() throws ApiException;
    }

    static <T> T call(String what, ApiCall<T> call) {
        try {
            return call.execute();
        } catch (ApiException e) {
            throw translate(what, e, false);
        }
    }

    static <T> T create(String what, ApiCall<T> call) {
        try {
            return call.execute();
        } catch (ApiException e) {
            throw translate(what, e, true);
        }
    }

    static <T> Optional<T> find(String what, ApiCall<T> call) {
        try {
            return Optional.ofNullable(call.execute());
        } catch (ApiException e) {
            if (e.getCode() == 404) {
                return Optional.empty();
            }
            throw translate(what, e, false);
        }
    }

    static ClusterException translate(String what, ApiException e, boolean creating) {
        String detail = e.getResponseBody() != null && !e.getResponseBody().isBlank()
                ? e.getResponseBody() : e.getMessage();
        String message = "%s failed (HTTP %d): %s".formatted(what, e.getCode(), detail);
        return switch (e.getCode()) {
            case 404 -> new NotFoundException(message, e);
            case 403 -> new ForbiddenException(message, e);
            case 409 -> creating ? new AlreadyExistsException(message, e) : new ConflictException(message, e);
            default -> new ClusterException(message, e.getCode(), e);
        };
    }
}

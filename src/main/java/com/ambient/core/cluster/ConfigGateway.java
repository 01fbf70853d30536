package com.ambient.core.cluster;

import io.kubernetes.client.openapi.models.V1ConfigMap;
import io.kubernetes.client.openapi.models.V1Secret;

import java.util.List;
import java.util.Optional;

/**
 * Secrets and config maps within a namespace.
 */
public interface ConfigGateway {

    Optional<V1Secret> findSecret(String namespace, String name);

    List<V1Secret> listSecrets(String namespace);

    V1Secret createSecret(String namespace, V1Secret secret);

    V1Secret replaceSecret(String namespace, V1Secret secret);

    Optional<V1ConfigMap> findConfigMap(String namespace, String name);
}

package com.ambient.core.cluster.kube;

import com.ambient.core.cluster.ConfigGateway;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1SecretList;

import java.util.List;
import java.util.Optional;

final class KubeConfigGateway implements ConfigGateway {

    private final CoreV1Api core;

    KubeConfigGateway(ApiClient client) {
        this.core = new CoreV1Api(client);
    }

    @Override
    public Optional<V1Secret> findSecret(String namespace, String name) {
        return KubeCalls.find("get secret " + namespace + "/" + name,
                () -> core.readNamespacedSecret(name, namespace).execute());
    }

    @Override
    public List<V1Secret> listSecrets(String namespace) {
        V1SecretList list = KubeCalls.call("list secrets in " + namespace,
                () -> core.listNamespacedSecret(namespace).execute());
        return list == null ? List.of() : list.getItems();
    }

    @Override
    public V1Secret createSecret(String namespace, V1Secret secret) {
        return KubeCalls.create("create secret in " + namespace,
                () -> core.createNamespacedSecret(namespace, secret).execute());
    }

    @Override
    public V1Secret replaceSecret(String namespace, V1Secret secret) {
        String name = secret.getMetadata().getName();
        return KubeCalls.call("update secret " + namespace + "/" + name,
                () -> core.replaceNamespacedSecret(name, namespace, secret).execute());
    }

    @Override
    public Optional<V1ConfigMap> findConfigMap(String namespace, String name) {
        return KubeCalls.find("get config map " + namespace + "/" + name,
                () -> core.readNamespacedConfigMap(name, namespace).execute());
    }
}

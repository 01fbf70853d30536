package com.ambient.core.cluster.kube;

import com.ambient.core.cluster.NamespaceGateway;
import com.ambient.core.cluster.WatchStream;
import com.ambient.core.resource.MetadataKeys;
import com.google.gson.reflect.TypeToken;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1NamespaceList;
import io.kubernetes.client.util.Watch;
import okhttp3.Call;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

final class KubeNamespaceGateway implements NamespaceGateway {

    private final CoreV1Api core;
    private final ApiClient watchClient;

    KubeNamespaceGateway(ApiClient client, ApiClient watchClient) {
        this.core = new CoreV1Api(client);
        this.watchClient = watchClient;
    }

    @Override
    public List<V1Namespace> listManaged() {
        V1NamespaceList list = KubeCalls.call("list managed namespaces",
                () -> core.listNamespace().labelSelector(MetadataKeys.MANAGED_SELECTOR).execute());
        return list == null ? List.of() : list.getItems();
    }

    @Override
    public Optional<V1Namespace> find(String name) {
        return KubeCalls.find("get namespace " + name, () -> core.readNamespace(name).execute());
    }

    @Override
    public V1Namespace create(V1Namespace namespace) {
        return KubeCalls.create("create namespace " + namespace.getMetadata().getName(),
                () -> core.createNamespace(namespace).execute());
    }

    @Override
    public V1Namespace replace(V1Namespace namespace) {
        String name = namespace.getMetadata().getName();
        return KubeCalls.call("update namespace " + name, () -> core.replaceNamespace(name, namespace).execute());
    }

    @Override
    public void delete(String name) {
        KubeCalls.call("delete namespace " + name, () -> core.deleteNamespace(name).execute());
    }

    @Override
    public WatchStream<V1Namespace> watchManaged() {
        CoreV1Api watchApi = new CoreV1Api(watchClient);
        Watch<V1Namespace> watch = KubeCalls.call("watch managed namespaces", () -> {
            Call call = watchApi.listNamespace()
                    .labelSelector(MetadataKeys.MANAGED_SELECTOR)
                    .watch(true)
                    .buildCall(null);
            return Watch.createWatch(watchClient, call, new TypeToken<Watch.Response<V1Namespace>>() {}.getType());
        });
        return new KubeWatchStream<>(watch, Function.identity());
    }
}

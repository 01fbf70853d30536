package com.ambient.core.cluster.kube;

import com.ambient.core.cluster.ResourceStore;
import com.ambient.core.cluster.WatchStream;
import com.ambient.core.model.CustomResource;
import com.ambient.core.model.ResourceKind;
import com.ambient.core.resource.ResourceCodec;
import com.google.gson.reflect.TypeToken;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CustomObjectsApi;
import io.kubernetes.client.util.Watch;
import okhttp3.Call;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ResourceStore} over the custom-objects API. The generic map payloads of that
 * API are converted with {@link ResourceCodec} at this boundary and nowhere else.
 */
final class KubeResourceStore<T extends CustomResource> implements ResourceStore<T> {

    private final CustomObjectsApi api;
    private final ApiClient watchClient;
    private final ResourceKind kind;
    private final Class<T> type;
    private final ResourceCodec codec;

    KubeResourceStore(ApiClient client, ApiClient watchClient, ResourceKind kind, Class<T> type,
                      ResourceCodec codec) {
        this.api = new CustomObjectsApi(client);
        this.watchClient = watchClient;
        this.kind = kind;
        this.type = type;
        this.codec = codec;
    }

    @Override
    public Optional<T> find(String namespace, String name) {
        return KubeCalls.find("get " + describe(namespace, name),
                        () -> api.getNamespacedCustomObject(ResourceKind.GROUP, ResourceKind.VERSION,
                                namespace, kind.plural(), name).execute())
                .map(raw -> codec.decode(raw, type));
    }

    @Override
    public List<T> list(String namespace) {
        Object raw = KubeCalls.call("list " + kind.plural() + " in " + namespace,
                () -> api.listNamespacedCustomObject(ResourceKind.GROUP, ResourceKind.VERSION,
                        namespace, kind.plural()).execute());
        List<T> result = new ArrayList<>();
        if (raw instanceof Map<?, ?> map && map.get("items") instanceof List<?> items) {
            for (Object item : items) {
                result.add(codec.decode(item, type));
            }
        }
        return result;
    }

    @Override
    public T create(String namespace, T resource) {
        Map<String, Object> body = codec.encode(resource);
        Object created = KubeCalls.create("create " + describe(namespace, resource.name()),
                () -> api.createNamespacedCustomObject(ResourceKind.GROUP, ResourceKind.VERSION,
                        namespace, kind.plural(), body).execute());
        return codec.decode(created, type);
    }

    @Override
    public T replace(T resource) {
        Map<String, Object> body = codec.encode(resource);
        Object updated = KubeCalls.call("update " + describe(resource.namespace(), resource.name()),
                () -> api.replaceNamespacedCustomObject(ResourceKind.GROUP, ResourceKind.VERSION,
                        resource.namespace(), kind.plural(), resource.name(), body).execute());
        return codec.decode(updated, type);
    }

    @Override
    public T replaceStatus(T resource) {
        Map<String, Object> body = codec.encode(resource);
        Object updated = KubeCalls.call("update status of " + describe(resource.namespace(), resource.name()),
                () -> api.replaceNamespacedCustomObjectStatus(ResourceKind.GROUP, ResourceKind.VERSION,
                        resource.namespace(), kind.plural(), resource.name(), body).execute());
        return codec.decode(updated, type);
    }

    @Override
    public void delete(String namespace, String name) {
        KubeCalls.call("delete " + describe(namespace, name),
                () -> api.deleteNamespacedCustomObject(ResourceKind.GROUP, ResourceKind.VERSION,
                        namespace, kind.plural(), name).execute());
    }

    @Override
    public WatchStream<T> watch() {
        CustomObjectsApi watchApi = new CustomObjectsApi(watchClient);
        Watch<Object> watch = KubeCalls.call("watch " + kind.plural(), () -> {
            Call call = watchApi.listClusterCustomObject(ResourceKind.GROUP, ResourceKind.VERSION, kind.plural())
                    .watch(true)
                    .buildCall(null);
            return Watch.createWatch(watchClient, call, new TypeToken<Watch.Response<Object>>() {}.getType());
        });
        return new KubeWatchStream<>(watch, raw -> codec.decode(raw, type));
    }

    @Override
    public String kindName() {
        return kind.kind();
    }

    private String describe(String namespace, String name) {
        return kind.kind() + " " + namespace + "/" + name;
    }
}

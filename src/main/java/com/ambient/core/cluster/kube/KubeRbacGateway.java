package com.ambient.core.cluster.kube;

import com.ambient.core.cluster.ClusterException;
import com.ambient.core.cluster.RbacGateway;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.RbacAuthorizationV1Api;
import io.kubernetes.client.openapi.models.AuthenticationV1TokenRequest;
import io.kubernetes.client.openapi.models.V1Role;
import io.kubernetes.client.openapi.models.V1RoleBinding;
import io.kubernetes.client.openapi.models.V1RoleBindingList;
import io.kubernetes.client.openapi.models.V1ServiceAccount;
import io.kubernetes.client.openapi.models.V1ServiceAccountList;
import io.kubernetes.client.openapi.models.V1TokenRequestSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

final class KubeRbacGateway implements RbacGateway {

    private final CoreV1Api core;
    private final RbacAuthorizationV1Api rbac;

    KubeRbacGateway(ApiClient client) {
        this.core = new CoreV1Api(client);
        this.rbac = new RbacAuthorizationV1Api(client);
    }

    @Override
    public V1ServiceAccount createServiceAccount(String namespace, V1ServiceAccount serviceAccount) {
        return KubeCalls.create("create service account in " + namespace,
                () -> core.createNamespacedServiceAccount(namespace, serviceAccount).execute());
    }

    @Override
    public Optional<V1ServiceAccount> findServiceAccount(String namespace, String name) {
        return KubeCalls.find("get service account " + namespace + "/" + name,
                () -> core.readNamespacedServiceAccount(name, namespace).execute());
    }

    @Override
    public List<V1ServiceAccount> listServiceAccounts(String namespace, String labelSelector) {
        V1ServiceAccountList list = KubeCalls.call("list service accounts in " + namespace,
                () -> core.listNamespacedServiceAccount(namespace).labelSelector(labelSelector).execute());
        return list == null ? List.of() : list.getItems();
    }

    @Override
    public V1ServiceAccount replaceServiceAccount(String namespace, V1ServiceAccount serviceAccount) {
        String name = serviceAccount.getMetadata().getName();
        return KubeCalls.call("update service account " + namespace + "/" + name,
                () -> core.replaceNamespacedServiceAccount(name, namespace, serviceAccount).execute());
    }

    @Override
    public void deleteServiceAccount(String namespace, String name) {
        KubeCalls.call("delete service account " + namespace + "/" + name,
                () -> core.deleteNamespacedServiceAccount(name, namespace).execute());
    }

    @Override
    public V1Role createRole(String namespace, V1Role role) {
        return KubeCalls.create("create role in " + namespace,
                () -> rbac.createNamespacedRole(namespace, role).execute());
    }

    @Override
    public V1RoleBinding createRoleBinding(String namespace, V1RoleBinding binding) {
        return KubeCalls.create("create role binding in " + namespace,
                () -> rbac.createNamespacedRoleBinding(namespace, binding).execute());
    }

    @Override
    public Optional<V1RoleBinding> findRoleBinding(String namespace, String name) {
        return KubeCalls.find("get role binding " + namespace + "/" + name,
                () -> rbac.readNamespacedRoleBinding(name, namespace).execute());
    }

    @Override
    public List<V1RoleBinding> listRoleBindings(String namespace, String labelSelector) {
        V1RoleBindingList list = KubeCalls.call("list role bindings in " + namespace,
                () -> rbac.listNamespacedRoleBinding(namespace).labelSelector(labelSelector).execute());
        return list == null ? List.of() : list.getItems();
    }

    @Override
    public void deleteRoleBinding(String namespace, String name) {
        KubeCalls.call("delete role binding " + namespace + "/" + name,
                () -> rbac.deleteNamespacedRoleBinding(name, namespace).execute());
    }

    @Override
    public String mintToken(String namespace, String serviceAccountName, Long expirationSeconds) {
        var request = new AuthenticationV1TokenRequest()
                .spec(new V1TokenRequestSpec()
                        .audiences(new ArrayList<>())
                        .expirationSeconds(expirationSeconds));
        AuthenticationV1TokenRequest response = KubeCalls.call(
                "mint token for " + namespace + "/" + serviceAccountName,
                () -> core.createNamespacedServiceAccountToken(serviceAccountName, namespace, request).execute());
        if (response == null || response.getStatus() == null
                || response.getStatus().getToken() == null || response.getStatus().getToken().isBlank()) {
            throw new ClusterException("Token request for " + namespace + "/" + serviceAccountName
                    + " returned no token", 500);
        }
        return response.getStatus().getToken();
    }
}

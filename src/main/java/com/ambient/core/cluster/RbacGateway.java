package com.ambient.core.cluster;

import io.kubernetes.client.openapi.models.V1Role;
import io.kubernetes.client.openapi.models.V1RoleBinding;
import io.kubernetes.client.openapi.models.V1ServiceAccount;

import java.util.List;
import java.util.Optional;

/**
 * Identities, roles and bindings within a namespace.
 */
public interface RbacGateway {

    V1ServiceAccount createServiceAccount(String namespace, V1ServiceAccount serviceAccount);

    Optional<V1ServiceAccount> findServiceAccount(String namespace, String name);

    List<V1ServiceAccount> listServiceAccounts(String namespace, String labelSelector);

    V1ServiceAccount replaceServiceAccount(String namespace, V1ServiceAccount serviceAccount);

    void deleteServiceAccount(String namespace, String name);

    V1Role createRole(String namespace, V1Role role);

    V1RoleBinding createRoleBinding(String namespace, V1RoleBinding binding);

    Optional<V1RoleBinding> findRoleBinding(String namespace, String name);

    List<V1RoleBinding> listRoleBindings(String namespace, String labelSelector);

    void deleteRoleBinding(String namespace, String name);

    /**
     * Mints a short-lived token for the service account through the TokenRequest API.
     *
     * @param expirationSeconds requested lifetime, or {@code null} for the server default
     */
    String mintToken(String namespace, String serviceAccountName, Long expirationSeconds);
}

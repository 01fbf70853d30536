package com.ambient.core.cluster.kube;

import com.ambient.core.cluster.AccessReviewer;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.AuthorizationV1Api;
import io.kubernetes.client.openapi.models.V1ResourceAttributes;
import io.kubernetes.client.openapi.models.V1SelfSubjectAccessReview;
import io.kubernetes.client.openapi.models.V1SelfSubjectAccessReviewSpec;

/**
 * Answers access questions with a SelfSubjectAccessReview, so the answer is always
 * about the identity the client is bound to.
 */
final class KubeAccessReviewer implements AccessReviewer {

    private final AuthorizationV1Api api;

    KubeAccessReviewer(ApiClient client) {
        this.api = new AuthorizationV1Api(client);
    }

    @Override
    public boolean isAllowed(String namespace, String group, String resource, String verb) {
        var review = new V1SelfSubjectAccessReview()
                .spec(new V1SelfSubjectAccessReviewSpec()
                        .resourceAttributes(new V1ResourceAttributes()
                                .namespace(namespace)
                                .group(group)
                                .resource(resource)
                                .verb(verb)));
        V1SelfSubjectAccessReview result = KubeCalls.call(
                "access review " + verb + " " + resource + " in " + namespace,
                () -> api.createSelfSubjectAccessReview(review).execute());
        return result != null && result.getStatus() != null && Boolean.TRUE.equals(result.getStatus().getAllowed());
    }
}

package com.ambient.core.cluster.kube;

import com.ambient.core.cluster.WorkloadGateway;
import com.ambient.core.resource.MetadataKeys;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.AppsV1Api;
import io.kubernetes.client.openapi.apis.BatchV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import io.kubernetes.client.openapi.models.V1Service;

import java.util.Optional;

final class KubeWorkloadGateway implements WorkloadGateway {

    private final BatchV1Api batch;
    private final CoreV1Api core;
    private final AppsV1Api apps;

    KubeWorkloadGateway(ApiClient client) {
        this.batch = new BatchV1Api(client);
        this.core = new CoreV1Api(client);
        this.apps = new AppsV1Api(client);
    }

    @Override
    public Optional<V1Job> findJob(String namespace, String name) {
        return KubeCalls.find("get job " + namespace + "/" + name,
                () -> batch.readNamespacedJob(name, namespace).execute());
    }

    @Override
    public V1Job createJob(String namespace, V1Job job) {
        return KubeCalls.create("create job in " + namespace,
                () -> batch.createNamespacedJob(namespace, job).execute());
    }

    @Override
    public void deleteJob(String namespace, String name) {
        KubeCalls.call("delete job " + namespace + "/" + name,
                () -> batch.deleteNamespacedJob(name, namespace).propagationPolicy("Background").execute());
    }

    @Override
    public Optional<String> firstPodLog(String namespace, String jobName, int limitBytes) {
        V1PodList pods = KubeCalls.call("list pods of job " + namespace + "/" + jobName,
                () -> core.listNamespacedPod(namespace)
                        .labelSelector(MetadataKeys.JOB_NAME_LABEL + "=" + jobName)
                        .execute());
        if (pods == null || pods.getItems().isEmpty()) {
            return Optional.empty();
        }
        V1Pod first = pods.getItems().get(0);
        String podName = first.getMetadata().getName();
        return KubeCalls.find("read log of pod " + namespace + "/" + podName,
                () -> core.readNamespacedPodLog(podName, namespace).limitBytes(limitBytes).execute());
    }

    @Override
    public Optional<V1PersistentVolumeClaim> findPersistentVolumeClaim(String namespace, String name) {
        return KubeCalls.find("get pvc " + namespace + "/" + name,
                () -> core.readNamespacedPersistentVolumeClaim(name, namespace).execute());
    }

    @Override
    public V1PersistentVolumeClaim createPersistentVolumeClaim(String namespace, V1PersistentVolumeClaim claim) {
        return KubeCalls.create("create pvc in " + namespace,
                () -> core.createNamespacedPersistentVolumeClaim(namespace, claim).execute());
    }

    @Override
    public Optional<V1Service> findService(String namespace, String name) {
        return KubeCalls.find("get service " + namespace + "/" + name,
                () -> core.readNamespacedService(name, namespace).execute());
    }

    @Override
    public V1Service createService(String namespace, V1Service service) {
        return KubeCalls.create("create service in " + namespace,
                () -> core.createNamespacedService(namespace, service).execute());
    }

    @Override
    public V1Deployment createDeployment(String namespace, V1Deployment deployment) {
        return KubeCalls.create("create deployment in " + namespace,
                () -> apps.createNamespacedDeployment(namespace, deployment).execute());
    }
}

package com.ambient.core.cluster;

import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Service;

import java.util.Optional;

/**
 * Execution units and the per-tenant infrastructure they run against.
 */
public interface WorkloadGateway {

    Optional<V1Job> findJob(String namespace, String name);

    /**
     * @throws AlreadyExistsException if a job with the same name exists
     */
    V1Job createJob(String namespace, V1Job job);

    /**
     * Deletes the job and, in the background, its pods.
     *
     * @throws NotFoundException if the job does not exist
     */
    void deleteJob(String namespace, String name);

    /** At most {@code limitBytes} of log output from the first pod created for the job, if any pod exists. */
    Optional<String> firstPodLog(String namespace, String jobName, int limitBytes);

    Optional<V1PersistentVolumeClaim> findPersistentVolumeClaim(String namespace, String name);

    V1PersistentVolumeClaim createPersistentVolumeClaim(String namespace, V1PersistentVolumeClaim claim);

    Optional<V1Service> findService(String namespace, String name);

    V1Service createService(String namespace, V1Service service);

    V1Deployment createDeployment(String namespace, V1Deployment deployment);
}

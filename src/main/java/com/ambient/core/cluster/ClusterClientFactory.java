package com.ambient.core.cluster;

/**
 * Builds identity-bound {@link ClusterClients}.
 */
public interface ClusterClientFactory {

    /**
     * Clients that act as the holder of {@code bearerToken}.
     *
     * @throws IllegalArgumentException if the token is blank; there is no fallback identity
     */
    ClusterClients forToken(String bearerToken);

    /** Clients that act as this process's own service identity. */
    ClusterClients serviceIdentity();
}

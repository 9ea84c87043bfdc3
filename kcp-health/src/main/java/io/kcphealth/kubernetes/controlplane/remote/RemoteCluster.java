/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.remote;

import java.util.Objects;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * An API client for a workload cluster together with the connection settings it was built from.
 * Closing it closes the client.
 *
 * @param client client bound to the workload cluster
 * @param config connection settings of the client
 */
public record RemoteCluster(KubernetesClient client, Config config) implements AutoCloseable {

    public RemoteCluster {
        Objects.requireNonNull(client);
        Objects.requireNonNull(config);
    }

    public static RemoteCluster of(KubernetesClient client) {
        return new RemoteCluster(client, client.getConfiguration());
    }

    @Override
    public void close() {
        client.close();
    }
}

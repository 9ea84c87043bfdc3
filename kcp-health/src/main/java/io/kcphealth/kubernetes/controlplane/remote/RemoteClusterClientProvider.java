/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.remote;

import io.kcphealth.kubernetes.controlplane.ClusterKey;

/**
 * Gives access to the API of a workload cluster managed from the management cluster.
 */
@FunctionalInterface
public interface RemoteClusterClientProvider {

    /**
     * @param clusterKey the workload cluster
     * @return a new connection, which the caller must close
     * @throws RemoteClusterAccessException if no connection can be built for the cluster
     */
    RemoteCluster connect(ClusterKey clusterKey);
}

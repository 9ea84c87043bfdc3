/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.proxy;

import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * Opens tunnels to pods of the cluster a client is connected to.
 */
@FunctionalInterface
public interface PodTunnelFactory {

    /**
     * @param client client for the cluster running the pod
     * @param target the pod port
     * @return an open tunnel, which the caller must close
     * @throws PodTunnelException if the tunnel cannot be opened
     */
    PodTunnel open(KubernetesClient client, PodPortTarget target);
}

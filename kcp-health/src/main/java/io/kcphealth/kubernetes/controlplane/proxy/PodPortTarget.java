/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.proxy;

import java.util.Objects;

import io.kcphealth.kubernetes.controlplane.StaticPods;

/**
 * A port of a pod in a workload cluster, reached through that cluster's API server.
 *
 * @param namespace pod namespace
 * @param podName pod name
 * @param port container port
 */
public record PodPortTarget(String namespace, String podName, int port) {

    public static final int ETCD_CLIENT_PORT = 2379;

    public PodPortTarget {
        Objects.requireNonNull(namespace);
        Objects.requireNonNull(podName);
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Only stacked etcd, running as a kubeadm static pod, can be addressed this way.
     *
     * @param nodeName control plane node
     * @return the client port of the etcd static pod on that node
     */
    public static PodPortTarget etcdOn(String nodeName) {
        return new PodPortTarget(StaticPods.NAMESPACE, StaticPods.podName(StaticPods.ETCD, nodeName), ETCD_CLIENT_PORT);
    }

    @Override
    public String toString() {
        return "pods/" + namespace + "/" + podName + ":" + port;
    }
}

/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.Objects;

/**
 * Identifies a workload cluster by the namespace and name of its {@code Cluster} object
 * in the management cluster.
 *
 * @param namespace namespace holding the cluster's objects in the management cluster
 * @param name the cluster name
 */
public record ClusterKey(String namespace, String name) {

    public ClusterKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}

/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.List;
import java.util.function.Predicate;

import io.kcphealth.kubernetes.api.v1alpha3.Machine;

/**
 * Source of the machines recorded for a cluster.
 */
@FunctionalInterface
public interface MachineInventory {

    /**
     * @param clusterKey the cluster
     * @param filter machines to keep
     * @return the cluster's machines accepted by {@code filter}
     */
    List<Machine> machines(ClusterKey clusterKey, Predicate<Machine> filter);
}

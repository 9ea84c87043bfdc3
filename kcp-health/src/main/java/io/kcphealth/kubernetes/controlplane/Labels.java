/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

/**
 * Well known labels read from management and workload cluster objects.
 */
public class Labels {

    /** Label on a {@code Machine} naming the cluster it belongs to. */
    public static final String CLUSTER_NAME = "cluster.x-k8s.io/cluster-name";

    /** Label on a control plane {@code Machine} holding the hash of the configuration it was created from. */
    public static final String CONTROL_PLANE_HASH = "kubeadm.controlplane.cluster.x-k8s.io/hash";

    /** Label kubeadm puts on control plane nodes. */
    public static final String CONTROL_PLANE_NODE_ROLE = "node-role.kubernetes.io/master";

    private Labels() {
    }
}

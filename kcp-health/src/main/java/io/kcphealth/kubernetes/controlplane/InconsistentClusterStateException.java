/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

/**
 * The workload cluster's nodes, its etcd members and the management cluster's machines
 * do not line up one to one.
 */
public class InconsistentClusterStateException extends ControlPlaneHealthException {

    public InconsistentClusterStateException(String message) {
        super(message);
    }
}

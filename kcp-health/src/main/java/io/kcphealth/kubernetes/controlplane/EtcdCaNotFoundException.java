/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

/**
 * The etcd certificate authority secret of a cluster does not exist in the management cluster.
 */
public class EtcdCaNotFoundException extends ControlPlaneHealthException {

    public EtcdCaNotFoundException(String message) {
        super(message);
    }
}

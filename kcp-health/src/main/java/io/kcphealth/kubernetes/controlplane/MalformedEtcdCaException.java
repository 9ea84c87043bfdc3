/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

/**
 * The etcd certificate authority secret exists but lacks the certificate or the key.
 */
public class MalformedEtcdCaException extends ControlPlaneHealthException {

    public MalformedEtcdCaException(String message) {
        super(message);
    }
}

/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.etcd;

/**
 * An etcd endpoint could not be connected to or queried.
 */
public class EtcdClientException extends RuntimeException {

    public EtcdClientException(String message, Throwable cause) {
        super(message, cause);
    }
}

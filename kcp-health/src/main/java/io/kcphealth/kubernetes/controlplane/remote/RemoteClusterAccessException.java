/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.remote;

import io.kcphealth.kubernetes.controlplane.ControlPlaneHealthException;

/**
 * Connection settings for a workload cluster are missing or unusable.
 */
public class RemoteClusterAccessException extends ControlPlaneHealthException {

    public RemoteClusterAccessException(String message) {
        super(message);
    }

    public RemoteClusterAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}

/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

/**
 * Base class of the failures reported by the control plane health checks.
 */
public class ControlPlaneHealthException extends RuntimeException {

    public ControlPlaneHealthException(String message) {
        super(message);
    }

    public ControlPlaneHealthException(String message, Throwable cause) {
        super(message, cause);
    }
}

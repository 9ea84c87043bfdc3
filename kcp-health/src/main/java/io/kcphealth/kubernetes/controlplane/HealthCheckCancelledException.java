/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

/**
 * The thread running a health check was interrupted while waiting on the network.
 * The interrupt status of the thread is left set.
 */
public class HealthCheckCancelledException extends ControlPlaneHealthException {

    public HealthCheckCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Throws if the current thread has been interrupted, without clearing its interrupt status.
     *
     * @param activity what was in progress, for the message
     * @param cause the failure observed while the thread was interrupted
     * @throws HealthCheckCancelledException if the current thread is interrupted
     */
    public static void throwIfInterrupted(String activity, Throwable cause) {
        if (Thread.currentThread().isInterrupted()) {
            throw new HealthCheckCancelledException("health check cancelled while " + activity, cause);
        }
    }
}

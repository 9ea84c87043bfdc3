/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.proxy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A tunnel to a pod port could not be opened.
 */
public class PodTunnelException extends RuntimeException {

    private final boolean notFound;

    public PodTunnelException(String message, boolean notFound, @Nullable Throwable cause) {
        super(message, cause);
        this.notFound = notFound;
    }

    /**
     * @return true if the tunnel failed because the pod does not exist
     */
    public boolean isNotFound() {
        return notFound;
    }
}

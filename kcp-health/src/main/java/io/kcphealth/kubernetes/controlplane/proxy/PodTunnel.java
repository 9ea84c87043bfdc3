/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.proxy;

import java.net.InetSocketAddress;

/**
 * An open tunnel to a pod port. Connections made to {@link #localAddress()} are relayed
 * to the pod through the API server until the tunnel is closed.
 */
public interface PodTunnel extends AutoCloseable {

    PodPortTarget target();

    InetSocketAddress localAddress();

    @Override
    void close();
}

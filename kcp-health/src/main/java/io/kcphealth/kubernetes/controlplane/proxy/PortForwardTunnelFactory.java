/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.proxy;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.LocalPortForward;
import io.fabric8.kubernetes.client.dsl.PodResource;

/**
 * Tunnels through the API server's pod {@code portforward} subresource, exposing the pod
 * port on an ephemeral loopback port.
 */
public class PortForwardTunnelFactory implements PodTunnelFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(PortForwardTunnelFactory.class);

    @Override
    public PodTunnel open(KubernetesClient client, PodPortTarget target) {
        PodResource pod = client.pods().inNamespace(target.namespace()).withName(target.podName());
        LocalPortForward portForward;
        try {
            // port forwarding only fails once a connection is relayed, so check the pod up front
            Pod existing = pod.get();
            if (existing == null) {
                throw new PodTunnelException("pod " + target.namespace() + "/" + target.podName() + " not found", true, null);
            }
            // loopback only, and an address the etcd serving certificate names
            portForward = pod.portForward(target.port(), InetAddress.getLoopbackAddress(), 0);
        }
        catch (KubernetesClientException e) {
            throw new PodTunnelException("failed to open tunnel to " + target, e.getCode() == 404, e);
        }
        LOGGER.atDebug()
                .setMessage("Forwarding {}:{} to {}")
                .addArgument(portForward::getLocalAddress)
                .addArgument(portForward::getLocalPort)
                .addArgument(target)
                .log();
        return new PortForwardTunnel(target, portForward);
    }

    private record PortForwardTunnel(PodPortTarget target, LocalPortForward portForward) implements PodTunnel {

        @Override
        public InetSocketAddress localAddress() {
            return new InetSocketAddress(portForward.getLocalAddress(), portForward.getLocalPort());
        }

        @Override
        public void close() {
            try {
                portForward.close();
            }
            catch (IOException e) {
                LOGGER.warn("Ignoring failure to close tunnel to {}", target, e);
            }
        }
    }
}

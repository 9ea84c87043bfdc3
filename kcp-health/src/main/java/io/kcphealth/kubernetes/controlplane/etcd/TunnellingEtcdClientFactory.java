/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.etcd;

import java.net.InetSocketAddress;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Objects;

import javax.net.ssl.SSLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.etcd.jetcd.Client;
import io.grpc.netty.GrpcSslContexts;
import io.netty.handler.ssl.SslContext;

import io.kcphealth.kubernetes.controlplane.certs.EtcdTlsBundle;
import io.kcphealth.kubernetes.controlplane.proxy.PodPortTarget;
import io.kcphealth.kubernetes.controlplane.proxy.PodTunnel;
import io.kcphealth.kubernetes.controlplane.proxy.PodTunnelException;
import io.kcphealth.kubernetes.controlplane.proxy.PodTunnelFactory;
import io.kcphealth.kubernetes.controlplane.remote.RemoteCluster;

/**
 * Connects to a node's etcd static pod through a tunnel across the workload cluster's
 * API server, so etcd does not have to be reachable from the management cluster.
 * External etcd is not supported: no etcd pod will be found for the node.
 */
public class TunnellingEtcdClientFactory implements EtcdClientFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(TunnellingEtcdClientFactory.class);

    private final PodTunnelFactory tunnelFactory;
    private final Duration dialTimeout;
    private final Duration requestTimeout;

    public TunnellingEtcdClientFactory(PodTunnelFactory tunnelFactory, Duration dialTimeout, Duration requestTimeout) {
        this.tunnelFactory = Objects.requireNonNull(tunnelFactory);
        this.dialTimeout = Objects.requireNonNull(dialTimeout);
        this.requestTimeout = Objects.requireNonNull(requestTimeout);
    }

    @Override
    public EtcdClient newClient(RemoteCluster cluster, String nodeName, EtcdTlsBundle tls) {
        PodPortTarget target = PodPortTarget.etcdOn(nodeName);
        PodTunnel tunnel;
        try {
            tunnel = tunnelFactory.open(cluster.client(), target);
        }
        catch (PodTunnelException e) {
            throw new EtcdClientException("failed to open tunnel to " + target, e);
        }
        try {
            String endpoint = endpoint(tunnel.localAddress());
            Client client = Client.builder()
                    .endpoints(endpoint)
                    .sslContext(sslContext(tls))
                    .connectTimeout(dialTimeout)
                    .build();
            LOGGER.debug("Created etcd client for node {} via {}", nodeName, endpoint);
            return new JetcdEtcdClient(client, tunnel, requestTimeout);
        }
        catch (SSLException | RuntimeException e) {
            tunnel.close();
            throw new EtcdClientException("failed to create etcd client for " + target, e);
        }
    }

    static String endpoint(InetSocketAddress address) {
        // the literal address, never a host name that could resolve to another interface
        String host = address.isUnresolved() ? address.getHostString() : address.getAddress().getHostAddress();
        if (host.contains(":")) {
            host = "[" + host + "]";
        }
        return "https://" + host + ":" + address.getPort();
    }

    static SslContext sslContext(EtcdTlsBundle tls) throws SSLException {
        return GrpcSslContexts.forClient()
                .keyManager(tls.clientKey(), tls.clientCertificate())
                .trustManager(tls.trustedCertificates().toArray(new X509Certificate[0]))
                .build();
    }
}

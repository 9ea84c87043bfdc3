/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.remote;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;

import io.kcphealth.kubernetes.controlplane.ClusterKey;

/**
 * Builds workload cluster clients from the kubeconfig secret ({@code <cluster>-kubeconfig},
 * key {@value #KUBECONFIG_KEY}) that Cluster API keeps in the management cluster.
 */
public class KubeconfigSecretClientProvider implements RemoteClusterClientProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubeconfigSecretClientProvider.class);

    static final String KUBECONFIG_KEY = "value";

    private final KubernetesClient managementClient;
    private final Duration requestTimeout;

    public KubeconfigSecretClientProvider(KubernetesClient managementClient, Duration requestTimeout) {
        this.managementClient = Objects.requireNonNull(managementClient);
        this.requestTimeout = Objects.requireNonNull(requestTimeout);
    }

    static String secretName(ClusterKey clusterKey) {
        return clusterKey.name() + "-kubeconfig";
    }

    @Override
    public RemoteCluster connect(ClusterKey clusterKey) {
        String secretName = secretName(clusterKey);
        Secret secret;
        try {
            secret = managementClient.secrets().inNamespace(clusterKey.namespace()).withName(secretName).get();
        }
        catch (KubernetesClientException e) {
            throw new RemoteClusterAccessException("failed to get kubeconfig secret " + clusterKey.namespace() + "/" + secretName, e);
        }
        if (secret == null) {
            throw new RemoteClusterAccessException("kubeconfig secret " + clusterKey.namespace() + "/" + secretName + " not found");
        }
        String kubeconfig = decode(secret.getData(), clusterKey, secretName);
        try {
            Config config = Config.fromKubeconfig(kubeconfig);
            config.setRequestTimeout(Math.toIntExact(requestTimeout.toMillis()));
            KubernetesClient client = new KubernetesClientBuilder().withConfig(config).build();
            LOGGER.debug("Connected to cluster {} at {}", clusterKey, config.getMasterUrl());
            return new RemoteCluster(client, config);
        }
        catch (KubernetesClientException | IllegalArgumentException e) {
            throw new RemoteClusterAccessException("invalid kubeconfig in secret " + clusterKey.namespace() + "/" + secretName, e);
        }
    }

    private static String decode(Map<String, String> data, ClusterKey clusterKey, String secretName) {
        String encoded = data == null ? null : data.get(KUBECONFIG_KEY);
        if (encoded == null) {
            throw new RemoteClusterAccessException("kubeconfig secret " + clusterKey.namespace() + "/" + secretName + " has no " + KUBECONFIG_KEY + " key");
        }
        try {
            return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        }
        catch (IllegalArgumentException e) {
            throw new RemoteClusterAccessException("kubeconfig secret " + clusterKey.namespace() + "/" + secretName + " is not base64 encoded", e);
        }
    }
}

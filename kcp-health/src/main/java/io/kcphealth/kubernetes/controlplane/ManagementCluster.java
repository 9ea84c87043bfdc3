/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;

import io.kcphealth.kubernetes.api.v1alpha3.Machine;
import io.kcphealth.kubernetes.controlplane.certs.ClientCertificateGenerator;
import io.kcphealth.kubernetes.controlplane.config.HealthCheckConfig;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdClientFactory;
import io.kcphealth.kubernetes.controlplane.etcd.TunnellingEtcdClientFactory;
import io.kcphealth.kubernetes.controlplane.proxy.PortForwardTunnelFactory;
import io.kcphealth.kubernetes.controlplane.remote.KubeconfigSecretClientProvider;
import io.kcphealth.kubernetes.controlplane.remote.RemoteCluster;
import io.kcphealth.kubernetes.controlplane.remote.RemoteClusterClientProvider;
import io.kcphealth.kubernetes.controlplane.tag.VisibleForTesting;

/**
 * Entry point for health checks of the control planes of workload clusters, as seen from the management cluster.
 * <p>
 * Each health check invocation connects to the workload cluster afresh and releases the connection when done.
 * Nothing is cached between invocations, so one instance can serve concurrent callers.
 * </p>
 */
public class ManagementCluster {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManagementCluster.class);

    static final String ETCD_CA_CERT_KEY = "tls.crt";
    static final String ETCD_CA_KEY_KEY = "tls.key";

    private final KubernetesClient client;
    private final RemoteClusterClientProvider remoteClusterClientProvider;
    private final EtcdClientFactory etcdClientFactory;
    private final ClientCertificateGenerator certificateGenerator;
    private final HealthCheckOrchestrator orchestrator;

    /**
     * @param client management cluster client
     * @param config timeouts for the workload cluster connections
     */
    public ManagementCluster(KubernetesClient client, HealthCheckConfig config) {
        this(client,
                new KubeconfigSecretClientProvider(client, config.kubernetesRequestTimeout()),
                new TunnellingEtcdClientFactory(new PortForwardTunnelFactory(), config.etcdDialTimeout(), config.etcdRequestTimeout()),
                new ClientCertificateGenerator(Clock.systemUTC()));
    }

    @VisibleForTesting
    ManagementCluster(KubernetesClient client,
                      RemoteClusterClientProvider remoteClusterClientProvider,
                      EtcdClientFactory etcdClientFactory,
                      ClientCertificateGenerator certificateGenerator) {
        this.client = Objects.requireNonNull(client);
        this.remoteClusterClientProvider = Objects.requireNonNull(remoteClusterClientProvider);
        this.etcdClientFactory = Objects.requireNonNull(etcdClientFactory);
        this.certificateGenerator = Objects.requireNonNull(certificateGenerator);
        this.orchestrator = new HealthCheckOrchestrator((clusterKey, filter) -> listMachines(clusterKey, filter));
    }

    /**
     * Lists the machines labelled as belonging to a cluster.
     *
     * @param clusterKey the cluster
     * @param filters filters the machines must all pass, see {@link MachineFilters}
     * @return the matching machines
     */
    @SafeVarargs
    public final List<Machine> listMachines(ClusterKey clusterKey, Predicate<Machine>... filters) {
        List<Machine> machines = client.resources(Machine.class)
                .inNamespace(clusterKey.namespace())
                .withLabel(Labels.CLUSTER_NAME, clusterKey.name())
                .list()
                .getItems();
        return MachineFilters.filter(machines, filters);
    }

    /**
     * Reads the etcd certificate authority of a cluster from the {@code <cluster>-etcd} secret.
     *
     * @param clusterKey the cluster
     * @return the CA certificate and key
     * @throws EtcdCaNotFoundException if the secret does not exist
     * @throws MalformedEtcdCaException if the secret lacks the certificate or the key
     */
    public EtcdCa etcdCa(ClusterKey clusterKey) {
        String secretName = clusterKey.name() + "-etcd";
        Secret secret = client.secrets().inNamespace(clusterKey.namespace()).withName(secretName).get();
        if (secret == null) {
            throw new EtcdCaNotFoundException("failed to get secret " + clusterKey.namespace() + "/" + secretName + "; etcd CA bundle");
        }
        Map<String, String> data = secret.getData();
        return new EtcdCa(
                secretField(data, ETCD_CA_CERT_KEY, "etcd tls crt", clusterKey),
                secretField(data, ETCD_CA_KEY_KEY, "etcd tls key", clusterKey));
    }

    private static byte[] secretField(Map<String, String> data, String key, String description, ClusterKey clusterKey) {
        String encoded = data == null ? null : data.get(key);
        if (encoded == null) {
            throw new MalformedEtcdCaException(description + " does not exist for cluster " + clusterKey);
        }
        try {
            return Base64.getDecoder().decode(encoded);
        }
        catch (IllegalArgumentException e) {
            throw new MalformedEtcdCaException(description + " is not base64 encoded for cluster " + clusterKey);
        }
    }

    /**
     * Verifies that the API server and controller manager of every control plane node are ready.
     *
     * @param clusterKey the cluster
     * @param controlPlaneName name of the control plane owning the machines
     * @throws UnhealthyNodesException if any node is unhealthy
     * @throws InconsistentClusterStateException if the nodes and the machines disagree
     */
    public void verifyControlPlaneHealthy(ClusterKey clusterKey, String controlPlaneName) {
        try (TargetCluster target = targetCluster(clusterKey)) {
            orchestrator.run(target.controlPlaneHealthCheck(), clusterKey, controlPlaneName);
        }
        LOGGER.debug("Control plane of cluster {} is healthy", clusterKey);
    }

    /**
     * Verifies that every control plane node runs a healthy etcd member of one consistent etcd cluster.
     *
     * @param clusterKey the cluster
     * @param controlPlaneName name of the control plane owning the machines
     * @throws UnhealthyNodesException if any member is unhealthy
     * @throws InconsistentClusterStateException if the members, the nodes and the machines disagree
     */
    public void verifyEtcdHealthy(ClusterKey clusterKey, String controlPlaneName) {
        try (TargetCluster target = targetCluster(clusterKey)) {
            orchestrator.run(target.etcdHealthCheck(), clusterKey, controlPlaneName);
        }
        LOGGER.debug("etcd of cluster {} is healthy", clusterKey);
    }

    @VisibleForTesting
    TargetCluster targetCluster(ClusterKey clusterKey) {
        RemoteCluster remote = remoteClusterClientProvider.connect(clusterKey);
        try {
            return new TargetCluster(remote, etcdCa(clusterKey), certificateGenerator, etcdClientFactory);
        }
        catch (RuntimeException e) {
            remote.close();
            throw e;
        }
    }
}

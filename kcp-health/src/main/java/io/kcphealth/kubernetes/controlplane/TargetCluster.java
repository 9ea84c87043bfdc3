/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.List;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClientException;

import io.kcphealth.kubernetes.controlplane.certs.ClientCertificateGenerator;
import io.kcphealth.kubernetes.controlplane.certs.EtcdTlsBundle;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdClient;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdClientFactory;
import io.kcphealth.kubernetes.controlplane.remote.RemoteCluster;

/**
 * Access to one workload cluster for the duration of a single health check invocation.
 * Closing it releases the workload cluster client.
 */
public class TargetCluster implements AutoCloseable {

    private final RemoteCluster remote;
    private final EtcdCa etcdCa;
    private final ClientCertificateGenerator certificateGenerator;
    private final EtcdClientFactory etcdClientFactory;

    public TargetCluster(RemoteCluster remote, EtcdCa etcdCa, ClientCertificateGenerator certificateGenerator, EtcdClientFactory etcdClientFactory) {
        this.remote = Objects.requireNonNull(remote);
        this.etcdCa = Objects.requireNonNull(etcdCa);
        this.certificateGenerator = Objects.requireNonNull(certificateGenerator);
        this.etcdClientFactory = Objects.requireNonNull(etcdClientFactory);
    }

    /**
     * @return the nodes labelled as control plane nodes, in the order the API server listed them
     */
    public List<Node> controlPlaneNodes() {
        return remote.client().nodes()
                .withLabel(Labels.CONTROL_PLANE_NODE_ROLE)
                .list()
                .getItems();
    }

    /**
     * @param component control plane component
     * @param nodeName node the static pod runs on
     * @return the component's static pod
     * @throws NodeHealthException if the pod does not exist or could not be fetched
     */
    Pod staticPod(String component, String nodeName) {
        String podName = StaticPods.podName(component, nodeName);
        Pod pod;
        try {
            pod = remote.client().pods().inNamespace(StaticPods.NAMESPACE).withName(podName).get();
        }
        catch (KubernetesClientException e) {
            HealthCheckCancelledException.throwIfInterrupted("getting pod " + podName, e);
            throw new NodeHealthException(NodeHealthException.Reason.POD_LOOKUP_FAILED,
                    "failed to get pod " + StaticPods.NAMESPACE + "/" + podName, e);
        }
        if (pod == null) {
            throw new NodeHealthException(NodeHealthException.Reason.POD_NOT_FOUND,
                    "pods \"" + podName + "\" not found");
        }
        return pod;
    }

    /**
     * Mints a client identity signed by this cluster's etcd CA.
     *
     * @return a new TLS bundle
     * @throws io.kcphealth.kubernetes.controlplane.certs.CertificateGenerationException if the CA is unusable
     */
    public EtcdTlsBundle etcdTlsBundle() {
        return certificateGenerator.generate(etcdCa.certificatePem(), etcdCa.keyPem());
    }

    EtcdClient etcdClientFor(String nodeName, EtcdTlsBundle tls) {
        return etcdClientFactory.newClient(remote, nodeName, tls);
    }

    public HealthCheck controlPlaneHealthCheck() {
        return new ControlPlaneHealthCheck(this);
    }

    public HealthCheck etcdHealthCheck() {
        return new EtcdHealthCheck(this);
    }

    @Override
    public void close() {
        remote.close();
    }
}

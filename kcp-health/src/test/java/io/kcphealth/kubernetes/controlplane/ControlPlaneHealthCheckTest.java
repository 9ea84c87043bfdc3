/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.time.Clock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;

import io.kcphealth.kubernetes.controlplane.certs.ClientCertificateGenerator;
import io.kcphealth.kubernetes.controlplane.remote.RemoteCluster;

import static io.kcphealth.kubernetes.controlplane.ClusterFixtures.controlPlaneNode;
import static io.kcphealth.kubernetes.controlplane.ClusterFixtures.create;
import static io.kcphealth.kubernetes.controlplane.ClusterFixtures.createHealthyControlPlaneNode;
import static io.kcphealth.kubernetes.controlplane.ClusterFixtures.staticPod;
import static io.kcphealth.kubernetes.controlplane.ClusterFixtures.workerNode;
import static org.assertj.core.api.Assertions.assertThat;

@EnableKubernetesMockClient(crud = true)
class ControlPlaneHealthCheckTest {

    KubernetesMockServer mockServer;
    KubernetesClient kubeClient;

    private TargetCluster targetCluster;

    @BeforeEach
    void setUp() {
        targetCluster = new TargetCluster(RemoteCluster.of(mockServer.createClient()), CertificateGenerator.generateEtcdCa(),
                new ClientCertificateGenerator(Clock.systemUTC()), new FakeEtcd());
    }

    @AfterEach
    void tearDown() {
        targetCluster.close();
    }

    @Test
    void shouldReportHealthyNodes() {
        // Given
        createHealthyControlPlaneNode(kubeClient, "cp-0");
        createHealthyControlPlaneNode(kubeClient, "cp-1");

        // When
        HealthCheckResult result = targetCluster.controlPlaneHealthCheck().check();

        // Then
        assertThat(result.nodeNames()).containsExactlyInAnyOrder("cp-0", "cp-1");
        assertThat(result.failures()).isEmpty();
    }

    @Test
    void shouldCheckOnlyControlPlaneNodes() {
        // Given
        createHealthyControlPlaneNode(kubeClient, "cp-0");
        create(kubeClient, controlPlaneNode("cp-1", "aws:///cp-1"));
        create(kubeClient, workerNode("worker-0"));

        // When
        HealthCheckResult result = targetCluster.controlPlaneHealthCheck().check();

        // Then
        assertThat(result.nodeNames()).containsExactlyInAnyOrder("cp-0", "cp-1");
        assertThat(result.errorFor("cp-0")).isEmpty();
        assertThat(result.errorFor("cp-1")).isPresent();
    }

    @Test
    void shouldReturnEmptyResultWithoutControlPlaneNodes() {
        // Given
        create(kubeClient, workerNode("worker-0"));

        // When
        HealthCheckResult result = targetCluster.controlPlaneHealthCheck().check();

        // Then
        assertThat(result.size()).isZero();
    }

    @Test
    void shouldReportMissingApiServerWithoutCheckingControllerManager() {
        // Given
        create(kubeClient, controlPlaneNode("cp-0", "aws:///cp-0"));
        create(kubeClient, staticPod(StaticPods.KUBE_CONTROLLER_MANAGER, "cp-0", "True"));

        // When
        HealthCheckResult result = targetCluster.controlPlaneHealthCheck().check();

        // Then
        assertThat(result.errorFor("cp-0")).hasValueSatisfying(e -> assertThat(e)
                .isInstanceOfSatisfying(NodeHealthException.class,
                        nhe -> assertThat(nhe.reason()).isEqualTo(NodeHealthException.Reason.POD_NOT_FOUND))
                .hasMessageContaining("kube-apiserver-cp-0"));
    }

    @Test
    void shouldReportControllerManagerNotReady() {
        // Given
        create(kubeClient, controlPlaneNode("cp-0", "aws:///cp-0"));
        create(kubeClient, staticPod(StaticPods.KUBE_APISERVER, "cp-0", "True"));
        create(kubeClient, staticPod(StaticPods.KUBE_CONTROLLER_MANAGER, "cp-0", "False"));

        // When
        HealthCheckResult result = targetCluster.controlPlaneHealthCheck().check();

        // Then
        assertThat(result.errorFor("cp-0")).hasValueSatisfying(e -> assertThat(e)
                .isInstanceOfSatisfying(NodeHealthException.class,
                        nhe -> assertThat(nhe.reason()).isEqualTo(NodeHealthException.Reason.POD_NOT_READY))
                .hasMessage("static pod kube-system/kube-controller-manager-cp-0 is not ready"));
    }

    @Test
    void shouldDistinguishMissingReadyConditionFromNotReady() {
        // Given
        create(kubeClient, controlPlaneNode("cp-0", "aws:///cp-0"));
        create(kubeClient, staticPod(StaticPods.KUBE_APISERVER, "cp-0", "True"));
        create(kubeClient, staticPod(StaticPods.KUBE_CONTROLLER_MANAGER, "cp-0", null));

        // When
        HealthCheckResult result = targetCluster.controlPlaneHealthCheck().check();

        // Then
        assertThat(result.errorFor("cp-0")).hasValueSatisfying(e -> assertThat(e)
                .isInstanceOfSatisfying(NodeHealthException.class,
                        nhe -> assertThat(nhe.reason()).isEqualTo(NodeHealthException.Reason.POD_MISSING_READY_CONDITION))
                .hasMessage("pod does not have ready condition: kube-controller-manager-cp-0"));
    }

    @Test
    void shouldLetReadyControllerManagerOverwriteApiServerNotReady() {
        // Given
        create(kubeClient, controlPlaneNode("cp-0", "aws:///cp-0"));
        create(kubeClient, staticPod(StaticPods.KUBE_APISERVER, "cp-0", "False"));
        create(kubeClient, staticPod(StaticPods.KUBE_CONTROLLER_MANAGER, "cp-0", "True"));

        // When
        HealthCheckResult result = targetCluster.controlPlaneHealthCheck().check();

        // Then
        assertThat(result.contains("cp-0")).isTrue();
        assertThat(result.errorFor("cp-0")).isEmpty();
    }

    @Test
    void shouldLetMissingControllerManagerOverwriteApiServerNotReady() {
        // Given
        create(kubeClient, controlPlaneNode("cp-0", "aws:///cp-0"));
        create(kubeClient, staticPod(StaticPods.KUBE_APISERVER, "cp-0", null));

        // When
        HealthCheckResult result = targetCluster.controlPlaneHealthCheck().check();

        // Then
        assertThat(result.errorFor("cp-0")).hasValueSatisfying(e -> assertThat(e)
                .isInstanceOfSatisfying(NodeHealthException.class,
                        nhe -> assertThat(nhe.reason()).isEqualTo(NodeHealthException.Reason.POD_NOT_FOUND))
                .hasMessageContaining("kube-controller-manager-cp-0"));
    }

    @Test
    void shouldKeepCheckingAfterUnhealthyNode() {
        // Given
        create(kubeClient, controlPlaneNode("cp-0", "aws:///cp-0"));
        createHealthyControlPlaneNode(kubeClient, "cp-1");
        createHealthyControlPlaneNode(kubeClient, "cp-2");

        // When
        HealthCheckResult result = targetCluster.controlPlaneHealthCheck().check();

        // Then
        assertThat(result.nodeNames()).containsExactlyInAnyOrder("cp-0", "cp-1", "cp-2");
        assertThat(result.failures()).containsOnlyKeys("cp-0");
    }
}

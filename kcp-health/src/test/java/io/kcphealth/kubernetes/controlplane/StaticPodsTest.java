/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.Pod;

import static io.kcphealth.kubernetes.controlplane.ClusterFixtures.staticPod;
import static org.assertj.core.api.Assertions.assertThat;

class StaticPodsTest {

    @Test
    void shouldNameStaticPodAfterComponentAndNode() {
        assertThat(StaticPods.podName(StaticPods.ETCD, "cp-0")).isEqualTo("etcd-cp-0");
        assertThat(StaticPods.podName(StaticPods.KUBE_CONTROLLER_MANAGER, "cp-1")).isEqualTo("kube-controller-manager-cp-1");
    }

    @Test
    void shouldAcceptReadyPod() {
        assertThat(StaticPods.checkReadyCondition(staticPod(StaticPods.KUBE_APISERVER, "cp-0", "True"))).isEmpty();
    }

    @Test
    void shouldReportPodWithReadyFalse() {
        // Given
        Pod pod = staticPod(StaticPods.KUBE_APISERVER, "cp-0", "False");

        // When
        Optional<NodeHealthException> problem = StaticPods.checkReadyCondition(pod);

        // Then
        assertThat(problem).hasValueSatisfying(e -> {
            assertThat(e.reason()).isEqualTo(NodeHealthException.Reason.POD_NOT_READY);
            assertThat(e).hasMessage("static pod kube-system/kube-apiserver-cp-0 is not ready");
        });
    }

    @Test
    void shouldReportPodWithUnknownReadiness() {
        assertThat(StaticPods.checkReadyCondition(staticPod(StaticPods.KUBE_APISERVER, "cp-0", "Unknown")))
                .hasValueSatisfying(e -> assertThat(e.reason()).isEqualTo(NodeHealthException.Reason.POD_NOT_READY));
    }

    @Test
    void shouldReportPodWithoutReadyCondition() {
        // Given
        Pod pod = staticPod(StaticPods.KUBE_APISERVER, "cp-0", null);

        // When
        Optional<NodeHealthException> problem = StaticPods.checkReadyCondition(pod);

        // Then
        assertThat(problem).hasValueSatisfying(e -> {
            assertThat(e.reason()).isEqualTo(NodeHealthException.Reason.POD_MISSING_READY_CONDITION);
            assertThat(e).hasMessage("pod does not have ready condition: kube-apiserver-cp-0");
        });
    }

    @Test
    void shouldReportPodWithoutStatus() {
        // Given
        Pod pod = staticPod(StaticPods.ETCD, "cp-0", "True");
        pod.setStatus(null);

        // When
        // Then
        assertThat(StaticPods.checkReadyCondition(pod))
                .hasValueSatisfying(e -> assertThat(e.reason()).isEqualTo(NodeHealthException.Reason.POD_MISSING_READY_CONDITION));
    }
}

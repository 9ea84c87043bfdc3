/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HealthCheckResultTest {

    @Test
    void shouldKeepNodesInCheckOrder() {
        // Given
        HealthCheckResult result = new HealthCheckResult();

        // When
        result.healthy("cp-2");
        result.healthy("cp-0");
        result.healthy("cp-1");

        // Then
        assertThat(result.nodeNames()).containsExactly("cp-2", "cp-0", "cp-1");
        assertThat(result.size()).isEqualTo(3);
        assertThat(result.failures()).isEmpty();
    }

    @Test
    void shouldReplaceEarlierOutcome() {
        // Given
        HealthCheckResult result = new HealthCheckResult();
        result.record("cp-0", new NodeHealthException(NodeHealthException.Reason.POD_NOT_READY, "not ready"));

        // When
        result.record("cp-0", null);

        // Then
        assertThat(result.contains("cp-0")).isTrue();
        assertThat(result.errorFor("cp-0")).isEmpty();
        assertThat(result.size()).isEqualTo(1);
    }

    @Test
    void shouldListOnlyFailures() {
        // Given
        HealthCheckResult result = new HealthCheckResult();
        NodeHealthException failure = new NodeHealthException(NodeHealthException.Reason.ETCD_ALARMS, "alarms");

        // When
        result.healthy("cp-0");
        result.record("cp-1", failure);
        result.healthy("cp-2");

        // Then
        assertThat(result.failures()).containsOnlyKeys("cp-1").containsEntry("cp-1", failure);
        assertThat(result.errorFor("cp-1")).containsSame(failure);
        assertThat(result.contains("cp-3")).isFalse();
    }
}

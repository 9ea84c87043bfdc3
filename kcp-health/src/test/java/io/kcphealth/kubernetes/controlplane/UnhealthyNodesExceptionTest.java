/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnhealthyNodesExceptionTest {

    private static final NodeHealthException NOT_READY = new NodeHealthException(NodeHealthException.Reason.POD_NOT_READY,
            "static pod kube-system/kube-apiserver-cp-0 is not ready");
    private static final NodeHealthException NO_PROVIDER_ID = new NodeHealthException(NodeHealthException.Reason.EMPTY_PROVIDER_ID,
            "empty provider ID");

    @Test
    void shouldDescribeSingleNode() {
        // Given
        // When
        var e = new UnhealthyNodesException(Map.of("cp-0", NOT_READY));

        // Then
        assertThat(e).hasMessage("node \"cp-0\": static pod kube-system/kube-apiserver-cp-0 is not ready");
    }

    @Test
    void shouldRetainEveryNodeInOrder() {
        // Given
        Map<String, Exception> errors = new LinkedHashMap<>();
        errors.put("cp-1", NO_PROVIDER_ID);
        errors.put("cp-0", NOT_READY);

        // When
        var e = new UnhealthyNodesException(errors);

        // Then
        assertThat(e.nodeErrors()).containsExactly(Map.entry("cp-1", NO_PROVIDER_ID), Map.entry("cp-0", NOT_READY));
        assertThat(e.getSuppressed()).containsExactly(NO_PROVIDER_ID, NOT_READY);
        assertThat(e).hasMessage("[node \"cp-1\": empty provider ID, node \"cp-0\": static pod kube-system/kube-apiserver-cp-0 is not ready]");
    }

    @Test
    void shouldNotBeAffectedByLaterChangesToSourceMap() {
        // Given
        Map<String, Exception> errors = new LinkedHashMap<>();
        errors.put("cp-0", NOT_READY);
        var e = new UnhealthyNodesException(errors);

        // When
        errors.put("cp-1", NO_PROVIDER_ID);

        // Then
        assertThat(e.nodeErrors()).containsOnlyKeys("cp-0");
        assertThatThrownBy(() -> e.nodeErrors().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRequireAtLeastOneNode() {
        Map<String, Exception> none = Map.of();
        assertThatThrownBy(() -> new UnhealthyNodesException(none)).isInstanceOf(IllegalArgumentException.class);
    }
}

/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.remote;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;

import io.kcphealth.kubernetes.controlplane.ClusterKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnableKubernetesMockClient(crud = true)
class KubeconfigSecretClientProviderTest {

    private static final ClusterKey CLUSTER = new ClusterKey("capi-system", "workload");

    private static final String KUBECONFIG = """
            apiVersion: v1
            kind: Config
            clusters:
            - name: workload
              cluster:
                server: https://10.0.0.1:6443
                insecure-skip-tls-verify: true
            users:
            - name: workload-admin
              user:
                token: abc123
            contexts:
            - name: workload-admin@workload
              context:
                cluster: workload
                user: workload-admin
            current-context: workload-admin@workload
            """;

    KubernetesClient kubeClient;

    @Test
    void shouldBuildClientFromKubeconfigSecret() {
        // Given
        givenSecret(KubeconfigSecretClientProvider.KUBECONFIG_KEY, encode(KUBECONFIG));
        var provider = new KubeconfigSecretClientProvider(kubeClient, Duration.ofSeconds(12));

        // When
        try (RemoteCluster remote = provider.connect(CLUSTER)) {

            // Then
            assertThat(remote.config().getMasterUrl()).startsWith("https://10.0.0.1:6443");
            assertThat(remote.config().getOauthToken()).isEqualTo("abc123");
            assertThat(remote.config().getRequestTimeout()).isEqualTo(12_000);
            assertThat(remote.client()).isNotNull();
        }
    }

    @Test
    void shouldNameSecretAfterCluster() {
        assertThat(KubeconfigSecretClientProvider.secretName(CLUSTER)).isEqualTo("workload-kubeconfig");
    }

    @Test
    void shouldFailWhenSecretMissing() {
        // Given
        var provider = new KubeconfigSecretClientProvider(kubeClient, Duration.ofSeconds(12));

        // When
        // Then
        assertThatThrownBy(() -> provider.connect(CLUSTER))
                .isInstanceOf(RemoteClusterAccessException.class)
                .hasMessage("kubeconfig secret capi-system/workload-kubeconfig not found");
    }

    @Test
    void shouldFailWhenKeyMissing() {
        // Given
        givenSecret("kubeconfig", encode(KUBECONFIG));
        var provider = new KubeconfigSecretClientProvider(kubeClient, Duration.ofSeconds(12));

        // When
        // Then
        assertThatThrownBy(() -> provider.connect(CLUSTER))
                .isInstanceOf(RemoteClusterAccessException.class)
                .hasMessage("kubeconfig secret capi-system/workload-kubeconfig has no value key");
    }

    @Test
    void shouldFailWhenValueNotBase64() {
        // Given
        givenSecret(KubeconfigSecretClientProvider.KUBECONFIG_KEY, "%%%not-base64%%%");
        var provider = new KubeconfigSecretClientProvider(kubeClient, Duration.ofSeconds(12));

        // When
        // Then
        assertThatThrownBy(() -> provider.connect(CLUSTER))
                .isInstanceOf(RemoteClusterAccessException.class)
                .hasMessageEndingWith("is not base64 encoded");
    }

    private void givenSecret(String key, String value) {
        kubeClient.secrets().inNamespace(CLUSTER.namespace()).resource(new SecretBuilder()
                .withNewMetadata()
                .withNamespace(CLUSTER.namespace())
                .withName("workload-kubeconfig")
                .endMetadata()
                .addToData(key, value)
                .build()).create();
    }

    private static String encode(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }
}

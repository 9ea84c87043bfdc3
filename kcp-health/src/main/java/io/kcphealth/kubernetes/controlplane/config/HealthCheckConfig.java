/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.config;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Deadlines applied to the network operations of a health check. They bound how long a check
 * can block when a workload cluster or one of its etcd members is unresponsive.
 *
 * @param kubernetesRequestTimeout timeout of each request to a workload cluster API server
 * @param etcdDialTimeout timeout for establishing a connection to an etcd member
 * @param etcdRequestTimeout timeout of each etcd request
 */
public record HealthCheckConfig(@JsonProperty("kubernetesRequestTimeout") @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration kubernetesRequestTimeout,
                                @JsonProperty("etcdDialTimeout") @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration etcdDialTimeout,
                                @JsonProperty("etcdRequestTimeout") @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration etcdRequestTimeout) {

    static final Duration DEFAULT_KUBERNETES_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    static final Duration DEFAULT_ETCD_DIAL_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_ETCD_REQUEST_TIMEOUT = Duration.ofSeconds(15);

    public static final HealthCheckConfig DEFAULT = new HealthCheckConfig(null, null, null);

    /**
     * Absent durations take their defaults, so the accessors never return null.
     */
    public HealthCheckConfig {
        kubernetesRequestTimeout = positive("kubernetesRequestTimeout", kubernetesRequestTimeout, DEFAULT_KUBERNETES_REQUEST_TIMEOUT);
        etcdDialTimeout = positive("etcdDialTimeout", etcdDialTimeout, DEFAULT_ETCD_DIAL_TIMEOUT);
        etcdRequestTimeout = positive("etcdRequestTimeout", etcdRequestTimeout, DEFAULT_ETCD_REQUEST_TIMEOUT);
    }

    private static Duration positive(String name, @Nullable Duration value, Duration defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, but was " + value);
        }
        return value;
    }
}

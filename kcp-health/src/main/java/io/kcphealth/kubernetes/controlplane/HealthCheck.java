/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

/**
 * A strategy for checking the control plane nodes of a workload cluster.
 * Problems with individual nodes are recorded in the returned result; a thrown
 * {@link ControlPlaneHealthException} means the check as a whole could not be completed
 * or found a cluster wide problem.
 */
@FunctionalInterface
public interface HealthCheck {

    HealthCheckResult check();
}

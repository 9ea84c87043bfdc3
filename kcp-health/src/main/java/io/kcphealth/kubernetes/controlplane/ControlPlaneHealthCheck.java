/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;

import static io.kcphealth.kubernetes.controlplane.ResourcesUtil.name;

/**
 * Checks that the API server and controller manager static pods on every control plane
 * node are ready. This is a best effort check: a node can become unhealthy right after it.
 */
class ControlPlaneHealthCheck implements HealthCheck {

    private static final Logger LOGGER = LoggerFactory.getLogger(ControlPlaneHealthCheck.class);

    private final TargetCluster cluster;

    ControlPlaneHealthCheck(TargetCluster cluster) {
        this.cluster = Objects.requireNonNull(cluster);
    }

    @Override
    public HealthCheckResult check() {
        List<Node> nodes = cluster.controlPlaneNodes();
        HealthCheckResult result = new HealthCheckResult();
        for (Node node : nodes) {
            String nodeName = name(node);
            result.healthy(nodeName);
            try {
                Pod apiServer = cluster.staticPod(StaticPods.KUBE_APISERVER, nodeName);
                result.record(nodeName, StaticPods.checkReadyCondition(apiServer).orElse(null));

                // the controller manager's outcome replaces the api server's, even when that was a failure
                Pod controllerManager = cluster.staticPod(StaticPods.KUBE_CONTROLLER_MANAGER, nodeName);
                result.record(nodeName, StaticPods.checkReadyCondition(controllerManager).orElse(null));
            }
            catch (NodeHealthException e) {
                result.record(nodeName, e);
            }
            LOGGER.atDebug()
                    .setMessage("Control plane node {}: {}")
                    .addArgument(nodeName)
                    .addArgument(() -> result.errorFor(nodeName).map(Exception::getMessage).orElse("healthy"))
                    .log();
        }
        return result;
    }
}

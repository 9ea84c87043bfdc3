/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.ObjectReference;

import io.kcphealth.kubernetes.api.v1alpha3.Machine;

/**
 * Runs a {@link HealthCheck} and cross-checks the nodes it saw against the machines owned by the control plane.
 * The same validation applies to every kind of check.
 */
public class HealthCheckOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthCheckOrchestrator.class);

    private final MachineInventory inventory;

    public HealthCheckOrchestrator(MachineInventory inventory) {
        this.inventory = Objects.requireNonNull(inventory);
    }

    /**
     * Returns normally only if every checked node is healthy and the checked nodes match the owned machines one to one.
     *
     * @param check the check to run
     * @param clusterKey the cluster
     * @param controlPlaneName name of the control plane owning the machines
     * @throws UnhealthyNodesException if any node failed the check
     * @throws InconsistentClusterStateException if the checked nodes and the owned machines disagree
     */
    public void run(HealthCheck check, ClusterKey clusterKey, String controlPlaneName) {
        HealthCheckResult result = check.check();

        Map<String, Exception> failures = result.failures();
        if (!failures.isEmpty()) {
            LOGGER.atDebug()
                    .setMessage("Cluster {} has unhealthy control plane nodes: {}")
                    .addArgument(clusterKey)
                    .addArgument(failures.keySet())
                    .log();
            throw new UnhealthyNodesException(failures);
        }

        List<Machine> machines = inventory.machines(clusterKey, MachineFilters.ownedControlPlaneMachines(controlPlaneName));
        for (Machine machine : machines) {
            ObjectReference nodeRef = machine.getStatus() == null ? null : machine.getStatus().getNodeRef();
            if (nodeRef == null) {
                throw new InconsistentClusterStateException(String.format("control plane machine %s has no status.nodeRef",
                        ResourcesUtil.namespacedName(machine)));
            }
            if (!result.contains(nodeRef.getName())) {
                throw new InconsistentClusterStateException(String.format("machine's (%s) node (%s) was not checked",
                        ResourcesUtil.namespacedName(machine), nodeRef.getName()));
            }
        }

        if (result.size() != machines.size()) {
            throw new InconsistentClusterStateException(String.format("number of nodes and machines in namespace %s did not match: %d nodes %d machines",
                    clusterKey.namespace(), result.size(), machines.size()));
        }
        LOGGER.atDebug()
                .setMessage("Cluster {} control plane {} passed with nodes {}")
                .addArgument(clusterKey)
                .addArgument(controlPlaneName)
                .addArgument(result.nodeNames())
                .log();
    }
}

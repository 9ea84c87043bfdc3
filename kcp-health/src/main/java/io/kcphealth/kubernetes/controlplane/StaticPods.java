/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.fabric8.kubernetes.api.model.PodStatus;

import static io.kcphealth.kubernetes.controlplane.ResourcesUtil.name;
import static io.kcphealth.kubernetes.controlplane.ResourcesUtil.namespace;

/**
 * Naming and readiness of the static pods kubeadm runs on each control plane node.
 */
public class StaticPods {

    public static final String NAMESPACE = "kube-system";
    public static final String KUBE_APISERVER = "kube-apiserver";
    public static final String KUBE_CONTROLLER_MANAGER = "kube-controller-manager";
    public static final String ETCD = "etcd";

    static final String READY_CONDITION = "Ready";
    static final String CONDITION_TRUE = "True";

    private StaticPods() {
    }

    /**
     * @param component the control plane component, e.g. {@value #ETCD}
     * @param nodeName the node the pod is bound to
     * @return the name the kubelet gives the component's mirror pod
     */
    public static String podName(String component, String nodeName) {
        return component + "-" + nodeName;
    }

    /**
     * Checks the pod's {@code Ready} condition.
     *
     * @param pod the pod
     * @return empty if the pod is ready, otherwise the problem
     */
    public static Optional<NodeHealthException> checkReadyCondition(Pod pod) {
        List<PodCondition> conditions = Optional.ofNullable(pod.getStatus())
                .map(PodStatus::getConditions)
                .orElse(List.of());
        boolean found = false;
        for (PodCondition condition : conditions) {
            if (READY_CONDITION.equals(condition.getType())) {
                found = true;
                if (!CONDITION_TRUE.equals(condition.getStatus())) {
                    return Optional.of(new NodeHealthException(NodeHealthException.Reason.POD_NOT_READY,
                            "static pod " + namespace(pod) + "/" + name(pod) + " is not ready"));
                }
            }
        }
        if (!found) {
            return Optional.of(new NodeHealthException(NodeHealthException.Reason.POD_MISSING_READY_CONDITION,
                    "pod does not have ready condition: " + name(pod)));
        }
        return Optional.empty();
    }
}

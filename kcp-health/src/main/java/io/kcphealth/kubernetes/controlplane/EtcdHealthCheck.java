/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Node;

import io.kcphealth.kubernetes.controlplane.certs.EtcdTlsBundle;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdClient;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdClientException;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdMember;

import static io.kcphealth.kubernetes.controlplane.ResourcesUtil.name;

/**
 * Checks the etcd member on every control plane node.
 * <p>
 * Each member is queried through its own tunnel. A member that answers a member list request
 * is part of a cluster with quorum. Across the whole pass every member must report the same
 * cluster ID and the same member set, and the number of members must equal the number of
 * control plane nodes.
 * </p>
 */
class EtcdHealthCheck implements HealthCheck {

    private static final Logger LOGGER = LoggerFactory.getLogger(EtcdHealthCheck.class);

    private final TargetCluster cluster;

    EtcdHealthCheck(TargetCluster cluster) {
        this.cluster = Objects.requireNonNull(cluster);
    }

    @Override
    public HealthCheckResult check() {
        List<Node> nodes = cluster.controlPlaneNodes();
        EtcdTlsBundle tls = cluster.etcdTlsBundle();
        HealthCheckResult result = new HealthCheckResult();
        MembershipTracker tracker = new MembershipTracker();

        for (Node node : nodes) {
            String nodeName = name(node);
            result.healthy(nodeName);
            result.record(nodeName, checkNode(node, tls, tracker).orElse(null));
        }

        int memberCount = tracker.memberCount();
        if (nodes.size() != memberCount) {
            throw new InconsistentClusterStateException(
                    String.format("there are %d control plane nodes, but %d etcd members", nodes.size(), memberCount));
        }
        return result;
    }

    private Optional<NodeHealthException> checkNode(Node node, EtcdTlsBundle tls, MembershipTracker tracker) {
        String nodeName = name(node);
        String providerId = node.getSpec() == null ? null : node.getSpec().getProviderID();
        if (providerId == null || providerId.isEmpty()) {
            return Optional.of(new NodeHealthException(NodeHealthException.Reason.EMPTY_PROVIDER_ID, "empty provider ID"));
        }

        List<EtcdMember> members;
        try (EtcdClient etcd = cluster.etcdClientFor(nodeName, tls)) {
            try {
                members = etcd.members();
            }
            catch (EtcdClientException e) {
                return Optional.of(new NodeHealthException(NodeHealthException.Reason.ETCD_MEMBER_LIST_FAILED,
                        "failed to list etcd members using etcd client", e));
            }
        }
        catch (EtcdClientException e) {
            return Optional.of(new NodeHealthException(NodeHealthException.Reason.ETCD_CONNECTION_FAILED,
                    "failed to create etcd client", e));
        }
        LOGGER.atDebug()
                .setMessage("etcd on node {} reports members {}")
                .addArgument(nodeName)
                .addArgument(members)
                .log();

        Optional<EtcdMember> self = EtcdMember.memberForName(members, nodeName);
        if (self.isEmpty()) {
            return Optional.of(new NodeHealthException(NodeHealthException.Reason.ETCD_MEMBER_NOT_FOUND,
                    "etcd member for node " + nodeName + " not found in member list"));
        }
        EtcdMember member = self.get();
        if (!member.alarms().isEmpty()) {
            return Optional.of(new NodeHealthException(NodeHealthException.Reason.ETCD_ALARMS,
                    "etcd member reports alarms: " + member.alarms()));
        }

        Optional<NodeHealthException> clusterIdError = tracker.checkClusterId(member.clusterId());
        if (clusterIdError.isPresent()) {
            return clusterIdError;
        }
        return tracker.checkMemberIds(EtcdMember.memberIds(members));
    }

    /**
     * The cluster ID and member set reported by the first member checked, which later members are compared with.
     */
    private static final class MembershipTracker {
        private Optional<Long> knownClusterId = Optional.empty();
        private Optional<Set<Long>> knownMemberIds = Optional.empty();

        Optional<NodeHealthException> checkClusterId(long clusterId) {
            if (knownClusterId.isEmpty()) {
                knownClusterId = Optional.of(clusterId);
                return Optional.empty();
            }
            long known = knownClusterId.get();
            if (known != clusterId) {
                return Optional.of(new NodeHealthException(NodeHealthException.Reason.ETCD_CLUSTER_ID_MISMATCH,
                        String.format("etcd cluster ID %x did not match the known cluster ID %x; the etcd cluster may be split",
                                clusterId, known)));
            }
            return Optional.empty();
        }

        Optional<NodeHealthException> checkMemberIds(Set<Long> memberIds) {
            if (knownMemberIds.isEmpty()) {
                knownMemberIds = Optional.of(memberIds);
                return Optional.empty();
            }
            Set<Long> known = knownMemberIds.get();
            if (!known.equals(memberIds)) {
                return Optional.of(new NodeHealthException(NodeHealthException.Reason.ETCD_MEMBER_SET_MISMATCH,
                        "etcd member IDs " + hex(memberIds) + " do not match the known member IDs " + hex(known)
                                + "; etcd members disagree about cluster membership"));
            }
            return Optional.empty();
        }

        int memberCount() {
            return knownMemberIds.map(Set::size).orElse(0);
        }

        private static List<String> hex(Set<Long> ids) {
            return ids.stream().sorted().map(Long::toHexString).toList();
        }
    }
}

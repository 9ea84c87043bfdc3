/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.etcd;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An etcd member as reported by one etcd endpoint.
 *
 * @param id member ID
 * @param name member name; kubeadm names members after their node
 * @param clusterId ID of the cluster the reporting endpoint belongs to
 * @param alarms names of the alarms raised against the member, empty if none
 */
public record EtcdMember(long id, String name, long clusterId, List<String> alarms) {

    public EtcdMember {
        Objects.requireNonNull(name);
        alarms = List.copyOf(alarms);
    }

    public static Optional<EtcdMember> memberForName(Collection<EtcdMember> members, String name) {
        return members.stream().filter(member -> member.name().equals(name)).findFirst();
    }

    public static Set<Long> memberIds(Collection<EtcdMember> members) {
        return members.stream().map(EtcdMember::id).collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String toString() {
        return "EtcdMember(id=" + Long.toHexString(id) + ", name=" + name + ", clusterId=" + Long.toHexString(clusterId) + ", alarms=" + alarms + ")";
    }
}

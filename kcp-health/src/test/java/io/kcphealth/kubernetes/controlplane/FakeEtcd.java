/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import io.kcphealth.kubernetes.controlplane.certs.EtcdTlsBundle;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdClient;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdClientException;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdClientFactory;
import io.kcphealth.kubernetes.controlplane.etcd.EtcdMember;
import io.kcphealth.kubernetes.controlplane.remote.RemoteCluster;

/**
 * Stands in for the tunnelled etcd endpoints of a cluster. Each node's endpoint answers with the
 * member list configured for it.
 */
public class FakeEtcd implements EtcdClientFactory {

    private final Map<String, List<EtcdMember>> memberViews = new HashMap<>();
    private final Map<String, RuntimeException> dialFailures = new HashMap<>();
    private final Map<String, RuntimeException> listFailures = new HashMap<>();
    private final List<String> dialled = new CopyOnWriteArrayList<>();
    private final List<String> closed = new CopyOnWriteArrayList<>();

    public static EtcdMember member(long id, String name, long clusterId, String... alarms) {
        return new EtcdMember(id, name, clusterId, List.of(alarms));
    }

    /**
     * Every listed node sees the same healthy members, one per node, in cluster {@code clusterId}.
     */
    public static FakeEtcd consistent(long clusterId, String... nodeNames) {
        List<EtcdMember> members = new ArrayList<>();
        for (int i = 0; i < nodeNames.length; i++) {
            members.add(member(i + 1, nodeNames[i], clusterId));
        }
        FakeEtcd etcd = new FakeEtcd();
        for (String nodeName : nodeNames) {
            etcd.memberView(nodeName, members);
        }
        return etcd;
    }

    public FakeEtcd memberView(String nodeName, List<EtcdMember> members) {
        memberViews.put(nodeName, List.copyOf(members));
        return this;
    }

    public FakeEtcd failDial(String nodeName, RuntimeException failure) {
        dialFailures.put(nodeName, failure);
        return this;
    }

    public FakeEtcd failMemberList(String nodeName, RuntimeException failure) {
        listFailures.put(nodeName, failure);
        return this;
    }

    /**
     * @return the nodes whose etcd was dialled, in dial order
     */
    public List<String> dialled() {
        return List.copyOf(dialled);
    }

    public Set<String> closed() {
        return Set.copyOf(closed);
    }

    @Override
    public EtcdClient newClient(RemoteCluster cluster, String nodeName, EtcdTlsBundle tls) {
        dialled.add(nodeName);
        RuntimeException dialFailure = dialFailures.get(nodeName);
        if (dialFailure != null) {
            throw dialFailure;
        }
        if (!memberViews.containsKey(nodeName) && !listFailures.containsKey(nodeName)) {
            throw new EtcdClientException("failed to open tunnel to kube-system/etcd-" + nodeName + ":2379",
                    new IllegalStateException("pods \"etcd-" + nodeName + "\" not found"));
        }
        return new EtcdClient() {
            @Override
            public List<EtcdMember> members() {
                RuntimeException listFailure = listFailures.get(nodeName);
                if (listFailure != null) {
                    throw listFailure;
                }
                return memberViews.get(nodeName);
            }

            @Override
            public void close() {
                closed.add(nodeName);
            }
        };
    }
}

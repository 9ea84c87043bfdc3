/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.etcd;

import io.kcphealth.kubernetes.controlplane.certs.EtcdTlsBundle;
import io.kcphealth.kubernetes.controlplane.remote.RemoteCluster;

/**
 * Creates clients for the etcd member running on a particular control plane node.
 */
@FunctionalInterface
public interface EtcdClientFactory {

    /**
     * @param cluster the workload cluster
     * @param nodeName the control plane node whose etcd member to connect to
     * @param tls client identity and trust for the etcd connection
     * @return a client, which the caller must close
     * @throws EtcdClientException if the client could not be created
     */
    EtcdClient newClient(RemoteCluster cluster, String nodeName, EtcdTlsBundle tls);
}

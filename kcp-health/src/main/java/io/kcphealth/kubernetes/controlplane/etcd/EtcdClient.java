/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.etcd;

import java.util.List;

/**
 * The etcd operations the health checks need, against a single etcd endpoint.
 */
public interface EtcdClient extends AutoCloseable {

    /**
     * Lists the cluster members with their alarms. Listing members is a linearized request,
     * so a response shows the endpoint is part of a cluster with quorum.
     *
     * @return the members as seen by this endpoint
     * @throws EtcdClientException if etcd could not be queried
     */
    List<EtcdMember> members();

    @Override
    void close();
}

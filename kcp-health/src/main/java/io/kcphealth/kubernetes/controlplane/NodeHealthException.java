/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A problem observed on a single control plane node. Checks record these in their
 * {@link HealthCheckResult} rather than throwing them, so one bad node does not stop the
 * remaining nodes from being checked.
 */
public class NodeHealthException extends ControlPlaneHealthException {

    public enum Reason {
        EMPTY_PROVIDER_ID,
        POD_NOT_FOUND,
        POD_LOOKUP_FAILED,
        POD_MISSING_READY_CONDITION,
        POD_NOT_READY,
        ETCD_CONNECTION_FAILED,
        ETCD_MEMBER_LIST_FAILED,
        ETCD_MEMBER_NOT_FOUND,
        ETCD_ALARMS,
        ETCD_CLUSTER_ID_MISMATCH,
        ETCD_MEMBER_SET_MISMATCH
    }

    private final Reason reason;

    public NodeHealthException(Reason reason, String message) {
        this(reason, message, null);
    }

    public NodeHealthException(Reason reason, String message, @Nullable Throwable cause) {
        super(cause == null ? message : message + ": " + cause.getMessage(), cause);
        this.reason = Objects.requireNonNull(reason);
    }

    public Reason reason() {
        return reason;
    }
}

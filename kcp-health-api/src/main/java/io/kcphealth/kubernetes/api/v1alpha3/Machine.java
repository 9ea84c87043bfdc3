/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.api.v1alpha3;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * A Cluster API {@code Machine}: the management cluster's record of one instance
 * belonging to a workload cluster. Only the fields read by the health checks are modelled;
 * anything else in the served object is ignored on deserialization.
 */
@Group(Machine.GROUP)
@Version(Machine.VERSION)
@Kind("Machine")
@Plural("machines")
public class Machine extends CustomResource<MachineSpec, MachineStatus> implements Namespaced {

    public static final String GROUP = "cluster.x-k8s.io";
    public static final String VERSION = "v1alpha3";

    @Override
    protected MachineSpec initSpec() {
        return new MachineSpec();
    }

    @Override
    protected MachineStatus initStatus() {
        return new MachineStatus();
    }
}

/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.api.v1alpha3;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.fabric8.kubernetes.api.model.KubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectReference;

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MachineStatus implements KubernetesResource {

    @JsonProperty("nodeRef")
    @Nullable
    private ObjectReference nodeRef;

    @JsonProperty("phase")
    @Nullable
    private String phase;

    /**
     * @return a reference to the workload cluster {@code Node} backing this machine,
     * or null if the machine has not been matched to a node yet
     */
    @Nullable
    public ObjectReference getNodeRef() {
        return nodeRef;
    }

    public void setNodeRef(@Nullable ObjectReference nodeRef) {
        this.nodeRef = nodeRef;
    }

    @Nullable
    public String getPhase() {
        return phase;
    }

    public void setPhase(@Nullable String phase) {
        this.phase = phase;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MachineStatus that)) {
            return false;
        }
        return Objects.equals(nodeRef, that.nodeRef) && Objects.equals(phase, that.phase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeRef, phase);
    }

    @Override
    public String toString() {
        return "MachineStatus(nodeRef=" + nodeRef + ", phase=" + phase + ")";
    }
}

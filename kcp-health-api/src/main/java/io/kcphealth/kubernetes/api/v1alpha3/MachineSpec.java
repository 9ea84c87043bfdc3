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

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MachineSpec implements KubernetesResource {

    @JsonProperty("clusterName")
    private String clusterName;

    @JsonProperty("providerID")
    @Nullable
    private String providerID;

    @JsonProperty("version")
    @Nullable
    private String version;

    public String getClusterName() {
        return clusterName;
    }

    public void setClusterName(String clusterName) {
        this.clusterName = clusterName;
    }

    /**
     * @return the identifier the infrastructure provider assigned to the instance, if it has one yet
     */
    @Nullable
    public String getProviderID() {
        return providerID;
    }

    public void setProviderID(@Nullable String providerID) {
        this.providerID = providerID;
    }

    @Nullable
    public String getVersion() {
        return version;
    }

    public void setVersion(@Nullable String version) {
        this.version = version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MachineSpec that)) {
            return false;
        }
        return Objects.equals(clusterName, that.clusterName)
                && Objects.equals(providerID, that.providerID)
                && Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clusterName, providerID, version);
    }

    @Override
    public String toString() {
        return "MachineSpec(clusterName=" + clusterName + ", providerID=" + providerID + ", version=" + version + ")";
    }
}

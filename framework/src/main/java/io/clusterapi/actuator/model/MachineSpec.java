// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import java.util.ArrayList;
import java.util.List;

import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Taint;
import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "The desired state of a machine.")
public class MachineSpec {

  @ApiModelProperty("Labels and annotations to propagate to the node backing the machine.")
  private V1ObjectMeta metadata;

  @ApiModelProperty("Taints to apply to the node backing the machine.")
  private List<V1Taint> taints;

  @ApiModelProperty("The cloud provider's identifier for the instance backing the machine.")
  private String providerID;

  @ApiModelProperty("Provider-specific configuration used to create the instance.")
  private ProviderSpec providerSpec = new ProviderSpec();

  public MachineSpec metadata(V1ObjectMeta metadata) {
    this.metadata = metadata;
    return this;
  }

  public V1ObjectMeta getMetadata() {
    return metadata;
  }

  public void setMetadata(V1ObjectMeta metadata) {
    this.metadata = metadata;
  }

  /**
   * Adds a taint to the node backing the machine.
   *
   * @param taint the taint
   * @return this object
   */
  public MachineSpec addTaintsItem(V1Taint taint) {
    if (taints == null) {
      taints = new ArrayList<>();
    }
    taints.add(taint);
    return this;
  }

  public List<V1Taint> getTaints() {
    return taints;
  }

  public void setTaints(List<V1Taint> taints) {
    this.taints = taints;
  }

  public String getProviderID() {
    return providerID;
  }

  public void setProviderID(String providerID) {
    this.providerID = providerID;
  }

  public MachineSpec providerSpec(ProviderSpec providerSpec) {
    this.providerSpec = providerSpec;
    return this;
  }

  public ProviderSpec getProviderSpec() {
    return providerSpec;
  }

  public void setProviderSpec(ProviderSpec providerSpec) {
    this.providerSpec = providerSpec;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("metadata", metadata)
        .append("taints", taints)
        .append("providerID", providerID)
        .append("providerSpec", providerSpec)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MachineSpec)) {
      return false;
    }
    MachineSpec rhs = (MachineSpec) other;
    return new EqualsBuilder()
        .append(metadata, rhs.metadata)
        .append(taints, rhs.taints)
        .append(providerID, rhs.providerID)
        .append(providerSpec, rhs.providerSpec)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(metadata)
        .append(taints)
        .append(providerID)
        .append(providerSpec)
        .toHashCode();
  }
}

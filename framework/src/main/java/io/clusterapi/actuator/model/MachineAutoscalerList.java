// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import java.util.ArrayList;
import java.util.List;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.openapi.models.V1ListMeta;
import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "MachineAutoscalerList is a list of MachineAutoscalers.")
public class MachineAutoscalerList implements KubernetesListObject {

  @ApiModelProperty("The API version for the MachineAutoscaler.")
  private String apiVersion;

  @ApiModelProperty("The type of resource. Must be 'MachineAutoscalerList'.")
  private String kind;

  @ApiModelProperty("Standard list metadata.")
  private V1ListMeta metadata;

  @ApiModelProperty("List of MachineAutoscalers.")
  private List<MachineAutoscaler> items = new ArrayList<>();

  @Override
  public String getApiVersion() {
    return apiVersion;
  }

  public void setApiVersion(String apiVersion) {
    this.apiVersion = apiVersion;
  }

  @Override
  public String getKind() {
    return kind;
  }

  public void setKind(String kind) {
    this.kind = kind;
  }

  @Override
  public V1ListMeta getMetadata() {
    return metadata;
  }

  public void setMetadata(V1ListMeta metadata) {
    this.metadata = metadata;
  }

  public MachineAutoscalerList items(List<MachineAutoscaler> items) {
    this.items = items;
    return this;
  }

  @Override
  public List<MachineAutoscaler> getItems() {
    return items;
  }

  public void setItems(List<MachineAutoscaler> items) {
    this.items = items;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("apiVersion", apiVersion)
        .append("kind", kind)
        .append("metadata", metadata)
        .append("items", items)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MachineAutoscalerList)) {
      return false;
    }
    MachineAutoscalerList rhs = (MachineAutoscalerList) other;
    return new EqualsBuilder()
        .append(metadata, rhs.metadata)
        .append(kind, rhs.kind)
        .append(apiVersion, rhs.apiVersion)
        .append(items, rhs.items)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(metadata)
        .append(kind)
        .append(apiVersion)
        .append(items)
        .toHashCode();
  }
}

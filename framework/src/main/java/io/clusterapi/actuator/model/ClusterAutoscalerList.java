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

@ApiModel(description = "ClusterAutoscalerList is a list of ClusterAutoscalers.")
public class ClusterAutoscalerList implements KubernetesListObject {

  @ApiModelProperty("The API version for the ClusterAutoscaler.")
  private String apiVersion;

  @ApiModelProperty("The type of resource. Must be 'ClusterAutoscalerList'.")
  private String kind;

  @ApiModelProperty("Standard list metadata.")
  private V1ListMeta metadata;

  @ApiModelProperty("List of ClusterAutoscalers.")
  private List<ClusterAutoscaler> items = new ArrayList<>();

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

  public ClusterAutoscalerList items(List<ClusterAutoscaler> items) {
    this.items = items;
    return this;
  }

  @Override
  public List<ClusterAutoscaler> getItems() {
    return items;
  }

  public void setItems(List<ClusterAutoscaler> items) {
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
    if (!(other instanceof ClusterAutoscalerList)) {
      return false;
    }
    ClusterAutoscalerList rhs = (ClusterAutoscalerList) other;
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

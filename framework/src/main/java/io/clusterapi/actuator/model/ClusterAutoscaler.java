// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "Cluster-wide configuration of the cluster autoscaler. Only the instance named 'default' is honored.")
public class ClusterAutoscaler implements KubernetesObject {

  @ApiModelProperty("The API version. Must be 'autoscaling.openshift.io/v1'.")
  private String apiVersion;

  @ApiModelProperty("The type of the REST resource. Must be 'ClusterAutoscaler'.")
  private String kind;

  @ApiModelProperty("The resource metadata.")
  private V1ObjectMeta metadata = new V1ObjectMeta();

  @ApiModelProperty("Scale-down behavior and resource limits.")
  private ClusterAutoscalerSpec spec = new ClusterAutoscalerSpec();

  public ClusterAutoscaler apiVersion(String apiVersion) {
    this.apiVersion = apiVersion;
    return this;
  }

  @Override
  public String getApiVersion() {
    return apiVersion;
  }

  public void setApiVersion(String apiVersion) {
    this.apiVersion = apiVersion;
  }

  public ClusterAutoscaler kind(String kind) {
    this.kind = kind;
    return this;
  }

  @Override
  public String getKind() {
    return kind;
  }

  public void setKind(String kind) {
    this.kind = kind;
  }

  public ClusterAutoscaler metadata(V1ObjectMeta metadata) {
    this.metadata = metadata;
    return this;
  }

  @Override
  public V1ObjectMeta getMetadata() {
    return metadata;
  }

  public void setMetadata(V1ObjectMeta metadata) {
    this.metadata = metadata;
  }

  public ClusterAutoscaler spec(ClusterAutoscalerSpec spec) {
    this.spec = spec;
    return this;
  }

  public ClusterAutoscalerSpec getSpec() {
    return spec;
  }

  public void setSpec(ClusterAutoscalerSpec spec) {
    this.spec = spec;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("apiVersion", apiVersion)
        .append("kind", kind)
        .append("metadata", metadata)
        .append("spec", spec)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    ClusterAutoscaler rhs = (ClusterAutoscaler) other;
    return new EqualsBuilder()
        .append(apiVersion, rhs.apiVersion)
        .append(kind, rhs.kind)
        .append(metadata, rhs.metadata)
        .append(spec, rhs.spec)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder(17, 37)
        .append(apiVersion)
        .append(kind)
        .append(metadata)
        .append(spec)
        .toHashCode();
  }
}

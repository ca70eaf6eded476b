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

@ApiModel(description = "Scales one machine set between a minimum and a maximum replica count.")
public class MachineAutoscaler implements KubernetesObject {

  @ApiModelProperty("The API version. Must be 'autoscaling.openshift.io/v1beta1'.")
  private String apiVersion;

  @ApiModelProperty("The type of the REST resource. Must be 'MachineAutoscaler'.")
  private String kind;

  @ApiModelProperty("The resource metadata.")
  private V1ObjectMeta metadata = new V1ObjectMeta();

  @ApiModelProperty("The replica bounds and the machine set to scale.")
  private MachineAutoscalerSpec spec = new MachineAutoscalerSpec();

  public MachineAutoscaler apiVersion(String apiVersion) {
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

  public MachineAutoscaler kind(String kind) {
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

  public MachineAutoscaler metadata(V1ObjectMeta metadata) {
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

  public MachineAutoscaler spec(MachineAutoscalerSpec spec) {
    this.spec = spec;
    return this;
  }

  public MachineAutoscalerSpec getSpec() {
    return spec;
  }

  public void setSpec(MachineAutoscalerSpec spec) {
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
    MachineAutoscaler rhs = (MachineAutoscaler) other;
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

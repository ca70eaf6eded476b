// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import java.util.Optional;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1ObjectReference;
import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "A Machine API machine: the declared intent for one cluster node.")
public class Machine implements KubernetesObject {

  @ApiModelProperty("The API version. Must be 'machine.openshift.io/v1beta1'.")
  private String apiVersion;

  @ApiModelProperty("The type of the REST resource. Must be 'Machine'.")
  private String kind;

  @ApiModelProperty("The resource metadata. Must include the `name` and `namespace`.")
  private V1ObjectMeta metadata = new V1ObjectMeta();

  @ApiModelProperty("The desired state of the machine.")
  private MachineSpec spec = new MachineSpec();

  @ApiModelProperty("The observed state of the machine. Updated by the machine controller.")
  private MachineStatus status;

  /**
   * Returns the name of the node backing this machine, if the machine controller has linked one.
   *
   * @return the node name or empty
   */
  public Optional<String> getNodeName() {
    return Optional.ofNullable(status).map(MachineStatus::getNodeRef).map(V1ObjectReference::getName);
  }

  public Machine apiVersion(String apiVersion) {
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

  public Machine kind(String kind) {
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

  public Machine metadata(V1ObjectMeta metadata) {
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

  public Machine spec(MachineSpec spec) {
    this.spec = spec;
    return this;
  }

  public MachineSpec getSpec() {
    return spec;
  }

  public void setSpec(MachineSpec spec) {
    this.spec = spec;
  }

  public Machine status(MachineStatus status) {
    this.status = status;
    return this;
  }

  public MachineStatus getStatus() {
    return status;
  }

  public void setStatus(MachineStatus status) {
    this.status = status;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("apiVersion", apiVersion)
        .append("kind", kind)
        .append("metadata", metadata)
        .append("spec", spec)
        .append("status", status)
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
    Machine rhs = (Machine) other;
    return new EqualsBuilder()
        .append(apiVersion, rhs.apiVersion)
        .append(kind, rhs.kind)
        .append(metadata, rhs.metadata)
        .append(spec, rhs.spec)
        .append(status, rhs.status)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder(17, 37)
        .append(apiVersion)
        .append(kind)
        .append(metadata)
        .append(spec)
        .append(status)
        .toHashCode();
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import java.util.Optional;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "The status reported by one of the cluster's operators.")
public class ClusterOperator implements KubernetesObject {

  @ApiModelProperty("The API version. Must be 'config.openshift.io/v1'.")
  private String apiVersion;

  @ApiModelProperty("The type of the REST resource. Must be 'ClusterOperator'.")
  private String kind;

  @ApiModelProperty("The resource metadata.")
  private V1ObjectMeta metadata = new V1ObjectMeta();

  @ApiModelProperty("The conditions reported by the operator.")
  private ClusterOperatorStatus status;

  /**
   * Returns the condition of the given type, if reported.
   *
   * @param type the condition type, such as Available or Degraded
   * @return the condition or empty
   */
  public Optional<ClusterOperatorStatusCondition> getCondition(String type) {
    return Optional.ofNullable(status)
        .map(ClusterOperatorStatus::getConditions)
        .flatMap(conditions -> conditions.stream().filter(c -> type.equals(c.getType())).findFirst());
  }

  public ClusterOperator apiVersion(String apiVersion) {
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

  public ClusterOperator kind(String kind) {
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

  public ClusterOperator metadata(V1ObjectMeta metadata) {
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

  public ClusterOperator status(ClusterOperatorStatus status) {
    this.status = status;
    return this;
  }

  public ClusterOperatorStatus getStatus() {
    return status;
  }

  public void setStatus(ClusterOperatorStatus status) {
    this.status = status;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("apiVersion", apiVersion)
        .append("kind", kind)
        .append("metadata", metadata)
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
    ClusterOperator rhs = (ClusterOperator) other;
    return new EqualsBuilder()
        .append(apiVersion, rhs.apiVersion)
        .append(kind, rhs.kind)
        .append(metadata, rhs.metadata)
        .append(status, rhs.status)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder(17, 37)
        .append(apiVersion)
        .append(kind)
        .append(metadata)
        .append(status)
        .toHashCode();
  }
}

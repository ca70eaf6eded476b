// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "The configuration of the cluster autoscaler.")
public class ClusterAutoscalerSpec {

  @ApiModelProperty("Controls how and when nodes are removed.")
  private ScaleDownConfig scaleDown;

  @ApiModelProperty("Caps on the total size of the cluster.")
  private ResourceLimits resourceLimits;

  public ClusterAutoscalerSpec scaleDown(ScaleDownConfig scaleDown) {
    this.scaleDown = scaleDown;
    return this;
  }

  public ScaleDownConfig getScaleDown() {
    return scaleDown;
  }

  public void setScaleDown(ScaleDownConfig scaleDown) {
    this.scaleDown = scaleDown;
  }

  public ClusterAutoscalerSpec resourceLimits(ResourceLimits resourceLimits) {
    this.resourceLimits = resourceLimits;
    return this;
  }

  public ResourceLimits getResourceLimits() {
    return resourceLimits;
  }

  public void setResourceLimits(ResourceLimits resourceLimits) {
    this.resourceLimits = resourceLimits;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("scaleDown", scaleDown)
        .append("resourceLimits", resourceLimits)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ClusterAutoscalerSpec)) {
      return false;
    }
    ClusterAutoscalerSpec rhs = (ClusterAutoscalerSpec) other;
    return new EqualsBuilder()
        .append(scaleDown, rhs.scaleDown)
        .append(resourceLimits, rhs.resourceLimits)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(scaleDown)
        .append(resourceLimits)
        .toHashCode();
  }
}

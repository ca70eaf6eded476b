// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "The replica bounds of a machine autoscaler.")
public class MachineAutoscalerSpec {

  @ApiModelProperty("The lower bound on the target's replicas.")
  private Integer minReplicas;

  @ApiModelProperty("The upper bound on the target's replicas.")
  private Integer maxReplicas;

  @ApiModelProperty("The machine set to scale.")
  private CrossVersionObjectReference scaleTargetRef;

  public MachineAutoscalerSpec minReplicas(Integer minReplicas) {
    this.minReplicas = minReplicas;
    return this;
  }

  public Integer getMinReplicas() {
    return minReplicas;
  }

  public void setMinReplicas(Integer minReplicas) {
    this.minReplicas = minReplicas;
  }

  public MachineAutoscalerSpec maxReplicas(Integer maxReplicas) {
    this.maxReplicas = maxReplicas;
    return this;
  }

  public Integer getMaxReplicas() {
    return maxReplicas;
  }

  public void setMaxReplicas(Integer maxReplicas) {
    this.maxReplicas = maxReplicas;
  }

  public MachineAutoscalerSpec scaleTargetRef(CrossVersionObjectReference scaleTargetRef) {
    this.scaleTargetRef = scaleTargetRef;
    return this;
  }

  public CrossVersionObjectReference getScaleTargetRef() {
    return scaleTargetRef;
  }

  public void setScaleTargetRef(CrossVersionObjectReference scaleTargetRef) {
    this.scaleTargetRef = scaleTargetRef;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("minReplicas", minReplicas)
        .append("maxReplicas", maxReplicas)
        .append("scaleTargetRef", scaleTargetRef)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MachineAutoscalerSpec)) {
      return false;
    }
    MachineAutoscalerSpec rhs = (MachineAutoscalerSpec) other;
    return new EqualsBuilder()
        .append(minReplicas, rhs.minReplicas)
        .append(maxReplicas, rhs.maxReplicas)
        .append(scaleTargetRef, rhs.scaleTargetRef)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(minReplicas)
        .append(maxReplicas)
        .append(scaleTargetRef)
        .toHashCode();
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "The observed state of a machine set.")
public class MachineSetStatus {

  @ApiModelProperty("The number of machines currently owned by the machine set.")
  private Integer replicas;

  @ApiModelProperty("The number of machines whose labels match the template labels.")
  private Integer fullyLabeledReplicas;

  @ApiModelProperty("The number of machines whose node is ready.")
  private Integer readyReplicas;

  @ApiModelProperty("The number of machines whose node has been ready for the minimum ready time.")
  private Integer availableReplicas;

  @ApiModelProperty("The generation of the machine set most recently observed by the controller.")
  private Long observedGeneration;

  public MachineSetStatus replicas(Integer replicas) {
    this.replicas = replicas;
    return this;
  }

  public Integer getReplicas() {
    return replicas;
  }

  public void setReplicas(Integer replicas) {
    this.replicas = replicas;
  }

  public Integer getFullyLabeledReplicas() {
    return fullyLabeledReplicas;
  }

  public void setFullyLabeledReplicas(Integer fullyLabeledReplicas) {
    this.fullyLabeledReplicas = fullyLabeledReplicas;
  }

  public MachineSetStatus readyReplicas(Integer readyReplicas) {
    this.readyReplicas = readyReplicas;
    return this;
  }

  public Integer getReadyReplicas() {
    return readyReplicas;
  }

  public void setReadyReplicas(Integer readyReplicas) {
    this.readyReplicas = readyReplicas;
  }

  public MachineSetStatus availableReplicas(Integer availableReplicas) {
    this.availableReplicas = availableReplicas;
    return this;
  }

  public Integer getAvailableReplicas() {
    return availableReplicas;
  }

  public void setAvailableReplicas(Integer availableReplicas) {
    this.availableReplicas = availableReplicas;
  }

  public Long getObservedGeneration() {
    return observedGeneration;
  }

  public void setObservedGeneration(Long observedGeneration) {
    this.observedGeneration = observedGeneration;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("replicas", replicas)
        .append("fullyLabeledReplicas", fullyLabeledReplicas)
        .append("readyReplicas", readyReplicas)
        .append("availableReplicas", availableReplicas)
        .append("observedGeneration", observedGeneration)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MachineSetStatus)) {
      return false;
    }
    MachineSetStatus rhs = (MachineSetStatus) other;
    return new EqualsBuilder()
        .append(replicas, rhs.replicas)
        .append(fullyLabeledReplicas, rhs.fullyLabeledReplicas)
        .append(readyReplicas, rhs.readyReplicas)
        .append(availableReplicas, rhs.availableReplicas)
        .append(observedGeneration, rhs.observedGeneration)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(replicas)
        .append(fullyLabeledReplicas)
        .append(readyReplicas)
        .append(availableReplicas)
        .append(observedGeneration)
        .toHashCode();
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.kubernetes.client.openapi.models.V1ObjectReference;
import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "The observed state of a machine.")
public class MachineStatus {

  @ApiModelProperty("The node backing this machine, once it has joined the cluster.")
  private V1ObjectReference nodeRef;

  @ApiModelProperty("The lifecycle phase of the machine, such as Provisioning, Running or Deleting.")
  private String phase;

  @ApiModelProperty("A description of a terminal problem reconciling the machine.")
  private String errorMessage;

  public MachineStatus nodeRef(V1ObjectReference nodeRef) {
    this.nodeRef = nodeRef;
    return this;
  }

  public V1ObjectReference getNodeRef() {
    return nodeRef;
  }

  public void setNodeRef(V1ObjectReference nodeRef) {
    this.nodeRef = nodeRef;
  }

  public MachineStatus phase(String phase) {
    this.phase = phase;
    return this;
  }

  public String getPhase() {
    return phase;
  }

  public void setPhase(String phase) {
    this.phase = phase;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("nodeRef", nodeRef)
        .append("phase", phase)
        .append("errorMessage", errorMessage)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MachineStatus rhs
        && new EqualsBuilder()
            .append(nodeRef, rhs.nodeRef)
            .append(phase, rhs.phase)
            .append(errorMessage, rhs.errorMessage)
            .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder().append(nodeRef).append(phase).append(errorMessage).toHashCode();
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import java.time.OffsetDateTime;

import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "One condition of a cluster operator, such as Available, Progressing or Degraded.")
public class ClusterOperatorStatusCondition {

  @ApiModelProperty("The condition type.")
  private String type;

  @ApiModelProperty("True, False or Unknown.")
  private String status;

  @ApiModelProperty("A machine-readable reason for the last transition.")
  private String reason;

  @ApiModelProperty("A human-readable description of the last transition.")
  private String message;

  @ApiModelProperty("When the condition last changed status.")
  private OffsetDateTime lastTransitionTime;

  public ClusterOperatorStatusCondition type(String type) {
    this.type = type;
    return this;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public ClusterOperatorStatusCondition status(String status) {
    this.status = status;
    return this;
  }

  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  public ClusterOperatorStatusCondition reason(String reason) {
    this.reason = reason;
    return this;
  }

  public String getReason() {
    return reason;
  }

  public void setReason(String reason) {
    this.reason = reason;
  }

  public ClusterOperatorStatusCondition message(String message) {
    this.message = message;
    return this;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public ClusterOperatorStatusCondition lastTransitionTime(OffsetDateTime lastTransitionTime) {
    this.lastTransitionTime = lastTransitionTime;
    return this;
  }

  public OffsetDateTime getLastTransitionTime() {
    return lastTransitionTime;
  }

  public void setLastTransitionTime(OffsetDateTime lastTransitionTime) {
    this.lastTransitionTime = lastTransitionTime;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("type", type)
        .append("status", status)
        .append("reason", reason)
        .append("message", message)
        .append("lastTransitionTime", lastTransitionTime)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ClusterOperatorStatusCondition)) {
      return false;
    }
    ClusterOperatorStatusCondition rhs = (ClusterOperatorStatusCondition) other;
    return new EqualsBuilder()
        .append(type, rhs.type)
        .append(status, rhs.status)
        .append(reason, rhs.reason)
        .append(message, rhs.message)
        .append(lastTransitionTime, rhs.lastTransitionTime)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(type)
        .append(status)
        .append(reason)
        .append(message)
        .append(lastTransitionTime)
        .toHashCode();
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "Scale-down behavior of the cluster autoscaler. Durations use Go syntax, such as 10s.")
public class ScaleDownConfig {

  @ApiModelProperty("Whether the autoscaler removes nodes.")
  private Boolean enabled;

  @ApiModelProperty("How long after a scale-up before scale-down evaluation resumes.")
  private String delayAfterAdd;

  @ApiModelProperty("How long after a node deletion before scale-down evaluation resumes.")
  private String delayAfterDelete;

  @ApiModelProperty("How long after a failed scale-down before evaluation resumes.")
  private String delayAfterFailure;

  @ApiModelProperty("How long a node must be unneeded before it is removed.")
  private String unneededTime;

  public ScaleDownConfig enabled(Boolean enabled) {
    this.enabled = enabled;
    return this;
  }

  public Boolean getEnabled() {
    return enabled;
  }

  public void setEnabled(Boolean enabled) {
    this.enabled = enabled;
  }

  public ScaleDownConfig delayAfterAdd(String delayAfterAdd) {
    this.delayAfterAdd = delayAfterAdd;
    return this;
  }

  public String getDelayAfterAdd() {
    return delayAfterAdd;
  }

  public void setDelayAfterAdd(String delayAfterAdd) {
    this.delayAfterAdd = delayAfterAdd;
  }

  public ScaleDownConfig delayAfterDelete(String delayAfterDelete) {
    this.delayAfterDelete = delayAfterDelete;
    return this;
  }

  public String getDelayAfterDelete() {
    return delayAfterDelete;
  }

  public void setDelayAfterDelete(String delayAfterDelete) {
    this.delayAfterDelete = delayAfterDelete;
  }

  public ScaleDownConfig delayAfterFailure(String delayAfterFailure) {
    this.delayAfterFailure = delayAfterFailure;
    return this;
  }

  public String getDelayAfterFailure() {
    return delayAfterFailure;
  }

  public void setDelayAfterFailure(String delayAfterFailure) {
    this.delayAfterFailure = delayAfterFailure;
  }

  public ScaleDownConfig unneededTime(String unneededTime) {
    this.unneededTime = unneededTime;
    return this;
  }

  public String getUnneededTime() {
    return unneededTime;
  }

  public void setUnneededTime(String unneededTime) {
    this.unneededTime = unneededTime;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("enabled", enabled)
        .append("delayAfterAdd", delayAfterAdd)
        .append("delayAfterDelete", delayAfterDelete)
        .append("delayAfterFailure", delayAfterFailure)
        .append("unneededTime", unneededTime)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ScaleDownConfig)) {
      return false;
    }
    ScaleDownConfig rhs = (ScaleDownConfig) other;
    return new EqualsBuilder()
        .append(enabled, rhs.enabled)
        .append(delayAfterAdd, rhs.delayAfterAdd)
        .append(delayAfterDelete, rhs.delayAfterDelete)
        .append(delayAfterFailure, rhs.delayAfterFailure)
        .append(unneededTime, rhs.unneededTime)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(enabled)
        .append(delayAfterAdd)
        .append(delayAfterDelete)
        .append(delayAfterFailure)
        .append(unneededTime)
        .toHashCode();
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import java.util.List;

import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "The status of a cluster operator.")
public class ClusterOperatorStatus {

  @ApiModelProperty("The conditions reported by the operator.")
  private List<ClusterOperatorStatusCondition> conditions;

  public ClusterOperatorStatus conditions(List<ClusterOperatorStatusCondition> conditions) {
    this.conditions = conditions;
    return this;
  }

  public List<ClusterOperatorStatusCondition> getConditions() {
    return conditions;
  }

  public void setConditions(List<ClusterOperatorStatusCondition> conditions) {
    this.conditions = conditions;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("conditions", conditions)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ClusterOperatorStatus)) {
      return false;
    }
    ClusterOperatorStatus rhs = (ClusterOperatorStatus) other;
    return new EqualsBuilder()
        .append(conditions, rhs.conditions)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(conditions)
        .toHashCode();
  }
}

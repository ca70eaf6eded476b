// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "Limits on the resources of the whole cluster.")
public class ResourceLimits {

  @ApiModelProperty("The largest number of nodes, in all node groups, the autoscaler may create.")
  private Integer maxNodesTotal;

  public ResourceLimits maxNodesTotal(Integer maxNodesTotal) {
    this.maxNodesTotal = maxNodesTotal;
    return this;
  }

  public Integer getMaxNodesTotal() {
    return maxNodesTotal;
  }

  public void setMaxNodesTotal(Integer maxNodesTotal) {
    this.maxNodesTotal = maxNodesTotal;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("maxNodesTotal", maxNodesTotal)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ResourceLimits)) {
      return false;
    }
    ResourceLimits rhs = (ResourceLimits) other;
    return new EqualsBuilder()
        .append(maxNodesTotal, rhs.maxNodesTotal)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(maxNodesTotal)
        .toHashCode();
  }
}

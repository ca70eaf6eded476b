// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Cloud-provider configuration for a machine. The content is opaque to this suite: it is copied from an existing
 * machine set when cloning one.
 */
@ApiModel(description = "Provider-specific machine configuration.")
public class ProviderSpec {

  @ApiModelProperty("The inlined provider configuration, as a free-form object.")
  private Object value;

  public ProviderSpec value(Object value) {
    this.value = value;
    return this;
  }

  public Object getValue() {
    return value;
  }

  public void setValue(Object value) {
    this.value = value;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this).append("value", value).toString();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ProviderSpec rhs && new EqualsBuilder().append(value, rhs.value).isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder().append(value).toHashCode();
  }
}

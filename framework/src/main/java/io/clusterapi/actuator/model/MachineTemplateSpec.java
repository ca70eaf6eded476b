// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "The template for the machines of a machine set.")
public class MachineTemplateSpec {

  @ApiModelProperty("Metadata given to each machine. The labels must match the machine set's selector.")
  private V1ObjectMeta metadata = new V1ObjectMeta();

  @ApiModelProperty("The specification of each machine.")
  private MachineSpec spec = new MachineSpec();

  public MachineTemplateSpec metadata(V1ObjectMeta metadata) {
    this.metadata = metadata;
    return this;
  }

  public V1ObjectMeta getMetadata() {
    return metadata;
  }

  public void setMetadata(V1ObjectMeta metadata) {
    this.metadata = metadata;
  }

  public MachineTemplateSpec spec(MachineSpec spec) {
    this.spec = spec;
    return this;
  }

  public MachineSpec getSpec() {
    return spec;
  }

  public void setSpec(MachineSpec spec) {
    this.spec = spec;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this).append("metadata", metadata).append("spec", spec).toString();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MachineTemplateSpec rhs
        && new EqualsBuilder().append(metadata, rhs.metadata).append(spec, rhs.spec).isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder().append(metadata).append(spec).toHashCode();
  }
}

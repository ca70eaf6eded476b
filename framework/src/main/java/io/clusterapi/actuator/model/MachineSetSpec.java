// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.model;

import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.swagger.annotations.ApiModel;
import io.swagger.annotations.ApiModelProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

@ApiModel(description = "The desired state of a machine set.")
public class MachineSetSpec {

  @ApiModelProperty(
      value = "The number of machines to run.",
      allowableValues = "range[0,infinity]")
  private Integer replicas;

  @ApiModelProperty("Selects the machines which belong to this machine set. Must match the template labels.")
  private V1LabelSelector selector;

  @ApiModelProperty("The template from which new machines are created.")
  private MachineTemplateSpec template = new MachineTemplateSpec();

  @ApiModelProperty("Which machines to delete first when scaling down: Random, Newest or Oldest.")
  private String deletePolicy;

  public MachineSetSpec replicas(Integer replicas) {
    this.replicas = replicas;
    return this;
  }

  public Integer getReplicas() {
    return replicas;
  }

  public void setReplicas(Integer replicas) {
    this.replicas = replicas;
  }

  public MachineSetSpec selector(V1LabelSelector selector) {
    this.selector = selector;
    return this;
  }

  public V1LabelSelector getSelector() {
    return selector;
  }

  public void setSelector(V1LabelSelector selector) {
    this.selector = selector;
  }

  public MachineSetSpec template(MachineTemplateSpec template) {
    this.template = template;
    return this;
  }

  public MachineTemplateSpec getTemplate() {
    return template;
  }

  public void setTemplate(MachineTemplateSpec template) {
    this.template = template;
  }

  public String getDeletePolicy() {
    return deletePolicy;
  }

  public void setDeletePolicy(String deletePolicy) {
    this.deletePolicy = deletePolicy;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("replicas", replicas)
        .append("selector", selector)
        .append("template", template)
        .append("deletePolicy", deletePolicy)
        .toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MachineSetSpec)) {
      return false;
    }
    MachineSetSpec rhs = (MachineSetSpec) other;
    return new EqualsBuilder()
        .append(replicas, rhs.replicas)
        .append(selector, rhs.selector)
        .append(template, rhs.template)
        .append(deletePolicy, rhs.deletePolicy)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(replicas)
        .append(selector)
        .append(template)
        .append(deletePolicy)
        .toHashCode();
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.actions;

import java.util.UUID;

import io.clusterapi.actuator.model.Machine;
import io.clusterapi.actuator.model.MachineSet;
import io.clusterapi.actuator.model.MachineSetSpec;
import io.clusterapi.actuator.model.MachineStatus;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Node;
import io.kubernetes.client.openapi.models.V1NodeCondition;
import io.kubernetes.client.openapi.models.V1NodeSpec;
import io.kubernetes.client.openapi.models.V1NodeStatus;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1ObjectReference;
import io.kubernetes.client.openapi.models.V1OwnerReference;

import static io.clusterapi.actuator.ActuatorConstants.MACHINE_ANNOTATION_KEY;
import static io.clusterapi.actuator.ActuatorConstants.MACHINE_ROLE_LABEL;
import static io.clusterapi.actuator.ActuatorConstants.WORKER_NODE_ROLE_LABEL;
import static io.clusterapi.actuator.actions.ResourceBuilders.CLUSTER_KEY;

/** Builders for the machines, machine sets and nodes used in tests. */
public class MachineFixtures {

  public static final String NAMESPACE = "test-machine-api";
  public static final String CLUSTER = "test-cluster";

  private MachineFixtures() {
    // no-op
  }

  /**
   * Creates a worker machine set with a uid.
   *
   * @param name the name
   * @param replicas the desired replicas
   * @return the machine set
   */
  public static MachineSet machineSet(String name, int replicas) {
    return new MachineSet()
        .metadata(new V1ObjectMeta()
            .name(name)
            .namespace(NAMESPACE)
            .uid(UUID.randomUUID().toString())
            .putLabelsItem(CLUSTER_KEY, CLUSTER)
            .putLabelsItem(MACHINE_ROLE_LABEL, "worker"))
        .spec(new MachineSetSpec().replicas(replicas));
  }

  /**
   * Creates a machine controlled by a machine set and linked to a node.
   *
   * @param name the name
   * @param owner the controlling machine set, or null for none
   * @param nodeName the node, or null if not yet linked
   * @return the machine
   */
  public static Machine machine(String name, MachineSet owner, String nodeName) {
    Machine machine = new Machine().metadata(new V1ObjectMeta().name(name).namespace(NAMESPACE));
    if (owner != null) {
      machine.getMetadata().addOwnerReferencesItem(new V1OwnerReference()
          .kind("MachineSet")
          .name(owner.getMetadata().getName())
          .uid(owner.getMetadata().getUid())
          .controller(true));
    }
    if (nodeName != null) {
      machine.status(new MachineStatus().nodeRef(new V1ObjectReference().kind("Node").name(nodeName)));
    }
    return machine;
  }

  /**
   * Creates a ready, schedulable worker node whose annotation names a machine.
   *
   * @param name the node name
   * @param machineName the machine name, or null to leave the node unannotated
   * @return the node
   */
  public static V1Node node(String name, String machineName) {
    V1ObjectMeta metadata = new V1ObjectMeta().name(name).putLabelsItem(WORKER_NODE_ROLE_LABEL, "");
    if (machineName != null) {
      metadata.putAnnotationsItem(MACHINE_ANNOTATION_KEY, NAMESPACE + "/" + machineName);
    }
    return new V1Node()
        .metadata(metadata)
        .spec(new V1NodeSpec().unschedulable(false))
        .status(new V1NodeStatus()
            .putCapacityItem("memory", new Quantity("8Gi"))
            .addConditionsItem(new V1NodeCondition().type("Ready").status("True")));
  }

  /**
   * Marks a node not ready.
   *
   * @param node the node
   * @return the node
   */
  public static V1Node notReady(V1Node node) {
    node.getStatus().getConditions().get(0).setStatus("False");
    return node;
  }
}

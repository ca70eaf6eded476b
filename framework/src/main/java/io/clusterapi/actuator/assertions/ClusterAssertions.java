// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.assertions;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import io.clusterapi.actuator.actions.MachineApiActions;
import io.clusterapi.actuator.actions.MachineKey;
import io.clusterapi.actuator.client.ClusterClient;
import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.common.logging.MessageKeys;
import io.clusterapi.actuator.model.ClusterOperator;
import io.clusterapi.actuator.model.ClusterOperatorStatusCondition;
import io.clusterapi.actuator.model.Machine;
import io.clusterapi.actuator.model.MachineSet;
import io.clusterapi.actuator.waiter.Probe;
import io.clusterapi.actuator.waiter.TransientReadException;
import io.kubernetes.client.openapi.models.V1DaemonSet;
import io.kubernetes.client.openapi.models.V1DaemonSetSpec;
import io.kubernetes.client.openapi.models.V1DaemonSetStatus;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentCondition;
import io.kubernetes.client.openapi.models.V1DeploymentSpec;
import io.kubernetes.client.openapi.models.V1DeploymentStatus;
import io.kubernetes.client.openapi.models.V1Node;
import io.kubernetes.client.openapi.models.V1NodeCondition;
import io.kubernetes.client.openapi.models.V1NodeSpec;
import io.kubernetes.client.openapi.models.V1NodeStatus;

import static io.clusterapi.actuator.actions.MachineApiActions.getName;
import static io.clusterapi.actuator.client.ResourceKind.CLUSTER_OPERATOR;
import static io.clusterapi.actuator.client.ResourceKind.DAEMON_SET;
import static io.clusterapi.actuator.client.ResourceKind.DEPLOYMENT;
import static io.clusterapi.actuator.client.ResourceKind.MACHINE;
import static io.clusterapi.actuator.client.ResourceKind.NODE;

/**
 * Probes over the state of the cluster, for use with a
 * {@link io.clusterapi.actuator.waiter.ConvergenceWaiter}. Each probe reads the cluster afresh on every call.
 * Read failures surface as the client's exceptions and are retried by the waiter.
 */
public class ClusterAssertions {

  private static final String TRUE = "True";

  private final ClusterClient client;
  private final String machineNamespace;
  private final LoggingFacade logger;

  /**
   * Creates the probes.
   *
   * @param client the cluster client
   * @param machineNamespace the namespace holding machines and machine sets
   * @param logger the diagnostic sink
   */
  public ClusterAssertions(ClusterClient client, String machineNamespace, LoggingFacade logger) {
    this.client = client;
    this.machineNamespace = machineNamespace;
    this.logger = logger;
  }

  /**
   * Checks that nodes and machines correspond one to one. Every node must name its machine in the machine
   * annotation, and every machine's node reference must name a node which points back at the machine.
   * Differences are reported as {@link TransientReadException}s; a malformed annotation is fatal.
   *
   * @return the probe
   */
  public Probe oneMachinePerNode() {
    return () -> {
      List<Machine> machines = client.list(MACHINE, machineNamespace);
      List<V1Node> nodes = client.list(NODE, null);
      if (machines.size() != nodes.size()) {
        throw new TransientReadException(
            "Expected the same number of machines and nodes, have " + nodes.size() + " nodes and "
                + machines.size() + " machines");
      }

      Map<String, MachineKey> machineOfNode = new HashMap<>();
      for (V1Node node : nodes) {
        MachineKey key = MachineKey.of(node)
            .orElseThrow(() -> new TransientReadException("Node " + getName(node) + " has no machine annotation"));
        machineOfNode.put(getName(node), key);
      }

      for (Machine machine : machines) {
        String nodeName = machine.getNodeName()
            .orElseThrow(() -> new TransientReadException("Machine " + getName(machine) + " has no node reference"));
        MachineKey expected = new MachineKey(machineNamespace, getName(machine));
        if (!expected.equals(machineOfNode.get(nodeName))) {
          throw new TransientReadException(
              "Node " + nodeName + " does not point back at machine " + expected);
        }
        logger.fine("Machine {0} is linked to node {1}", getName(machine), nodeName);
      }
      return true;
    };
  }

  /**
   * Checks that no node is marked unschedulable.
   *
   * @return the probe
   */
  public Probe allNodesSchedulable() {
    return () -> {
      for (V1Node node : client.list(NODE, null)) {
        if (isUnschedulable(node)) {
          logger.info(MessageKeys.NODE_UNSCHEDULABLE, getName(node));
          return false;
        }
      }
      return true;
    };
  }

  /**
   * Checks that every node in the cluster is Ready.
   *
   * @return the probe
   */
  public Probe allNodesReady() {
    return () -> nodesReady(client.list(NODE, null));
  }

  public Probe machineSetScaledTo(MachineSet machineSet, int target) {
    return machineSetsScaledTo(List.of(machineSet), target);
  }

  /**
   * Checks that the machines controlled by a group of machine sets are backed by exactly {@code target} live
   * nodes and that all of those nodes are Ready.
   *
   * @param machineSets the machine sets
   * @param target the expected number of nodes
   * @return the probe
   */
  public Probe machineSetsScaledTo(List<MachineSet> machineSets, int target) {
    return () -> {
      Set<String> nodeNames = client.list(MACHINE, machineNamespace).stream()
          .filter(machine -> machineSets.stream().anyMatch(set -> MachineApiActions.isControlledBy(machine, set)))
          .map(Machine::getNodeName)
          .flatMap(Optional::stream)
          .collect(Collectors.toSet());
      List<V1Node> nodes = client.list(NODE, null).stream()
          .filter(node -> nodeNames.contains(getName(node)))
          .collect(Collectors.toList());
      if (nodes.size() != target) {
        logger.info(MessageKeys.NODE_COUNT_MISMATCH, target, nodes.size());
        return false;
      }
      return nodesReady(nodes);
    };
  }

  /**
   * Checks that a deployment has all its desired replicas available and reports the Available condition.
   *
   * @param namespace the namespace
   * @param name the deployment name
   * @return the probe
   */
  public Probe deploymentAvailable(String namespace, String name) {
    return () -> {
      V1Deployment deployment = client.get(DEPLOYMENT, namespace, name);
      int desired = Optional.ofNullable(deployment.getSpec()).map(V1DeploymentSpec::getReplicas).orElse(1);
      V1DeploymentStatus status = Optional.ofNullable(deployment.getStatus()).orElse(new V1DeploymentStatus());
      int available = Optional.ofNullable(status.getAvailableReplicas()).orElse(0);
      logger.fine("Deployment {0}/{1} has {2} of {3} replicas available", namespace, name, available, desired);
      return available == desired && hasAvailableCondition(status.getConditions());
    };
  }

  /**
   * Checks that a deployment's spec equals the given one.
   *
   * @param namespace the namespace
   * @param name the deployment name
   * @param expected the expected spec
   * @return the probe
   */
  public Probe deploymentSynced(String namespace, String name, V1DeploymentSpec expected) {
    return () -> Objects.equals(expected, client.get(DEPLOYMENT, namespace, name).getSpec());
  }

  /**
   * Checks that a daemon set has a pod available on every node where one is desired.
   *
   * @param namespace the namespace
   * @param name the daemon set name
   * @return the probe
   */
  public Probe daemonSetAvailable(String namespace, String name) {
    return () -> {
      V1DaemonSet daemonSet = client.get(DAEMON_SET, namespace, name);
      V1DaemonSetStatus status = daemonSet.getStatus();
      if (status == null || status.getNumberAvailable() == null) {
        return false;
      }
      logger.fine("DaemonSet {0}/{1} has {2} of {3} pods available", namespace, name,
          status.getNumberAvailable(), status.getDesiredNumberScheduled());
      return status.getNumberAvailable().equals(status.getDesiredNumberScheduled());
    };
  }

  public Probe daemonSetSynced(String namespace, String name, V1DaemonSetSpec expected) {
    return () -> Objects.equals(expected, client.get(DAEMON_SET, namespace, name).getSpec());
  }

  /**
   * Checks that a cluster operator reports the Available condition.
   *
   * @param name the cluster operator name
   * @return the probe
   */
  public Probe clusterOperatorAvailable(String name) {
    return () -> {
      ClusterOperator operator = client.get(CLUSTER_OPERATOR, null, name);
      return operator.getCondition("Available")
          .map(ClusterOperatorStatusCondition::getStatus)
          .map(TRUE::equals)
          .orElse(false);
    };
  }

  /**
   * Returns true if every node reports the Ready condition, logging any which do not.
   *
   * @param nodes the nodes
   * @return true if all are ready
   */
  public boolean nodesReady(List<V1Node> nodes) {
    boolean ready = true;
    for (V1Node node : nodes) {
      if (!isReady(node)) {
        logger.info(MessageKeys.NODE_NOT_READY, getName(node));
        ready = false;
      }
    }
    return ready;
  }

  public static boolean isReady(V1Node node) {
    return Optional.ofNullable(node.getStatus())
        .map(V1NodeStatus::getConditions)
        .orElse(List.of())
        .stream()
        .filter(condition -> "Ready".equals(condition.getType()))
        .map(V1NodeCondition::getStatus)
        .anyMatch(TRUE::equals);
  }

  private static boolean isUnschedulable(V1Node node) {
    return Optional.ofNullable(node.getSpec()).map(V1NodeSpec::getUnschedulable).orElse(false);
  }

  private static boolean hasAvailableCondition(List<V1DeploymentCondition> conditions) {
    return Optional.ofNullable(conditions).orElse(List.of()).stream()
        .anyMatch(condition -> "Available".equals(condition.getType()) && TRUE.equals(condition.getStatus()));
  }
}

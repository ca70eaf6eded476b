// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.actions;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import io.clusterapi.actuator.client.ClusterClient;
import io.clusterapi.actuator.client.ResourceKind;
import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.common.logging.MessageKeys;
import io.clusterapi.actuator.model.Machine;
import io.clusterapi.actuator.model.MachineSet;
import io.clusterapi.actuator.model.MachineSetStatus;
import io.clusterapi.actuator.waiter.ConvergenceWaiter;
import io.clusterapi.actuator.waiter.FatalConfigurationException;
import io.clusterapi.actuator.waiter.RetryPolicies;
import io.clusterapi.actuator.waiter.TransientReadException;
import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Node;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;

import static io.clusterapi.actuator.ActuatorConstants.MACHINE_API_NAMESPACE;
import static io.clusterapi.actuator.ActuatorConstants.MACHINE_ROLE_LABEL;
import static io.clusterapi.actuator.ActuatorConstants.WORKER_NODE_ROLE_LABEL;
import static io.clusterapi.actuator.client.ResourceKind.MACHINE;
import static io.clusterapi.actuator.client.ResourceKind.MACHINE_SET;
import static io.clusterapi.actuator.client.ResourceKind.NODE;

/**
 * Reads and changes Machine API resources. Every read is retried with the read retry policy, so transient
 * API failures only surface once that policy's deadline has passed.
 */
public class MachineApiActions {

  private static final String MACHINE_SET_KIND = "MachineSet";

  private final ClusterClient client;
  private final String namespace;
  private final ConvergenceWaiter readWaiter;
  private final ConvergenceWaiter deletionWaiter;
  private final LoggingFacade logger;

  /**
   * Creates actions against the configured Machine API namespace using the standard retry policies.
   *
   * @param client the cluster client
   * @param logger the diagnostic sink
   */
  public MachineApiActions(ClusterClient client, LoggingFacade logger) {
    this(client, MACHINE_API_NAMESPACE, RetryPolicies.withReadRetryPolicy(logger),
        RetryPolicies.withStandardRetryPolicy(logger), logger);
  }

  /**
   * Creates actions.
   *
   * @param client the cluster client
   * @param namespace the Machine API namespace
   * @param readWaiter the waiter for single reads and updates
   * @param deletionWaiter the waiter for resource deletion
   * @param logger the diagnostic sink
   */
  public MachineApiActions(ClusterClient client, String namespace, ConvergenceWaiter readWaiter,
                           ConvergenceWaiter deletionWaiter, LoggingFacade logger) {
    this.client = client;
    this.namespace = namespace;
    this.readWaiter = readWaiter;
    this.deletionWaiter = deletionWaiter;
    this.logger = logger;
  }

  public ClusterClient getClient() {
    return client;
  }

  public String getNamespace() {
    return namespace;
  }

  public List<MachineSet> getMachineSets() {
    return read(() -> client.list(MACHINE_SET, namespace), "listing machine sets in {0}", namespace);
  }

  public List<MachineSet> getWorkerMachineSets() {
    String selector = MACHINE_ROLE_LABEL + "=worker";
    return read(() -> client.list(MACHINE_SET, namespace, selector), "listing worker machine sets in {0}", namespace);
  }

  public MachineSet getMachineSet(String name) {
    return read(() -> client.get(MACHINE_SET, namespace, name), "reading machine set {0}", name);
  }

  public List<Machine> getMachines() {
    return read(() -> client.list(MACHINE, namespace), "listing machines in {0}", namespace);
  }

  public List<V1Node> getNodes() {
    return read(() -> client.list(NODE, null), "listing nodes");
  }

  public List<V1Node> getWorkerNodes() {
    return read(() -> client.list(NODE, null, WORKER_NODE_ROLE_LABEL), "listing worker nodes");
  }

  /**
   * Returns a worker node, waiting for one to appear.
   *
   * @return the first worker node listed
   */
  public V1Node getWorkerNode() {
    return read(() -> {
      List<V1Node> workers = client.list(NODE, null, WORKER_NODE_ROLE_LABEL);
      if (workers.isEmpty()) {
        throw new TransientReadException("No nodes were found with label " + WORKER_NODE_ROLE_LABEL);
      }
      return workers.get(0);
    }, "finding a worker node");
  }

  /**
   * Returns the number of nodes in the cluster.
   *
   * @return the node count
   */
  public int getClusterSize() {
    int size = getNodes().size();
    logger.info("Cluster size is {0} nodes", size);
    return size;
  }

  /**
   * Returns the machine which backs a node, following the node's machine annotation.
   *
   * @param node the node
   * @return the machine
   * @throws FatalConfigurationException if the node has no machine annotation or it is malformed
   */
  public Machine getMachineFromNode(V1Node node) {
    MachineKey key = MachineKey.of(node)
        .orElseThrow(() -> new FatalConfigurationException("Node " + getName(node) + " has no machine annotation"));
    return read(() -> client.get(MACHINE, key.namespace(), key.name()), "reading machine {0}", key);
  }

  /**
   * Returns the machine set which owns a machine.
   *
   * @param machine the machine
   * @return the owning machine set
   * @throws FatalConfigurationException if the machine has no machine set owner
   */
  public MachineSet getMachineSetFromMachine(Machine machine) {
    String owner = getOwnerReferences(machine).stream()
        .filter(ref -> MACHINE_SET_KIND.equals(ref.getKind()))
        .map(V1OwnerReference::getName)
        .findFirst()
        .orElseThrow(() -> new FatalConfigurationException("No MachineSet found for machine " + getName(machine)));
    return getMachineSet(owner);
  }

  /**
   * Returns the machines whose controller is the given machine set.
   *
   * @param machineSet the machine set
   * @return the controlled machines
   */
  public List<Machine> getMachinesOf(MachineSet machineSet) {
    return getMachines().stream()
        .filter(machine -> isControlledBy(machine, machineSet))
        .collect(Collectors.toList());
  }

  /**
   * Returns the nodes backing the machines controlled by a machine set. Machines which have no node yet, or
   * whose node no longer exists, contribute nothing.
   *
   * @param machineSet the machine set
   * @return the nodes
   */
  public List<V1Node> getNodesOf(MachineSet machineSet) {
    Set<String> nodeNames = getMachinesOf(machineSet).stream()
        .map(Machine::getNodeName)
        .flatMap(Optional::stream)
        .collect(Collectors.toSet());
    return getNodes().stream()
        .filter(node -> nodeNames.contains(getName(node)))
        .collect(Collectors.toList());
  }

  /** Logs the replica counts of every machine set. */
  public void logMachineSetsSnapshot() {
    for (MachineSet machineSet : getMachineSets()) {
      MachineSetStatus status = Optional.ofNullable(machineSet.getStatus()).orElse(new MachineSetStatus());
      logger.info(MessageKeys.MACHINE_SET_SNAPSHOT, getName(machineSet), machineSet.getReplicas(),
          zeroIfNull(status.getReplicas()), zeroIfNull(status.getReadyReplicas()),
          zeroIfNull(status.getAvailableReplicas()));
    }
  }

  /**
   * Sets the desired replica count of a machine set. Update conflicts are retried against a fresh read.
   *
   * @param name the machine set name
   * @param replicas the desired replicas
   */
  public void scaleMachineSet(String name, int replicas) {
    logger.info(MessageKeys.MACHINE_SET_SCALED, name, replicas);
    readWaiter.until(() -> {
      MachineSet machineSet = client.get(MACHINE_SET, namespace, name);
      machineSet.getSpec().setReplicas(replicas);
      client.update(MACHINE_SET, machineSet);
      return true;
    }, "scaling machine set {0} to {1}", name, replicas);
  }

  /**
   * Finds the machine set behind a worker node and scales it.
   *
   * @param replicas the desired replicas
   * @return the machine set as it was before scaling
   */
  public MachineSet scaleAWorker(int replicas) {
    V1Node workerNode = getWorkerNode();
    logger.info("Got worker node {0}", getName(workerNode));
    Machine workerMachine = getMachineFromNode(workerNode);
    logger.info("Got worker machine {0}", getName(workerMachine));
    MachineSet workerMachineSet = getMachineSetFromMachine(workerMachine);
    logger.info("MachineSet {0} original replicas: {1}. Scaling to: {2}",
        getName(workerMachineSet), workerMachineSet.getReplicas(), replicas);
    scaleMachineSet(getName(workerMachineSet), replicas);
    return workerMachineSet;
  }

  /**
   * Waits until a machine set and every machine it controlled are gone.
   *
   * @param machineSet the deleted machine set
   */
  public void waitForMachineSetDelete(MachineSet machineSet) {
    String name = getName(machineSet);
    deletionWaiter.until(() -> {
      if (machineSetExists(name)) {
        return false;
      }
      return client.list(MACHINE, namespace).stream().noneMatch(machine -> isControlledBy(machine, machineSet));
    }, "machine set {0} and its machines to be deleted", name);
  }

  /**
   * Deletes a resource, treating its absence as success.
   *
   * @param kind the resource kind
   * @param object the resource
   * @param propagationPolicy the deletion propagation policy
   * @param <T> the resource type
   * @param <L> the list type
   * @return true if the resource was deleted, false if it was already gone
   * @throws ApiException if the deletion fails for any other reason
   */
  public <T extends KubernetesObject, L extends KubernetesListObject> boolean deleteIfExists(
      ResourceKind<T, L> kind, T object, String propagationPolicy) throws ApiException {
    try {
      client.delete(kind, object, propagationPolicy);
      logger.info(MessageKeys.RESOURCE_DELETED, kind, getName(object));
      return true;
    } catch (ApiException e) {
      if (ClusterClient.isNotFound(e)) {
        logger.fine("{0} {1} was already deleted", kind, getName(object));
        return false;
      }
      throw e;
    }
  }

  /**
   * Returns true if the machine's controller owner reference points at the machine set. When the machine set
   * carries no uid the reference is matched by name.
   *
   * @param machine the machine
   * @param machineSet the machine set
   * @return true if controlled
   */
  public static boolean isControlledBy(Machine machine, MachineSet machineSet) {
    V1ObjectMeta setMetadata = machineSet.getMetadata();
    return getOwnerReferences(machine).stream()
        .filter(ref -> Boolean.TRUE.equals(ref.getController()))
        .filter(ref -> MACHINE_SET_KIND.equals(ref.getKind()))
        .anyMatch(ref -> setMetadata.getUid() != null
            ? setMetadata.getUid().equals(ref.getUid())
            : Objects.equals(setMetadata.getName(), ref.getName()));
  }

  /**
   * Returns the name of a resource.
   *
   * @param object the resource
   * @return its metadata name, or null if it has no metadata
   */
  public static String getName(KubernetesObject object) {
    return Optional.ofNullable(object.getMetadata()).map(V1ObjectMeta::getName).orElse(null);
  }

  /**
   * Returns the labels of a resource.
   *
   * @param object the resource
   * @return its labels, never null
   */
  public static Map<String, String> getLabels(KubernetesObject object) {
    return Optional.ofNullable(object.getMetadata()).map(V1ObjectMeta::getLabels).orElse(Map.of());
  }

  private boolean machineSetExists(String name) throws ApiException {
    try {
      client.get(MACHINE_SET, namespace, name);
      return true;
    } catch (ApiException e) {
      if (ClusterClient.isNotFound(e)) {
        return false;
      }
      throw e;
    }
  }

  private static List<V1OwnerReference> getOwnerReferences(KubernetesObject object) {
    return Optional.ofNullable(object.getMetadata())
        .map(V1ObjectMeta::getOwnerReferences)
        .orElse(List.of());
  }

  private static int zeroIfNull(Integer value) {
    return value == null ? 0 : value;
  }

  private <R> R read(Callable<R> reader, String msg, Object... params) {
    AtomicReference<R> result = new AtomicReference<>();
    readWaiter.until(() -> {
      result.set(reader.call());
      return true;
    }, msg, params);
    return result.get();
  }
}

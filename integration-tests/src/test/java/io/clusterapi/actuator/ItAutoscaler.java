// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import io.clusterapi.actuator.actions.AutoscalerEvents;
import io.clusterapi.actuator.actions.MachineApiActions;
import io.clusterapi.actuator.annotations.IntegrationTest;
import io.clusterapi.actuator.assertions.ClusterAssertions;
import io.clusterapi.actuator.client.ClusterClient;
import io.clusterapi.actuator.client.KubernetesClusterClient;
import io.clusterapi.actuator.client.ResourceKind;
import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.common.logging.MessageKeys;
import io.clusterapi.actuator.model.Machine;
import io.clusterapi.actuator.model.MachineAutoscaler;
import io.clusterapi.actuator.model.MachineSet;
import io.clusterapi.actuator.utils.Cleanup;
import io.clusterapi.actuator.watcher.EventCounter;
import io.clusterapi.actuator.watcher.EventWatcher;
import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1Node;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.clusterapi.actuator.ActuatorConstants.MACHINE_API_NAMESPACE;
import static io.clusterapi.actuator.ActuatorConstants.WORKLOAD_NAMESPACE;
import static io.clusterapi.actuator.TestConstants.MACHINE_AUTOSCALER_MAX_REPLICAS;
import static io.clusterapi.actuator.TestConstants.MACHINE_AUTOSCALER_MIN_REPLICAS;
import static io.clusterapi.actuator.TestConstants.TRANSIENT_MACHINE_SETS;
import static io.clusterapi.actuator.actions.AutoscalerEvents.countSatisfies;
import static io.clusterapi.actuator.actions.MachineApiActions.getName;
import static io.clusterapi.actuator.actions.ResourceBuilders.WORKLOAD_JOB_NAME;
import static io.clusterapi.actuator.actions.ResourceBuilders.newClusterAutoscaler;
import static io.clusterapi.actuator.actions.ResourceBuilders.newMachineAutoscaler;
import static io.clusterapi.actuator.actions.ResourceBuilders.newRunId;
import static io.clusterapi.actuator.actions.ResourceBuilders.newTransientMachineSet;
import static io.clusterapi.actuator.actions.ResourceBuilders.newWorkload;
import static io.clusterapi.actuator.actions.ResourceBuilders.transientMachineSetName;
import static io.clusterapi.actuator.actions.ResourceBuilders.workloadMemoryRequest;
import static io.clusterapi.actuator.client.ClusterClient.PROPAGATION_FOREGROUND;
import static io.clusterapi.actuator.client.ResourceKind.CLUSTER_AUTOSCALER;
import static io.clusterapi.actuator.client.ResourceKind.JOB;
import static io.clusterapi.actuator.client.ResourceKind.MACHINE_AUTOSCALER;
import static io.clusterapi.actuator.client.ResourceKind.MACHINE_SET;
import static io.clusterapi.actuator.client.ResourceKind.POD;
import static io.clusterapi.actuator.utils.ThreadSafeLogger.getLogger;
import static io.clusterapi.actuator.waiter.RetryPolicies.withLongRetryPolicy;
import static io.clusterapi.actuator.waiter.RetryPolicies.withShortRetryPolicy;
import static io.clusterapi.actuator.waiter.RetryPolicies.withStandardRetryPolicy;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the cluster autoscaler through a full cycle: transient machine sets are put under machine autoscalers,
 * a workload too large for the cluster forces a scale-up to the configured node cap, and deleting the workload
 * lets the autoscaler remove the nodes again.
 */
@DisplayName("Verify the cluster autoscaler scales machine sets up to the node cap and back down")
@IntegrationTest
class ItAutoscaler {

  private static LoggingFacade logger = null;

  private ClusterClient client;
  private MachineApiActions actions;
  private ClusterAssertions assertions;
  private Cleanup cleanup;
  private EventWatcher eventWatcher;

  /**
   * Connects to the cluster.
   *
   * @throws Exception if the cluster cannot be reached
   */
  @BeforeAll
  public void initAll() throws Exception {
    logger = getLogger();
    client = KubernetesClusterClient.create(logger);
    actions = new MachineApiActions(client, logger);
    assertions = new ClusterAssertions(client, MACHINE_API_NAMESPACE, logger);
    cleanup = new Cleanup(actions, logger);
  }

  @AfterAll
  void tearDownAll() {
    if (eventWatcher != null) {
      eventWatcher.stop();
    }
    if (cleanup != null) {
      cleanup.run();
    }
  }

  @Test
  @DisplayName("Scale out to maxNodesTotal, hold there, then scale back in once the workload is gone")
  void scaleOutAndBackIn() throws Exception {
    List<MachineSet> existingMachineSets = actions.getMachineSets();
    List<Machine> existingMachines = actions.getMachines();
    List<V1Node> existingNodes = actions.getNodes();
    logger.info("Have {0} existing machine sets, {1} machines and {2} nodes",
        existingMachineSets.size(), existingMachines.size(), existingNodes.size());
    assertThat(existingMachineSets).isNotEmpty();
    assertThat(existingNodes).hasSameSizeAs(existingMachines);

    List<MachineSet> machineSets = createTransientMachineSets(existingMachineSets);
    withLongRetryPolicy(logger).until(assertions.machineSetsScaledTo(machineSets, machineSets.size()),
        "nodes to be ready in {0} transient machine sets", machineSets.size());

    int clusterSize = actions.getClusterSize();
    List<MachineAutoscaler> machineAutoscalers = new ArrayList<>();
    Map<String, Boolean> scaledGroups = new ConcurrentHashMap<>();
    for (MachineSet machineSet : machineSets) {
      logger.info("Create MachineAutoscaler backed by MachineSet {0}/{1} - min:{2}, max:{3}",
          machineSet.getMetadata().getNamespace(), getName(machineSet),
          MACHINE_AUTOSCALER_MIN_REPLICAS, MACHINE_AUTOSCALER_MAX_REPLICAS);
      machineAutoscalers.add(create(MACHINE_AUTOSCALER,
          newMachineAutoscaler(machineSet, MACHINE_AUTOSCALER_MIN_REPLICAS, MACHINE_AUTOSCALER_MAX_REPLICAS)));
      scaledGroups.put(machineSet.getMetadata().getNamespace() + "/" + getName(machineSet), false);
    }
    int expansion = machineAutoscalers.size();
    assertThat(expansion).isGreaterThan(1);

    // one less than the autoscalers could reach, so the cap is what stops the scale-up
    int maxNodesTotal = clusterSize + expansion - 1;

    eventWatcher = new EventWatcher("autoscaler-events", client, logger);
    eventWatcher.start();
    AutoscalerEvents.logAutoscalerEvents(eventWatcher, logger);

    logger.info("Creating ClusterAutoscaler configured with maxNodesTotal:{0}", maxNodesTotal);
    create(CLUSTER_AUTOSCALER, newClusterAutoscaler(maxNodesTotal));

    V1Node workerNode = actions.getWorkerNode();
    Quantity memoryRequest = workloadMemoryRequest(workerNode);
    logger.info("Memory capacity of worker node {0} gives a workload request of {1}",
        getName(workerNode), memoryRequest.toSuffixedString());

    EventCounter scaleUpCounter = AutoscalerEvents.newScaleUpCounter(eventWatcher, 0, scaledGroups);
    EventCounter maxNodesTotalReachedCounter = AutoscalerEvents.newMaxNodesTotalReachedCounter(eventWatcher, 0);

    // one job more than the cap allows keeps the autoscaler reporting that the cap was reached
    logger.info("Creating scale-out workload: jobs: {0}, memory: {1}", maxNodesTotal + 1,
        memoryRequest.toSuffixedString());
    V1Job workload = create(JOB, newWorkload(maxNodesTotal + 1, memoryRequest));

    long expectedScaleUps = expansion - 1;
    withLongRetryPolicy(logger).until(
        countSatisfies(scaleUpCounter, "scale-up", count -> count == expectedScaleUps, logger),
        "{0} scale-up events", expectedScaleUps);
    withShortRetryPolicy(logger).until(
        countSatisfies(maxNodesTotalReachedCounter, "maxNodesTotal reached", count -> count >= 1, logger),
        "the cluster autoscaler to report that maxNodesTotal was reached");
    withShortRetryPolicy(logger).consistently(
        countSatisfies(scaleUpCounter, "scale-up", count -> count == expectedScaleUps, logger),
        "no scale-up beyond {0} events at the node cap", expectedScaleUps);
    logger.info("Scaled groups: {0}", scaledGroups);

    logger.info("Deleting workload");
    EventCounter scaleDownCounter = AutoscalerEvents.newScaleDownCounter(eventWatcher, 0);
    actions.deleteIfExists(JOB, workload, PROPAGATION_FOREGROUND);
    cleanup.forget(workload);
    withLongRetryPolicy(logger).until(
        countSatisfies(scaleDownCounter, "scale-down", count -> count >= expectedScaleUps, logger),
        "{0} scale-down events", expectedScaleUps);
    withStandardRetryPolicy(logger).until(this::noWorkloadPodsRemain, "workload pods to be removed");

    // stop the autoscalers before the machine sets they manage are removed
    for (MachineAutoscaler machineAutoscaler : machineAutoscalers) {
      actions.deleteIfExists(MACHINE_AUTOSCALER, machineAutoscaler, PROPAGATION_FOREGROUND);
      cleanup.forget(machineAutoscaler);
    }
    for (MachineSet machineSet : machineSets) {
      actions.deleteIfExists(MACHINE_SET, machineSet, PROPAGATION_FOREGROUND);
      cleanup.forget(machineSet);
      actions.waitForMachineSetDelete(machineSet);
    }
  }

  private List<MachineSet> createTransientMachineSets(List<MachineSet> existingMachineSets) throws ApiException {
    String runId = newRunId();
    List<MachineSet> machineSets = new ArrayList<>();
    for (int i = 0; i < TRANSIENT_MACHINE_SETS; i++) {
      MachineSet source = existingMachineSets.get(i % existingMachineSets.size());
      machineSets.add(create(MACHINE_SET, newTransientMachineSet(source, transientMachineSetName(runId, i))));
    }
    logger.info("Created {0} transient machine sets", machineSets.size());
    return machineSets;
  }

  private <T extends KubernetesObject, L extends KubernetesListObject> T create(ResourceKind<T, L> kind, T object)
      throws ApiException {
    T created = client.create(kind, object);
    logger.info(MessageKeys.RESOURCE_CREATED, kind, getName(created));
    return cleanup.track(kind, created);
  }

  private boolean noWorkloadPodsRemain() throws Exception {
    List<String> workloadPods = client.list(POD, WORKLOAD_NAMESPACE).stream()
        .map(MachineApiActions::getName)
        .filter(name -> name != null && name.contains(WORKLOAD_JOB_NAME))
        .collect(Collectors.toList());
    workloadPods.forEach(name -> logger.info("Still have workload pod {0}", name));
    return workloadPods.isEmpty();
  }
}

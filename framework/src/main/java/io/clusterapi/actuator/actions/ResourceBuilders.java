// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.actions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import io.clusterapi.actuator.client.ResourceKind;
import io.clusterapi.actuator.model.ClusterAutoscaler;
import io.clusterapi.actuator.model.ClusterAutoscalerSpec;
import io.clusterapi.actuator.model.CrossVersionObjectReference;
import io.clusterapi.actuator.model.MachineAutoscaler;
import io.clusterapi.actuator.model.MachineAutoscalerSpec;
import io.clusterapi.actuator.model.MachineSet;
import io.clusterapi.actuator.model.MachineSetSpec;
import io.clusterapi.actuator.model.MachineSpec;
import io.clusterapi.actuator.model.MachineTemplateSpec;
import io.clusterapi.actuator.model.ProviderSpec;
import io.clusterapi.actuator.model.ResourceLimits;
import io.clusterapi.actuator.model.ScaleDownConfig;
import io.clusterapi.actuator.waiter.FatalConfigurationException;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobSpec;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1Node;
import io.kubernetes.client.openapi.models.V1NodeStatus;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1Toleration;

import static io.clusterapi.actuator.ActuatorConstants.AUTOSCALER_WORKER_LABEL;
import static io.clusterapi.actuator.ActuatorConstants.MACHINE_API_NAMESPACE;
import static io.clusterapi.actuator.ActuatorConstants.WORKLOAD_NAMESPACE;

/** Builders for the resources which the autoscaler scenarios create. */
public class ResourceBuilders {

  public static final String AUTOSCALING_TEST_LABEL = "test.autoscaling.label";
  public static final String WORKLOAD_JOB_NAME = "e2e-autoscaler-workload";
  public static final String CLUSTER_KEY = "machine.openshift.io/cluster-api-cluster";
  public static final String MACHINE_SET_KEY = "machine.openshift.io/cluster-api-machineset";
  public static final String CLUSTER_AUTOSCALER_NAME = "default";

  private static final String SCALE_DOWN_DELAY = "10s";
  // at least twice the autoscaler sync period, with a large least common multiple
  private static final String UNNEEDED_TIME = "23s";
  private static final BigDecimal WORKLOAD_MEMORY_FRACTION = new BigDecimal("0.7");

  private ResourceBuilders() {
    // no-op
  }

  /**
   * Builds a job whose pods each request the given memory and half a CPU, and which can only run on nodes
   * carrying the autoscaler worker label.
   *
   * @param jobs the completions and parallelism of the job
   * @param memoryRequest the memory request of each pod
   * @return the job
   */
  public static V1Job newWorkload(int jobs, Quantity memoryRequest) {
    V1Container container = new V1Container()
        .name(WORKLOAD_JOB_NAME)
        .image("busybox")
        .command(List.of("sleep", "86400"))
        .resources(new V1ResourceRequirements()
            .putRequestsItem("memory", memoryRequest)
            .putRequestsItem("cpu", new Quantity("500m")));

    return new V1Job()
        .apiVersion(ResourceKind.JOB.getApiVersion())
        .kind(ResourceKind.JOB.getKind())
        .metadata(new V1ObjectMeta()
            .name(WORKLOAD_JOB_NAME)
            .namespace(WORKLOAD_NAMESPACE)
            .putLabelsItem(AUTOSCALING_TEST_LABEL, ""))
        .spec(new V1JobSpec()
            .template(new V1PodTemplateSpec()
                .spec(new V1PodSpec()
                    .addContainersItem(container)
                    .restartPolicy("Never")
                    .putNodeSelectorItem(AUTOSCALER_WORKER_LABEL, "")
                    .addTolerationsItem(new V1Toleration().key("kubemark").operator("Exists"))))
            .backoffLimit(4)
            .completions(jobs)
            .parallelism(jobs));
  }

  /**
   * Computes a memory request of 70% of a node's memory capacity: enough that every node is used, not enough
   * to fit two pods on one node.
   *
   * @param node a worker node
   * @return the memory request
   * @throws FatalConfigurationException if the node does not report its memory capacity
   */
  public static Quantity workloadMemoryRequest(V1Node node) {
    Quantity capacity = Optional.ofNullable(node.getStatus())
        .map(V1NodeStatus::getCapacity)
        .map(c -> c.get("memory"))
        .orElseThrow(() -> new FatalConfigurationException(
            "Node " + MachineApiActions.getName(node) + " reports no memory capacity"));
    BigDecimal bytes = capacity.getNumber().multiply(WORKLOAD_MEMORY_FRACTION).setScale(0, RoundingMode.DOWN);
    return new Quantity(bytes, Quantity.Format.DECIMAL_SI);
  }

  /**
   * Builds the cluster autoscaler, configured to scale down quickly and to cap the cluster size.
   *
   * @param maxNodesTotal the maximum number of nodes in the cluster
   * @return the cluster autoscaler
   */
  public static ClusterAutoscaler newClusterAutoscaler(int maxNodesTotal) {
    return new ClusterAutoscaler()
        .apiVersion(ResourceKind.CLUSTER_AUTOSCALER.getApiVersion())
        .kind(ResourceKind.CLUSTER_AUTOSCALER.getKind())
        .metadata(new V1ObjectMeta()
            .name(CLUSTER_AUTOSCALER_NAME)
            .putLabelsItem(AUTOSCALING_TEST_LABEL, ""))
        .spec(new ClusterAutoscalerSpec()
            .scaleDown(new ScaleDownConfig()
                .enabled(true)
                .delayAfterAdd(SCALE_DOWN_DELAY)
                .delayAfterDelete(SCALE_DOWN_DELAY)
                .delayAfterFailure(SCALE_DOWN_DELAY)
                .unneededTime(UNNEEDED_TIME))
            .resourceLimits(new ResourceLimits().maxNodesTotal(maxNodesTotal)));
  }

  /**
   * Builds a machine autoscaler for a machine set. The name is generated by the server.
   *
   * @param target the machine set to scale
   * @param minReplicas the minimum size
   * @param maxReplicas the maximum size
   * @return the machine autoscaler
   */
  public static MachineAutoscaler newMachineAutoscaler(MachineSet target, int minReplicas, int maxReplicas) {
    return new MachineAutoscaler()
        .apiVersion(ResourceKind.MACHINE_AUTOSCALER.getApiVersion())
        .kind(ResourceKind.MACHINE_AUTOSCALER.getKind())
        .metadata(new V1ObjectMeta()
            .generateName("autoscale-" + MachineApiActions.getName(target))
            .namespace(MACHINE_API_NAMESPACE)
            .putLabelsItem(AUTOSCALING_TEST_LABEL, ""))
        .spec(new MachineAutoscalerSpec()
            .minReplicas(minReplicas)
            .maxReplicas(maxReplicas)
            .scaleTargetRef(new CrossVersionObjectReference()
                .apiVersion(ResourceKind.MACHINE_SET.getApiVersion())
                .kind(ResourceKind.MACHINE_SET.getKind())
                .name(MachineApiActions.getName(target))));
  }

  /**
   * Builds a machine set for a cluster. Selector and template labels are added to the cluster and machine set
   * labels without replacing them.
   *
   * @param clusterName the cluster name
   * @param namespace the namespace
   * @param name the machine set name
   * @param selectorLabels additional labels for the selector
   * @param templateLabels additional labels for the machine template
   * @param providerSpec the provider configuration for the machines
   * @param replicas the desired replicas
   * @return the machine set
   */
  public static MachineSet newMachineSet(String clusterName, String namespace, String name,
                                         Map<String, String> selectorLabels, Map<String, String> templateLabels,
                                         ProviderSpec providerSpec, int replicas) {
    Map<String, String> matchLabels = new HashMap<>(Map.of(MACHINE_SET_KEY, name, CLUSTER_KEY, clusterName));
    Map<String, String> machineLabels = new HashMap<>(matchLabels);
    Optional.ofNullable(selectorLabels).ifPresent(labels -> labels.forEach(matchLabels::putIfAbsent));
    Optional.ofNullable(templateLabels).ifPresent(labels -> labels.forEach(machineLabels::putIfAbsent));

    return new MachineSet()
        .apiVersion(ResourceKind.MACHINE_SET.getApiVersion())
        .kind(ResourceKind.MACHINE_SET.getKind())
        .metadata(new V1ObjectMeta()
            .name(name)
            .namespace(namespace)
            .putLabelsItem(CLUSTER_KEY, clusterName))
        .spec(new MachineSetSpec()
            .replicas(replicas)
            .selector(new V1LabelSelector().matchLabels(matchLabels))
            .template(new MachineTemplateSpec()
                .metadata(new V1ObjectMeta().labels(machineLabels))
                .spec(new MachineSpec()
                    .providerSpec(new ProviderSpec().value(providerSpec == null ? null : providerSpec.getValue())))));
  }

  /**
   * Builds a one-replica machine set which copies the cluster, labels and provider configuration of an existing
   * machine set. Its nodes carry the autoscaler worker label.
   *
   * @param source the machine set to copy
   * @param name the name of the new machine set
   * @return the machine set
   */
  public static MachineSet newTransientMachineSet(MachineSet source, String name) {
    MachineSetSpec sourceSpec = source.getSpec();
    Map<String, String> selectorLabels = Optional.ofNullable(sourceSpec.getSelector())
        .map(V1LabelSelector::getMatchLabels).orElse(null);
    MachineTemplateSpec sourceTemplate = Optional.ofNullable(sourceSpec.getTemplate())
        .orElse(new MachineTemplateSpec());
    Map<String, String> templateLabels = Optional.ofNullable(sourceTemplate.getMetadata())
        .map(V1ObjectMeta::getLabels).orElse(null);
    ProviderSpec providerSpec = Optional.ofNullable(sourceTemplate.getSpec())
        .map(MachineSpec::getProviderSpec).orElse(null);

    String clusterName = MachineApiActions.getLabels(source).get(CLUSTER_KEY);
    if (clusterName == null) {
      throw new FatalConfigurationException(
          "MachineSet " + MachineApiActions.getName(source) + " has no " + CLUSTER_KEY + " label");
    }

    MachineSet machineSet = newMachineSet(clusterName, source.getMetadata().getNamespace(), name, selectorLabels, templateLabels, providerSpec, 1);
    machineSet.getSpec().getTemplate().getSpec()
        .metadata(new V1ObjectMeta().putLabelsItem(AUTOSCALER_WORKER_LABEL, ""));
    return machineSet;
  }

  /**
   * Returns the name of the i'th transient machine set of a test run.
   *
   * @param runId an identifier of the test run
   * @param index the machine set index
   * @return the name
   */
  public static String transientMachineSetName(String runId, int index) {
    return "e2e-" + runId + "-w-" + index;
  }

  /**
   * Generates a short random identifier for a test run.
   *
   * @return five characters of a random UUID
   */
  public static String newRunId() {
    return UUID.randomUUID().toString().substring(0, 5);
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.client;

import io.clusterapi.actuator.model.ClusterAutoscaler;
import io.clusterapi.actuator.model.ClusterAutoscalerList;
import io.clusterapi.actuator.model.ClusterOperator;
import io.clusterapi.actuator.model.ClusterOperatorList;
import io.clusterapi.actuator.model.Machine;
import io.clusterapi.actuator.model.MachineAutoscaler;
import io.clusterapi.actuator.model.MachineAutoscalerList;
import io.clusterapi.actuator.model.MachineList;
import io.clusterapi.actuator.model.MachineSet;
import io.clusterapi.actuator.model.MachineSetList;
import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.CoreV1Event;
import io.kubernetes.client.openapi.models.CoreV1EventList;
import io.kubernetes.client.openapi.models.V1DaemonSet;
import io.kubernetes.client.openapi.models.V1DaemonSetList;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentList;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobList;
import io.kubernetes.client.openapi.models.V1Node;
import io.kubernetes.client.openapi.models.V1NodeList;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;

import static io.clusterapi.actuator.ActuatorConstants.AUTOSCALING_GROUP;
import static io.clusterapi.actuator.ActuatorConstants.CONFIG_GROUP;
import static io.clusterapi.actuator.ActuatorConstants.MACHINE_API_GROUP;
import static io.clusterapi.actuator.ActuatorConstants.MACHINE_API_VERSION;

/**
 * Describes a kind of cluster resource: its Java types and the REST coordinates used to reach it.
 *
 * @param <T> the resource type
 * @param <L> the list type
 */
public final class ResourceKind<T extends KubernetesObject, L extends KubernetesListObject> {

  public static final ResourceKind<V1Node, V1NodeList> NODE =
      new ResourceKind<>("Node", V1Node.class, V1NodeList.class, "", "v1", "nodes", false);
  public static final ResourceKind<V1Pod, V1PodList> POD =
      new ResourceKind<>("Pod", V1Pod.class, V1PodList.class, "", "v1", "pods", true);
  public static final ResourceKind<CoreV1Event, CoreV1EventList> EVENT =
      new ResourceKind<>("Event", CoreV1Event.class, CoreV1EventList.class, "", "v1", "events", true);
  public static final ResourceKind<V1Deployment, V1DeploymentList> DEPLOYMENT =
      new ResourceKind<>("Deployment", V1Deployment.class, V1DeploymentList.class, "apps", "v1", "deployments", true);
  public static final ResourceKind<V1DaemonSet, V1DaemonSetList> DAEMON_SET =
      new ResourceKind<>("DaemonSet", V1DaemonSet.class, V1DaemonSetList.class, "apps", "v1", "daemonsets", true);
  public static final ResourceKind<V1Job, V1JobList> JOB =
      new ResourceKind<>("Job", V1Job.class, V1JobList.class, "batch", "v1", "jobs", true);
  public static final ResourceKind<Machine, MachineList> MACHINE =
      new ResourceKind<>("Machine", Machine.class, MachineList.class,
          MACHINE_API_GROUP, MACHINE_API_VERSION, "machines", true);
  public static final ResourceKind<MachineSet, MachineSetList> MACHINE_SET =
      new ResourceKind<>("MachineSet", MachineSet.class, MachineSetList.class,
          MACHINE_API_GROUP, MACHINE_API_VERSION, "machinesets", true);
  public static final ResourceKind<MachineAutoscaler, MachineAutoscalerList> MACHINE_AUTOSCALER =
      new ResourceKind<>("MachineAutoscaler", MachineAutoscaler.class, MachineAutoscalerList.class,
          AUTOSCALING_GROUP, "v1beta1", "machineautoscalers", true);
  public static final ResourceKind<ClusterAutoscaler, ClusterAutoscalerList> CLUSTER_AUTOSCALER =
      new ResourceKind<>("ClusterAutoscaler", ClusterAutoscaler.class, ClusterAutoscalerList.class,
          AUTOSCALING_GROUP, "v1", "clusterautoscalers", false);
  public static final ResourceKind<ClusterOperator, ClusterOperatorList> CLUSTER_OPERATOR =
      new ResourceKind<>("ClusterOperator", ClusterOperator.class, ClusterOperatorList.class,
          CONFIG_GROUP, "v1", "clusteroperators", false);

  private final String kind;
  private final Class<T> apiClass;
  private final Class<L> listClass;
  private final String group;
  private final String version;
  private final String plural;
  private final boolean namespaced;

  ResourceKind(String kind, Class<T> apiClass, Class<L> listClass, String group, String version, String plural,
               boolean namespaced) {
    this.kind = kind;
    this.apiClass = apiClass;
    this.listClass = listClass;
    this.group = group;
    this.version = version;
    this.plural = plural;
    this.namespaced = namespaced;
  }

  public String getKind() {
    return kind;
  }

  public Class<T> getApiClass() {
    return apiClass;
  }

  public Class<L> getListClass() {
    return listClass;
  }

  public String getGroup() {
    return group;
  }

  public String getVersion() {
    return version;
  }

  /**
   * Returns the value for the apiVersion field of resources of this kind.
   *
   * @return group/version, or just the version for the core group
   */
  public String getApiVersion() {
    return group.isEmpty() ? version : group + "/" + version;
  }

  public String getPlural() {
    return plural;
  }

  public boolean isNamespaced() {
    return namespaced;
  }

  @Override
  public String toString() {
    return kind;
  }
}

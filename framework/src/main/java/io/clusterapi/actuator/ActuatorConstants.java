// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator;

import java.time.Duration;

import static io.clusterapi.actuator.common.utils.CommonUtils.getEnvironmentProperty;

/**
 * Settings for the verification suite. Each is read from the environment first, then from Java system properties,
 * then defaulted.
 */
public interface ActuatorConstants {

  String MACHINE_API_NAMESPACE = getEnvironmentProperty("MACHINE_API_NAMESPACE", "openshift-machine-api");
  String KUBECONFIG = getEnvironmentProperty("KUBECONFIG", (String) null);

  Duration WAIT_SHORT = Duration.ofSeconds(getEnvironmentProperty("WAIT_SHORT_SECONDS", 60L));
  Duration WAIT_MEDIUM = Duration.ofSeconds(getEnvironmentProperty("WAIT_MEDIUM_SECONDS", 180L));
  Duration WAIT_LONG = Duration.ofSeconds(getEnvironmentProperty("WAIT_LONG_SECONDS", 900L));
  Duration POLL_INTERVAL = Duration.ofSeconds(getEnvironmentProperty("POLL_INTERVAL_SECONDS", 3L));
  Duration READ_POLL_INTERVAL = Duration.ofSeconds(1);

  boolean SKIP_CLEANUP = getEnvironmentProperty("SKIP_CLEANUP", false);

  String WORKLOAD_NAMESPACE = "default";
  String WORKER_NODE_ROLE_LABEL = "node-role.kubernetes.io/worker";
  String MACHINE_ROLE_LABEL = "sigs.k8s.io/cluster-api-machine-role";
  String MACHINE_ANNOTATION_KEY = "machine.openshift.io/machine";
  String AUTOSCALER_WORKER_LABEL = "machine.openshift.io/autoscaler-e2e-worker";
  String MACHINE_API_GROUP = "machine.openshift.io";
  String MACHINE_API_VERSION = "v1beta1";
  String AUTOSCALING_GROUP = "autoscaling.openshift.io";
  String CONFIG_GROUP = "config.openshift.io";
}

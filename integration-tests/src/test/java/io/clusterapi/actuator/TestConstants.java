// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator;

import java.util.Optional;

public interface TestConstants {

  // per-class log files are written below this directory
  String RESULTS_ROOT = Optional.ofNullable(System.getenv("RESULT_ROOT")).orElse("target/it-results");
  String LOGS_DIR = RESULTS_ROOT + "/diagnostics/logs";

  String MACHINE_API_OPERATOR = "machine-api-operator";
  String MACHINE_API_CONTROLLERS = "machine-api-controllers";
  String TERMINATION_HANDLER = "machine-api-termination-handler";
  String MACHINE_API_CLUSTER_OPERATOR = "machine-api";

  int TRANSIENT_MACHINE_SETS = 3;
  int MACHINE_AUTOSCALER_MIN_REPLICAS = 1;
  int MACHINE_AUTOSCALER_MAX_REPLICAS = 2;
}

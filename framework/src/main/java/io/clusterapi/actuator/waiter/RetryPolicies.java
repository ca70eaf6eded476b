// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.waiter;

import java.time.Duration;

import io.clusterapi.actuator.common.logging.LoggingFacade;

import static io.clusterapi.actuator.ActuatorConstants.POLL_INTERVAL;
import static io.clusterapi.actuator.ActuatorConstants.READ_POLL_INTERVAL;
import static io.clusterapi.actuator.ActuatorConstants.WAIT_LONG;
import static io.clusterapi.actuator.ActuatorConstants.WAIT_MEDIUM;
import static io.clusterapi.actuator.ActuatorConstants.WAIT_SHORT;

/** The standard waiters of the suite, built from the configured wait times. */
public class RetryPolicies {

  private RetryPolicies() {
    // no-op
  }

  /** Retries single reads from the cluster: every second for a minute. */
  public static ConvergenceWaiter withReadRetryPolicy(LoggingFacade logger) {
    return new ConvergenceWaiter(READ_POLL_INTERVAL, Duration.ofMinutes(1), logger);
  }

  public static ConvergenceWaiter withShortRetryPolicy(LoggingFacade logger) {
    return new ConvergenceWaiter(POLL_INTERVAL, WAIT_SHORT, logger);
  }

  public static ConvergenceWaiter withStandardRetryPolicy(LoggingFacade logger) {
    return new ConvergenceWaiter(POLL_INTERVAL, WAIT_MEDIUM, logger);
  }

  public static ConvergenceWaiter withLongRetryPolicy(LoggingFacade logger) {
    return new ConvergenceWaiter(POLL_INTERVAL, WAIT_LONG, logger);
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.waiter;

import java.io.Serial;
import java.time.Duration;

/**
 * Thrown when a condition did not converge before the waiter's deadline. The cause, if any, is the last
 * transient error the probe reported.
 */
public class DeadlineExceededException extends RuntimeException {

  @Serial
  private static final long serialVersionUID = 1L;

  private final transient Duration deadline;

  public DeadlineExceededException(String description, Duration deadline, Throwable lastError) {
    super(String.format("Condition '%s' was not met within %d ms", description, deadline.toMillis()), lastError);
    this.deadline = deadline;
  }

  public Duration getDeadline() {
    return deadline;
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.waiter;

import java.io.Serial;

/** Thrown when a condition expected to hold for a whole period was observed false, or could not be read. */
public class ConsistencyViolationException extends RuntimeException {

  @Serial
  private static final long serialVersionUID = 1L;

  public ConsistencyViolationException(String description, long elapsedMillis, Throwable error) {
    super(String.format("Condition '%s' stopped holding after %d ms", description, elapsedMillis), error);
  }
}

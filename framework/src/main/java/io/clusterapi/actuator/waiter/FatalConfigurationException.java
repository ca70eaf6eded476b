// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.waiter;

import java.io.Serial;

/** A malformed reference or contract violation which no amount of waiting will fix. Waiters abort on it. */
public class FatalConfigurationException extends RuntimeException {

  @Serial
  private static final long serialVersionUID = 1L;

  public FatalConfigurationException(String message) {
    super(message);
  }

  public FatalConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}

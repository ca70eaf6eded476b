// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

import java.io.Serial;

/** Thrown when a notification stream cannot be opened or sustained. */
public class SubscriptionException extends Exception {

  @Serial
  private static final long serialVersionUID = 1L;

  public SubscriptionException(String message) {
    super(message);
  }

  public SubscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}

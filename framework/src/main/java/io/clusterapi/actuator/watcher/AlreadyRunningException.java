// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

import java.io.Serial;

/** Thrown when starting an event watcher which is already running. */
public class AlreadyRunningException extends IllegalStateException {

  @Serial
  private static final long serialVersionUID = 1L;

  public AlreadyRunningException(String watcherName) {
    super("Event watcher " + watcherName + " is already running");
  }
}

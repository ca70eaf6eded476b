// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

/** Receives the notifications selected by a registration's predicate. */
@FunctionalInterface
public interface NotificationHandler {

  void handle(Notification notification);
}

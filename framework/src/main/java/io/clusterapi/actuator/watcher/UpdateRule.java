// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

/** Computes a counter's next value from its current value and the matching notification. */
@FunctionalInterface
public interface UpdateRule {

  UpdateRule INCREMENT = (current, notification) -> current + 1;

  long apply(long current, Notification notification);
}

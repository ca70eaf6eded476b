// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.waiter;

/** A single observation of the cluster: true once the expected state has been reached. */
@FunctionalInterface
public interface Probe {

  boolean check() throws Exception;
}

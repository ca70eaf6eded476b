// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

/** Opens subscriptions to a notification stream. */
@FunctionalInterface
public interface NotificationSource {

  Subscription openSubscription() throws SubscriptionException;
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

import java.util.function.Predicate;

/**
 * A (predicate, handler) pair attached to an {@link EventWatcher}. A disabled registration stays attached but is
 * skipped during dispatch, so it can be re-enabled without racing in-flight deliveries.
 */
public class Registration {

  private final EventWatcher watcher;
  private final Predicate<Notification> predicate;
  private final NotificationHandler handler;
  private volatile boolean enabled;

  Registration(EventWatcher watcher, Predicate<Notification> predicate, NotificationHandler handler,
               boolean enabled) {
    this.watcher = watcher;
    this.predicate = predicate;
    this.handler = handler;
    this.enabled = enabled;
  }

  public void enable() {
    enabled = true;
  }

  public void disable() {
    enabled = false;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** Detaches this registration from its watcher. */
  public void unregister() {
    watcher.unregister(this);
  }

  public boolean isRegistered() {
    return watcher.isRegistered(this);
  }

  Predicate<Notification> getPredicate() {
    return predicate;
  }

  NotificationHandler getHandler() {
    return handler;
  }
}

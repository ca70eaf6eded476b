// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.common.logging.MessageKeys;

/**
 * A count maintained from the notifications delivered by an {@link EventWatcher}. The counter starts disabled;
 * while disabled its value is frozen. Reads and updates are mutually exclusive.
 */
public class EventCounter {

  private final Registration registration;
  private final UpdateRule updateRule;
  private final LoggingFacade logger;
  private final ReentrantLock lock = new ReentrantLock();
  private long value;

  /**
   * Creates a counter and registers it, disabled, with the watcher.
   *
   * @param watcher the watcher which will feed this counter
   * @param predicate selects the notifications which update the counter
   * @param initialValue the starting value
   * @param updateRule computes the new value for each matching notification
   */
  public EventCounter(EventWatcher watcher, Predicate<Notification> predicate, long initialValue,
                      UpdateRule updateRule) {
    this.value = initialValue;
    this.updateRule = updateRule;
    this.logger = watcher.getLogger();
    this.registration = watcher.register(predicate, this::update, false);
  }

  /**
   * Creates a counter starting at zero which adds one for each matching notification.
   *
   * @param watcher the watcher which will feed this counter
   * @param predicate selects the notifications to count
   */
  public EventCounter(EventWatcher watcher, Predicate<Notification> predicate) {
    this(watcher, predicate, 0, UpdateRule.INCREMENT);
  }

  public EventCounter enable() {
    registration.enable();
    return this;
  }

  public EventCounter disable() {
    registration.disable();
    return this;
  }

  public boolean isEnabled() {
    return registration.isEnabled();
  }

  public void unregister() {
    registration.unregister();
  }

  /**
   * Returns the current value.
   *
   * @return the value
   */
  public long get() {
    lock.lock();
    try {
      return value;
    } finally {
      lock.unlock();
    }
  }

  private void update(Notification notification) {
    lock.lock();
    try {
      long updated = updateRule.apply(value, notification);
      if (updated != value) {
        logger.fine(MessageKeys.COUNTER_UPDATED, value, updated);
      }
      value = updated;
    } catch (RuntimeException e) {
      logger.warning(e, MessageKeys.COUNTER_UPDATE_FAILED, notification, value);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "EventCounter{value=" + get() + ", enabled=" + isEnabled() + "}";
  }
}

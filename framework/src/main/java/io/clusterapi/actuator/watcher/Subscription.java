// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

/**
 * A live, unbounded stream of notifications. A subscription is read by a single thread, but may be closed
 * from any thread.
 */
public interface Subscription extends AutoCloseable {

  /**
   * Blocks until the next notification arrives.
   *
   * @return the next notification, or null when the stream has ended or been closed
   * @throws SubscriptionException if the stream can no longer be sustained
   */
  Notification next() throws SubscriptionException;

  /** Ends the stream, unblocking any pending call to {@link #next()}. Closing twice has no effect. */
  @Override
  void close();
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.client;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.common.logging.MessageKeys;
import io.clusterapi.actuator.watcher.Notification;
import io.clusterapi.actuator.watcher.Subscription;
import io.clusterapi.actuator.watcher.SubscriptionException;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.CoreV1Event;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.Watch;
import io.kubernetes.client.util.Watchable;

import static java.net.HttpURLConnection.HTTP_GONE;

/**
 * A subscription to cluster events backed by a sequence of Kubernetes watches. The API server ends each watch
 * after its timeout; the subscription then re-issues it from the last resource version seen. If that version
 * has expired, the subscription starts again from the current state, so events recorded in between are lost.
 * A watch which ends without returning anything is reopened only after the reopen delay.
 * Only when a watch cannot be reopened does {@link #next()} fail.
 */
class EventSubscription implements Subscription {

  static final String ADDED = "ADDED";
  static final String MODIFIED = "MODIFIED";
  static final String ERROR = "ERROR";
  static final String BOOKMARK = "BOOKMARK";

  static final int MAX_OPEN_ATTEMPTS = 3;

  /** The calls a subscription makes against the event API. */
  interface EventWatchSource {

    /** Returns the resource version of the current event list. */
    String currentResourceVersion() throws ApiException;

    Watchable<CoreV1Event> watch(String resourceVersion) throws ApiException;
  }

  private final EventWatchSource source;
  private final Duration reopenDelay;
  private final LoggingFacade logger;
  private String resourceVersion;
  private volatile Watchable<CoreV1Event> watch;
  // whether the current watch has returned any response
  private boolean watchResponded;
  private volatile boolean closed;

  EventSubscription(EventWatchSource source, Duration reopenDelay, LoggingFacade logger) {
    this.source = source;
    this.reopenDelay = reopenDelay;
    this.logger = logger;
  }

  /**
   * Records the starting point of the subscription, so that events which already exist are not replayed.
   *
   * @return this subscription
   * @throws SubscriptionException if the event list cannot be read
   */
  EventSubscription open() throws SubscriptionException {
    try {
      resourceVersion = source.currentResourceVersion();
      watch = source.watch(resourceVersion);
      watchResponded = false;
      return this;
    } catch (ApiException e) {
      throw new SubscriptionException("Unable to open a watch on events: " + e.getMessage(), e);
    }
  }

  // for test
  String getResourceVersion() {
    return resourceVersion;
  }

  @Override
  public Notification next() throws SubscriptionException {
    while (!closed) {
      Watchable<CoreV1Event> current = watch != null ? watch : reopen();
      if (current == null) {
        return null;
      }

      if (hasNext(current)) {
        watchResponded = true;
        Notification notification = handleResponse(current.next());
        if (notification != null) {
          return notification;
        }
      } else {
        closeWatch(current);
        watch = null;
        if (!watchResponded && !closed) {
          pause();
        }
      }
    }
    return null;
  }

  private boolean hasNext(Watchable<CoreV1Event> current) {
    try {
      return current.hasNext();
    } catch (RuntimeException e) {
      // the server or a close() ended the watch
      return false;
    }
  }

  private Notification handleResponse(Watch.Response<CoreV1Event> item) {
    if (ERROR.equalsIgnoreCase(item.type)) {
      handleErrorResponse(item);
      return null;
    }

    trackResourceVersion(item.object);
    if (ADDED.equalsIgnoreCase(item.type) || MODIFIED.equalsIgnoreCase(item.type)) {
      return Notification.from(item.object);
    }
    // BOOKMARK and DELETED carry nothing to report
    return null;
  }

  private void handleErrorResponse(Watch.Response<CoreV1Event> item) {
    int code = Optional.ofNullable(item.status).map(V1Status::getCode).orElse(0);
    if (code == HTTP_GONE) {
      logger.fine(MessageKeys.WATCH_EXPIRED, "events", resourceVersion);
      resourceVersion = null;
    }
    closeWatch(watch);
    watch = null;
  }

  private void trackResourceVersion(CoreV1Event event) {
    Optional.ofNullable(event)
        .map(CoreV1Event::getMetadata)
        .map(V1ObjectMeta::getResourceVersion)
        .ifPresent(v -> resourceVersion = v);
  }

  private Watchable<CoreV1Event> reopen() throws SubscriptionException {
    ApiException lastFailure = null;
    for (int attempt = 1; attempt <= MAX_OPEN_ATTEMPTS && !closed; attempt++) {
      try {
        if (resourceVersion == null) {
          resourceVersion = source.currentResourceVersion();
        }
        watch = source.watch(resourceVersion);
        watchResponded = false;
        if (closed) {
          closeWatch(watch);
          return null;
        }
        return watch;
      } catch (ApiException e) {
        lastFailure = e;
        if (e.getCode() == HTTP_GONE) {
          resourceVersion = null;
        }
        logger.fine(e, MessageKeys.WATCH_RECONNECT_FAILED, "events");
        pause();
      }
    }

    if (closed) {
      return null;
    }
    throw new SubscriptionException("Unable to reopen the watch on events after " + MAX_OPEN_ATTEMPTS
        + " attempts", lastFailure);
  }

  private void pause() {
    try {
      Thread.sleep(reopenDelay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      closed = true;
    }
  }

  @Override
  public void close() {
    closed = true;
    closeWatch(watch);
  }

  private void closeWatch(Watchable<CoreV1Event> current) {
    if (current == null) {
      return;
    }
    try {
      current.close();
    } catch (IOException | RuntimeException e) {
      logger.finest("Ignoring failure closing a watch", e);
    }
  }
}

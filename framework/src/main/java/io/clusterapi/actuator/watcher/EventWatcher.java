// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.common.logging.MessageKeys;

/**
 * Owns a single subscription to a notification stream and fans every arriving notification out to the
 * registered (predicate, handler) pairs. Dispatch runs on one thread obtained from the supplied thread factory.
 *
 * <p>A watcher may be started once. {@link #stop()} is idempotent and terminal: once it returns, no handler
 * will be invoked again. When the stream ends or fails the dispatch loop exits and the watcher stops running;
 * it does not reconnect and cannot be restarted. A failure is available from {@link #getFailure()}.
 */
public class EventWatcher {

  // ENDED: the stream finished or failed while running
  private enum State { NEW, RUNNING, ENDED, STOPPED }

  private final String name;
  private final NotificationSource source;
  private final ThreadFactory threadFactory;
  private final LoggingFacade logger;
  private final List<Registration> registrations = new CopyOnWriteArrayList<>();

  // guards the lifecycle state and every dispatch pass
  private final ReentrantLock lock = new ReentrantLock();
  private State state = State.NEW;
  private Subscription subscription;
  private Thread thread;
  private volatile SubscriptionException failure;
  // set before stop() waits for the lock, so no new delivery starts once stop() has been called
  private volatile boolean stopRequested;

  /**
   * Creates a watcher.
   *
   * @param name a name for diagnostics
   * @param source the source from which to open the subscription
   * @param threadFactory the factory for the dispatch thread
   * @param logger the diagnostic sink
   */
  public EventWatcher(String name, NotificationSource source, ThreadFactory threadFactory, LoggingFacade logger) {
    this.name = name;
    this.source = source;
    this.threadFactory = threadFactory;
    this.logger = logger;
  }

  /**
   * Creates a watcher whose dispatch thread is a daemon thread named after the watcher.
   *
   * @param name a name for diagnostics
   * @param source the source from which to open the subscription
   * @param logger the diagnostic sink
   */
  public EventWatcher(String name, NotificationSource source, LoggingFacade logger) {
    this(name, source, r -> {
      Thread t = new Thread(r, "event-watcher-" + name);
      t.setDaemon(true);
      return t;
    }, logger);
  }

  public String getName() {
    return name;
  }

  public LoggingFacade getLogger() {
    return logger;
  }

  /**
   * Opens the subscription and starts dispatching.
   *
   * @throws SubscriptionException if the subscription cannot be opened
   * @throws AlreadyRunningException if the watcher is already running
   * @throws IllegalStateException if the watcher has been stopped
   */
  public void start() throws SubscriptionException {
    lock.lock();
    try {
      if (state == State.RUNNING) {
        throw new AlreadyRunningException(name);
      } else if (state == State.STOPPED) {
        throw new IllegalStateException("Event watcher " + name + " has been stopped and cannot be restarted");
      } else if (state == State.ENDED) {
        throw new IllegalStateException("The stream of event watcher " + name + " has ended; create a new watcher");
      }

      subscription = source.openSubscription();
      state = State.RUNNING;
      thread = threadFactory.newThread(this::doWatch);
      thread.start();
      logger.info(MessageKeys.WATCHER_STARTED, name);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the subscription and waits for any in-flight delivery. No handler is invoked after this returns.
   */
  public void stop() {
    Subscription toClose;
    Thread toJoin;
    stopRequested = true;
    lock.lock();
    try {
      if (state == State.STOPPED) {
        return;
      }
      state = State.STOPPED;
      toClose = subscription;
      toJoin = thread;
    } finally {
      lock.unlock();
    }

    if (toClose != null) {
      toClose.close();
    }
    if (toJoin != null && toJoin != Thread.currentThread()) {
      waitForExit(toJoin);
    }
    logger.info(MessageKeys.WATCHER_STOPPED, name);
  }

  private void waitForExit(Thread dispatchThread) {
    try {
      dispatchThread.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public boolean isRunning() {
    lock.lock();
    try {
      return state == State.RUNNING;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the failure which ended the subscription while the watcher was running.
   *
   * @return the failure, or null if the stream has not failed
   */
  public SubscriptionException getFailure() {
    return failure;
  }

  /**
   * Adds an enabled fan-out target. It receives only notifications arriving after this call.
   *
   * @param predicate selects the notifications to deliver
   * @param handler receives the selected notifications
   * @return the registration
   */
  public Registration register(Predicate<Notification> predicate, NotificationHandler handler) {
    return register(predicate, handler, true);
  }

  Registration register(Predicate<Notification> predicate, NotificationHandler handler, boolean enabled) {
    Registration registration = new Registration(this, predicate, handler, enabled);
    registrations.add(registration);
    return registration;
  }

  void unregister(Registration registration) {
    registrations.remove(registration);
  }

  boolean isRegistered(Registration registration) {
    return registrations.contains(registration);
  }

  private void doWatch() {
    try {
      Notification notification;
      while ((notification = subscription.next()) != null) {
        if (!dispatch(notification)) {
          return;
        }
      }
    } catch (SubscriptionException e) {
      recordFailure(e);
    } catch (RuntimeException e) {
      recordFailure(new SubscriptionException("Notification stream of " + name + " failed", e));
    } finally {
      markEnded();
    }
  }

  private void markEnded() {
    lock.lock();
    try {
      if (state == State.RUNNING) {
        state = State.ENDED;
      }
    } finally {
      lock.unlock();
    }
  }

  private boolean dispatch(Notification notification) {
    lock.lock();
    try {
      if (!isDispatching()) {
        return false;
      }
      logger.finer(MessageKeys.NOTIFICATION_RECEIVED, name, notification);
      for (Registration registration : registrations) {
        if (!isDispatching()) {
          return false;
        }
        if (registration.isEnabled()) {
          deliver(registration, notification);
        }
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  private boolean isDispatching() {
    return state == State.RUNNING && !stopRequested;
  }

  private void deliver(Registration registration, Notification notification) {
    boolean matches;
    try {
      matches = registration.getPredicate().test(notification);
    } catch (RuntimeException e) {
      logger.warning(e, MessageKeys.PREDICATE_FAILED, name, notification);
      return;
    }

    if (matches) {
      try {
        registration.getHandler().handle(notification);
      } catch (RuntimeException e) {
        logger.warning(e, MessageKeys.HANDLER_FAILED, name, notification);
      }
    }
  }

  private void recordFailure(SubscriptionException e) {
    lock.lock();
    try {
      if (state == State.RUNNING) {
        failure = e;
        logger.warning(e, MessageKeys.SUBSCRIPTION_FAILED, name);
      } else {
        logger.fine(e, MessageKeys.SUBSCRIPTION_FAILED, name);
      }
    } finally {
      lock.unlock();
    }
  }
}

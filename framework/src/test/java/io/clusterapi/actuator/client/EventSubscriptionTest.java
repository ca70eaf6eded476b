// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.client;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import com.meterware.simplestub.Memento;
import io.clusterapi.actuator.common.logging.LoggingFactory;
import io.clusterapi.actuator.common.utils.TestUtils;
import io.clusterapi.actuator.watcher.Notification;
import io.clusterapi.actuator.watcher.SubscriptionException;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.CoreV1Event;
import io.kubernetes.client.openapi.models.V1EventSource;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1ObjectReference;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.Watch;
import io.kubernetes.client.util.Watchable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.clusterapi.actuator.client.EventSubscription.ADDED;
import static io.clusterapi.actuator.client.EventSubscription.BOOKMARK;
import static io.clusterapi.actuator.client.EventSubscription.ERROR;
import static io.clusterapi.actuator.client.EventSubscription.MAX_OPEN_ATTEMPTS;
import static io.clusterapi.actuator.client.EventSubscription.MODIFIED;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EventSubscriptionTest {

  private final List<Memento> mementos = new ArrayList<>();
  private final StubWatchSource source = new StubWatchSource();
  private final EventSubscription subscription =
      new EventSubscription(source, Duration.ZERO, LoggingFactory.getLogger());

  @BeforeEach
  void setUp() {
    mementos.add(TestUtils.silenceActuatorLogger());
  }

  @AfterEach
  void tearDown() {
    subscription.close();
    mementos.forEach(Memento::revert);
  }

  private static CoreV1Event event(String resourceVersion, String reason) {
    return new CoreV1Event()
        .metadata(new V1ObjectMeta().name("event-" + resourceVersion).resourceVersion(resourceVersion))
        .source(new V1EventSource().component("cluster-autoscaler"))
        .involvedObject(new V1ObjectReference().kind("ConfigMap").name("cluster-autoscaler-status"))
        .reason(reason)
        .message("message " + resourceVersion);
  }

  private static Watch.Response<CoreV1Event> response(String type, CoreV1Event event) {
    return new Watch.Response<>(type, event);
  }

  private static Watch.Response<CoreV1Event> errorResponse(int code) {
    Watch.Response<CoreV1Event> error = new Watch.Response<>(ERROR, new CoreV1Event());
    error.status = new V1Status().code(code);
    return error;
  }

  @Test
  void whenOpened_watchStartsFromCurrentResourceVersion() throws SubscriptionException {
    source.currentVersion = "100";
    source.addWatch();

    subscription.open();

    assertThat(source.watchedVersions, contains("100"));
  }

  @Test
  void whenOpenFails_throwSubscriptionException() {
    source.listFailure = new ApiException(403, "forbidden");

    assertThrows(SubscriptionException.class, subscription::open);
  }

  @Test
  void addedAndModifiedEvents_areReportedInOrder() throws SubscriptionException {
    source.addWatch(response(ADDED, event("101", "First")), response(MODIFIED, event("102", "Second")));
    subscription.open();

    Notification first = subscription.next();
    Notification second = subscription.next();

    assertThat(first.reason(), equalTo("First"));
    assertThat(first.component(), equalTo("cluster-autoscaler"));
    assertThat(second.reason(), equalTo("Second"));
    assertThat(subscription.getResourceVersion(), equalTo("102"));
  }

  @Test
  void bookmarkAndDeletedEvents_areSkipped() throws SubscriptionException {
    source.addWatch(
        response(BOOKMARK, event("101", "Bookmark")),
        response("DELETED", event("102", "Deleted")),
        response(ADDED, event("103", "Added")));
    subscription.open();

    assertThat(subscription.next().reason(), equalTo("Added"));
  }

  @Test
  void whenWatchEnds_reopenFromLastSeenResourceVersion() throws SubscriptionException {
    source.currentVersion = "100";
    source.addWatch(response(ADDED, event("105", "BeforeTimeout")));
    source.addWatch(response(ADDED, event("106", "AfterTimeout")));
    subscription.open();

    subscription.next();
    Notification afterReopen = subscription.next();

    assertThat(afterReopen.reason(), equalTo("AfterTimeout"));
    assertThat(source.watchedVersions, contains("100", "105"));
  }

  @Test
  void whenResourceVersionExpired_restartFromCurrentState() throws SubscriptionException {
    source.currentVersion = "100";
    source.addWatch(response(ADDED, event("105", "Before")), errorResponse(410));
    source.addWatch(response(ADDED, event("201", "After")));
    subscription.open();

    subscription.next();
    source.currentVersion = "200";
    Notification afterExpiry = subscription.next();

    assertThat(afterExpiry.reason(), equalTo("After"));
    assertThat(source.watchedVersions, contains("100", "200"));
  }

  @Test
  void whenOtherErrorReceived_reopenFromLastSeenResourceVersion() throws SubscriptionException {
    source.currentVersion = "100";
    source.addWatch(response(ADDED, event("105", "Before")), errorResponse(500));
    source.addWatch(response(ADDED, event("106", "After")));
    subscription.open();

    subscription.next();
    subscription.next();

    assertThat(source.watchedVersions, contains("100", "105"));
  }

  @Test
  void whenWatchCannotBeReopened_throwSubscriptionException() throws SubscriptionException {
    source.addWatch();
    subscription.open();

    assertThrows(SubscriptionException.class, subscription::next);
    assertThat(source.watchedVersions.size(), equalTo(1 + MAX_OPEN_ATTEMPTS));
  }

  @Test
  void afterClose_nextReturnsNullAndWatchIsClosed() throws SubscriptionException {
    StubWatch watch = source.addWatch(response(ADDED, event("101", "Unread")));
    subscription.open();

    subscription.close();

    assertThat(subscription.next(), nullValue());
    assertThat(watch.closed, is(true));
  }

  @Test
  void whenWatchEndsWithoutResponses_waitReopenDelayBeforeReopening() throws SubscriptionException {
    EventSubscription delayed = new EventSubscription(source, Duration.ofMillis(200), LoggingFactory.getLogger());
    source.addWatch();
    source.addWatch();
    source.addWatch();
    source.addWatch(response(ADDED, event("101", "AfterEmptyWatches")));
    delayed.open();

    long start = System.nanoTime();
    Notification notification = delayed.next();
    long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();
    delayed.close();

    assertThat(notification.reason(), equalTo("AfterEmptyWatches"));
    assertThat(source.watchedVersions.size(), equalTo(4));
    assertThat(elapsedMillis, greaterThanOrEqualTo(600L));
  }

  @Test
  void whenWatchEndsAfterResponses_reopenWithoutDelay() throws SubscriptionException {
    EventSubscription delayed = new EventSubscription(source, Duration.ofSeconds(10), LoggingFactory.getLogger());
    source.addWatch(response(ADDED, event("101", "BeforeTimeout")));
    source.addWatch(response(ADDED, event("102", "AfterTimeout")));
    delayed.open();
    delayed.next();

    long start = System.nanoTime();
    Notification notification = delayed.next();
    long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();
    delayed.close();

    assertThat(notification.reason(), equalTo("AfterTimeout"));
    assertThat(elapsedMillis, lessThan(5000L));
  }

  static class StubWatchSource implements EventSubscription.EventWatchSource {
    private final Deque<StubWatch> watches = new ArrayDeque<>();
    private final List<String> watchedVersions = new ArrayList<>();
    private String currentVersion = "1";
    private ApiException listFailure;

    @SafeVarargs
    final StubWatch addWatch(Watch.Response<CoreV1Event>... responses) {
      StubWatch watch = new StubWatch(List.of(responses));
      watches.add(watch);
      return watch;
    }

    @Override
    public String currentResourceVersion() throws ApiException {
      if (listFailure != null) {
        throw listFailure;
      }
      return currentVersion;
    }

    @Override
    public Watchable<CoreV1Event> watch(String resourceVersion) throws ApiException {
      watchedVersions.add(resourceVersion);
      if (watches.isEmpty()) {
        throw new ApiException(500, "watch refused");
      }
      return watches.poll();
    }
  }

  static class StubWatch implements Watchable<CoreV1Event> {
    private final Iterator<Watch.Response<CoreV1Event>> responses;
    private boolean closed;

    StubWatch(List<Watch.Response<CoreV1Event>> responses) {
      this.responses = responses.iterator();
    }

    @Override
    public boolean hasNext() {
      return !closed && responses.hasNext();
    }

    @Override
    public Watch.Response<CoreV1Event> next() {
      return responses.next();
    }

    @Override
    public Iterator<Watch.Response<CoreV1Event>> iterator() {
      return this;
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.actions;

import java.util.Map;
import java.util.function.LongPredicate;
import java.util.function.Predicate;

import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.common.logging.MessageKeys;
import io.clusterapi.actuator.waiter.Probe;
import io.clusterapi.actuator.watcher.EventCounter;
import io.clusterapi.actuator.watcher.EventWatcher;
import io.clusterapi.actuator.watcher.Notification;
import io.clusterapi.actuator.watcher.Registration;
import io.clusterapi.actuator.watcher.UpdateRule;

import static io.clusterapi.actuator.watcher.Notifications.fromComponent;
import static io.clusterapi.actuator.watcher.Notifications.involvingKind;
import static io.clusterapi.actuator.watcher.Notifications.messageStartsWith;
import static io.clusterapi.actuator.watcher.Notifications.withReason;

/**
 * Counters over the events which the cluster autoscaler records against its status config map. Every counter
 * returned here is already enabled.
 */
public class AutoscalerEvents {

  public static final String CLUSTER_AUTOSCALER_COMPONENT = "cluster-autoscaler";
  public static final String CLUSTER_AUTOSCALER_OBJECT_KIND = "ConfigMap";
  public static final String SCALED_UP_GROUP = "ScaledUpGroup";
  public static final String SCALE_DOWN_EMPTY = "ScaleDownEmpty";
  public static final String MAX_NODES_TOTAL_REACHED = "MaxNodesTotalReached";

  private AutoscalerEvents() {
    // no-op
  }

  public static Predicate<Notification> isScaleUpEvent() {
    return autoscalerEvent(SCALED_UP_GROUP, "Scale-up: setting group");
  }

  public static Predicate<Notification> isScaleDownEvent() {
    return autoscalerEvent(SCALE_DOWN_EMPTY, "Scale-down: empty node");
  }

  public static Predicate<Notification> isMaxNodesTotalReachedEvent() {
    return autoscalerEvent(MAX_NODES_TOTAL_REACHED, "Max total nodes in cluster reached");
  }

  /**
   * Counts scale-up events. The autoscaler records two events for each scale-up: one when it decides on the
   * new group size, which is counted, and one once the size has been set. Each group in {@code scaledGroups}
   * which is still mapped to false is marked true when the second of these names it. The map is owned by the
   * caller and is updated on the watcher's dispatch thread, so it should be a concurrent map.
   *
   * @param watcher the watcher
   * @param initialValue the starting count
   * @param scaledGroups the groups to track, keyed by namespace/name
   * @return the enabled counter
   */
  public static EventCounter newScaleUpCounter(EventWatcher watcher, long initialValue,
                                               Map<String, Boolean> scaledGroups) {
    Predicate<Notification> isScaleUp = isScaleUpEvent();
    Predicate<Notification> isScaledGroup = autoscalerEvent(SCALED_UP_GROUP, "Scale-up: group ");
    Predicate<Notification> markingGroups = notification -> {
      if (isScaledGroup.test(notification)) {
        markScaledGroups(watcher, notification, scaledGroups);
      }
      return isScaleUp.test(notification);
    };
    return new EventCounter(watcher, markingGroups, initialValue, UpdateRule.INCREMENT).enable();
  }

  private static void markScaledGroups(EventWatcher watcher, Notification notification,
                                       Map<String, Boolean> scaledGroups) {
    for (Map.Entry<String, Boolean> group : scaledGroups.entrySet()) {
      if (!group.getValue()
          && notification.message().startsWith("Scale-up: group " + group.getKey() + " size set to")) {
        group.setValue(true);
        watcher.getLogger().info(MessageKeys.SCALE_UP_GROUP_SEEN, group.getKey());
      }
    }
  }

  public static EventCounter newScaleDownCounter(EventWatcher watcher, long initialValue) {
    return new EventCounter(watcher, isScaleDownEvent(), initialValue, UpdateRule.INCREMENT).enable();
  }

  public static EventCounter newMaxNodesTotalReachedCounter(EventWatcher watcher, long initialValue) {
    return new EventCounter(watcher, isMaxNodesTotalReachedEvent(), initialValue, UpdateRule.INCREMENT).enable();
  }

  /**
   * Logs every event recorded by the cluster autoscaler.
   *
   * @param watcher the watcher
   * @param logger the destination
   * @return the registration
   */
  public static Registration logAutoscalerEvents(EventWatcher watcher, LoggingFacade logger) {
    return watcher.register(fromComponent(CLUSTER_AUTOSCALER_COMPONENT),
        notification -> logger.info("{0}: {1}", notification.involvedName(), notification.message()));
  }

  /**
   * A wait condition over a counter which logs the value it saw on every poll.
   *
   * @param counter the counter
   * @param events what the counter counts, for the log
   * @param condition applied to the current count
   * @param logger the destination
   * @return the condition
   */
  public static Probe countSatisfies(EventCounter counter, String events, LongPredicate condition,
                                     LoggingFacade logger) {
    return () -> {
      long observed = counter.get();
      logger.info(MessageKeys.EVENT_COUNT_OBSERVED, observed, events);
      return condition.test(observed);
    };
  }

  private static Predicate<Notification> autoscalerEvent(String reason, String messagePrefix) {
    return fromComponent(CLUSTER_AUTOSCALER_COMPONENT)
        .and(withReason(reason))
        .and(involvingKind(CLUSTER_AUTOSCALER_OBJECT_KIND))
        .and(messageStartsWith(messagePrefix));
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

import java.time.OffsetDateTime;
import java.util.Optional;

import io.kubernetes.client.openapi.models.CoreV1Event;
import io.kubernetes.client.openapi.models.V1EventSource;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1ObjectReference;

/**
 * One observed control-plane occurrence, built from a Kubernetes event. Instances are immutable.
 *
 * @param component the component which reported the event
 * @param reason the machine-readable reason code
 * @param message the human-readable message
 * @param involvedKind the kind of the object the event is about
 * @param involvedNamespace the namespace of that object, null for cluster-scoped objects
 * @param involvedName the name of that object
 * @param timestamp when the event was last observed
 */
public record Notification(String component, String reason, String message,
                           String involvedKind, String involvedNamespace, String involvedName,
                           OffsetDateTime timestamp) {

  /**
   * Creates a notification from a Kubernetes event. The component is taken from the event source, or from the
   * reporting component for events recorded through the events.k8s.io API.
   *
   * @param event the event
   * @return the corresponding notification
   */
  public static Notification from(CoreV1Event event) {
    V1ObjectReference involved = Optional.ofNullable(event.getInvolvedObject()).orElse(new V1ObjectReference());
    return new Notification(
        getComponent(event),
        event.getReason(),
        event.getMessage(),
        involved.getKind(),
        involved.getNamespace(),
        involved.getName(),
        getTimestamp(event));
  }

  private static String getComponent(CoreV1Event event) {
    return Optional.ofNullable(event.getSource())
        .map(V1EventSource::getComponent)
        .orElse(event.getReportingComponent());
  }

  private static OffsetDateTime getTimestamp(CoreV1Event event) {
    return Optional.ofNullable(event.getLastTimestamp())
        .or(() -> Optional.ofNullable(event.getEventTime()))
        .or(() -> Optional.ofNullable(event.getFirstTimestamp()))
        .or(() -> Optional.ofNullable(event.getMetadata()).map(V1ObjectMeta::getCreationTimestamp))
        .orElse(null);
  }

  @Override
  public String toString() {
    return String.format("%s/%s %s %s/%s: %s", component, reason, involvedKind, involvedNamespace, involvedName,
        message);
  }
}

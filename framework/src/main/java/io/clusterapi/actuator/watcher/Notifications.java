// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.watcher;

import java.util.Objects;
import java.util.function.Predicate;

/** Stock predicates over notifications. Combine them with {@link Predicate#and}, {@link Predicate#or} and
 * {@link Predicate#negate}. */
public class Notifications {

  private Notifications() {
    // no-op
  }

  public static Predicate<Notification> matchAny() {
    return n -> true;
  }

  public static Predicate<Notification> matchNone() {
    return n -> false;
  }

  public static Predicate<Notification> fromComponent(String component) {
    return n -> Objects.equals(component, n.component());
  }

  public static Predicate<Notification> withReason(String reason) {
    return n -> Objects.equals(reason, n.reason());
  }

  public static Predicate<Notification> involvingKind(String kind) {
    return n -> Objects.equals(kind, n.involvedKind());
  }

  public static Predicate<Notification> involving(String kind, String name) {
    return involvingKind(kind).and(n -> Objects.equals(name, n.involvedName()));
  }

  public static Predicate<Notification> messageStartsWith(String prefix) {
    return n -> n.message() != null && n.message().startsWith(prefix);
  }
}

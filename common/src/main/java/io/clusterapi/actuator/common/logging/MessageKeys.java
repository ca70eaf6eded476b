// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.common.logging;

/**
 * Message keys used to look up log messages from the {@code Actuator} resource bundle.
 * The bundle lives at {@code common/src/main/resources/Actuator.properties}.
 */
public class MessageKeys {
  public static final String WATCHER_STARTED = "ACT-0001";
  public static final String WATCHER_STOPPED = "ACT-0002";
  public static final String SUBSCRIPTION_FAILED = "ACT-0003";
  public static final String PREDICATE_FAILED = "ACT-0004";
  public static final String HANDLER_FAILED = "ACT-0005";
  public static final String NOTIFICATION_RECEIVED = "ACT-0006";
  public static final String COUNTER_UPDATE_FAILED = "ACT-0007";
  public static final String COUNTER_UPDATED = "ACT-0008";
  public static final String WATCH_EXPIRED = "ACT-0009";
  public static final String WATCH_RECONNECT_FAILED = "ACT-0010";

  public static final String WAITING_FOR_CONDITION = "ACT-0020";
  public static final String CONDITION_MET = "ACT-0021";
  public static final String TRANSIENT_PROBE_ERROR = "ACT-0022";
  public static final String DEADLINE_EXCEEDED = "ACT-0023";
  public static final String CONSISTENCY_VIOLATED = "ACT-0024";
  public static final String CONSISTENCY_HELD = "ACT-0025";

  public static final String MACHINE_SET_SNAPSHOT = "ACT-0040";
  public static final String MACHINE_SET_SCALED = "ACT-0041";
  public static final String NODE_COUNT_MISMATCH = "ACT-0042";
  public static final String NODE_NOT_READY = "ACT-0043";
  public static final String NODE_UNSCHEDULABLE = "ACT-0044";
  public static final String SCALE_UP_GROUP_SEEN = "ACT-0045";
  public static final String RESOURCE_CREATED = "ACT-0046";
  public static final String RESOURCE_DELETED = "ACT-0047";
  public static final String CLEANUP_SKIPPED = "ACT-0048";
  public static final String EVENT_COUNT_OBSERVED = "ACT-0049";

  private MessageKeys() {
    // no-op
  }
}

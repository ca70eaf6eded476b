// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.extensions;

import java.io.IOException;
import java.time.Duration;

import io.clusterapi.actuator.actions.MachineApiActions;
import io.clusterapi.actuator.client.KubernetesClusterClient;
import io.clusterapi.actuator.common.logging.LoggingFacade;
import org.junit.jupiter.api.extension.AfterTestExecutionCallback;
import org.junit.jupiter.api.extension.BeforeTestExecutionCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.TestWatcher;

import static io.clusterapi.actuator.utils.ThreadSafeLogger.getLogger;

/**
 * JUnit5 extension which logs the start, duration and outcome of every test. When a test fails, the replica
 * counts of all machine sets are logged to help diagnose what the cluster was doing at the time.
 */
public class IntegrationTestWatcher implements BeforeTestExecutionCallback, AfterTestExecutionCallback, TestWatcher {

  private static final String START_TIME = "start time";

  @Override
  public void beforeTestExecution(ExtensionContext context) {
    getLogger().info("Starting test {0}.{1}", context.getRequiredTestClass().getSimpleName(), context.getDisplayName());
    getStore(context).put(START_TIME, System.nanoTime());
  }

  @Override
  public void afterTestExecution(ExtensionContext context) {
    long startTime = getStore(context).remove(START_TIME, long.class);
    getLogger().info("Test {0} took {1} seconds", context.getDisplayName(),
        Duration.ofNanos(System.nanoTime() - startTime).toSeconds());
  }

  @Override
  public void testSuccessful(ExtensionContext context) {
    getLogger().info("Test {0} passed", context.getDisplayName());
  }

  @Override
  public void testFailed(ExtensionContext context, Throwable cause) {
    LoggingFacade logger = getLogger();
    logger.severe("Test {0} failed: {1}", context.getDisplayName(), cause.toString());
    try {
      new MachineApiActions(KubernetesClusterClient.create(logger), logger).logMachineSetsSnapshot();
    } catch (IOException | RuntimeException e) {
      logger.warning("Unable to log machine sets after failure of " + context.getDisplayName(), e);
    }
  }

  private ExtensionContext.Store getStore(ExtensionContext context) {
    return context.getStore(ExtensionContext.Namespace.create(getClass(), context.getRequiredTestMethod()));
  }
}

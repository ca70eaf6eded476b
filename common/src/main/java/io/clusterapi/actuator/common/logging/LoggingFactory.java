// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.common.logging;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/** A factory to create Loggers. */
public class LoggingFactory {

  public static final String ACTUATOR_LOGGER = "Actuator";
  public static final String ACTUATOR_BUNDLE = "Actuator";

  // map from logger name to facade
  private static final Map<String, LoggingFacade> facades = new HashMap<>();

  private LoggingFactory() {
    // hide implicit public constructor
  }

  /**
   * Obtains the logger shared by the framework, bound to the {@code Actuator} message bundle.
   *
   * @return the framework logging facade
   */
  public static LoggingFacade getLogger() {
    return getLogger(ACTUATOR_LOGGER, ACTUATOR_BUNDLE);
  }

  /**
   * Obtains a Logger from the underlying logging implementation and wraps it in a LoggingFacade.
   *
   * @param name the name of the logger to use
   * @param resourceBundleName the resource bundle to use with this logger
   * @return a LoggingFacade object for the caller to use
   */
  public static synchronized LoggingFacade getLogger(String name, String resourceBundleName) {
    return facades.computeIfAbsent(name, n -> new LoggingFacade(Logger.getLogger(n, resourceBundleName)));
  }
}

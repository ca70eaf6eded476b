// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.common.logging;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Centralized logging for the actuator framework. Wraps a {@link java.util.logging.Logger} and resolves the
 * calling class and method so that records carry the real source rather than this facade. Messages may be
 * either keys from the {@link MessageKeys Actuator} resource bundle or literal {@link java.text.MessageFormat}
 * patterns.
 */
public class LoggingFacade {

  private static final String FACADE_CLASS = LoggingFacade.class.getName();

  private final Logger logger;

  /**
   * Construct logging facade.
   *
   * @param logger logger
   */
  public LoggingFacade(Logger logger) {
    this.logger = logger;
  }

  /**
   * Returns the underlying logger. Used by tests to install handlers.
   *
   * @return the wrapped logger
   */
  public Logger getUnderlyingLogger() {
    return logger;
  }

  public boolean isLoggable(Level level) {
    return logger.isLoggable(level);
  }

  public boolean isFineEnabled() {
    return logger.isLoggable(Level.FINE);
  }

  public boolean isFinerEnabled() {
    return logger.isLoggable(Level.FINER);
  }

  /** Logs a method entry at FINER. */
  public void entering() {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.entering(details.clazz, details.method);
    }
  }

  /**
   * Logs a method entry with parameters at FINER.
   *
   * @param params the method parameters
   */
  public void entering(Object... params) {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.entering(details.clazz, details.method, params);
    }
  }

  /** Logs a method exit at FINER. */
  public void exiting() {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.exiting(details.clazz, details.method);
    }
  }

  /**
   * Logs a method exit with its result at FINER.
   *
   * @param result the value being returned
   */
  public void exiting(Object result) {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.exiting(details.clazz, details.method, result);
    }
  }

  /**
   * Logs a message with parameters at the given level.
   *
   * @param level the level
   * @param msg message key or pattern
   * @param params message parameters
   */
  public void log(Level level, String msg, Object... params) {
    if (isLoggable(level)) {
      CallerDetails details = inferCaller();
      logger.logp(level, details.clazz, details.method, msg, params);
    }
  }

  /**
   * Logs a message and a throwable at the given level.
   *
   * @param level the level
   * @param msg message key or pattern
   * @param thrown the throwable to attach
   */
  public void log(Level level, String msg, Throwable thrown) {
    if (isLoggable(level)) {
      CallerDetails details = inferCaller();
      logger.logp(level, details.clazz, details.method, msg, thrown);
    }
  }

  /**
   * Logs a message with both a throwable and parameters at the given level.
   *
   * @param level the level
   * @param thrown the throwable to attach
   * @param msg message key or pattern
   * @param params message parameters
   */
  public void log(Level level, Throwable thrown, String msg, Object... params) {
    if (isLoggable(level)) {
      CallerDetails details = inferCaller();
      LogRecord logRecord = new LogRecord(level, msg);
      logRecord.setLoggerName(logger.getName());
      logRecord.setResourceBundle(logger.getResourceBundle());
      logRecord.setResourceBundleName(logger.getResourceBundleName());
      logRecord.setSourceClassName(details.clazz);
      logRecord.setSourceMethodName(details.method);
      logRecord.setParameters(params);
      logRecord.setThrown(thrown);
      logger.log(logRecord);
    }
  }

  public void warning(Throwable thrown, String msg, Object... params) {
    log(Level.WARNING, thrown, msg, params);
  }

  public void fine(Throwable thrown, String msg, Object... params) {
    log(Level.FINE, thrown, msg, params);
  }

  public void finest(String msg) {
    log(Level.FINEST, msg);
  }

  public void finest(String msg, Object... params) {
    log(Level.FINEST, msg, params);
  }

  public void finest(String msg, Throwable thrown) {
    log(Level.FINEST, msg, thrown);
  }

  public void finer(String msg) {
    log(Level.FINER, msg);
  }

  public void finer(String msg, Object... params) {
    log(Level.FINER, msg, params);
  }

  public void finer(String msg, Throwable thrown) {
    log(Level.FINER, msg, thrown);
  }

  public void fine(String msg) {
    log(Level.FINE, msg);
  }

  public void fine(String msg, Object... params) {
    log(Level.FINE, msg, params);
  }

  public void fine(String msg, Throwable thrown) {
    log(Level.FINE, msg, thrown);
  }

  public void config(String msg, Object... params) {
    log(Level.CONFIG, msg, params);
  }

  public void info(String msg) {
    log(Level.INFO, msg);
  }

  public void info(String msg, Object... params) {
    log(Level.INFO, msg, params);
  }

  public void info(String msg, Throwable thrown) {
    log(Level.INFO, msg, thrown);
  }

  public void warning(String msg) {
    log(Level.WARNING, msg);
  }

  public void warning(String msg, Object... params) {
    log(Level.WARNING, msg, params);
  }

  public void warning(String msg, Throwable thrown) {
    log(Level.WARNING, msg, thrown);
  }

  public void severe(String msg) {
    log(Level.SEVERE, msg);
  }

  public void severe(String msg, Object... params) {
    log(Level.SEVERE, msg, params);
  }

  public void severe(String msg, Throwable thrown) {
    log(Level.SEVERE, msg, thrown);
  }

  /**
   * Logs that a throwable is being thrown, at FINER.
   *
   * @param pending the throwable about to be thrown
   */
  public void throwing(Throwable pending) {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.throwing(details.clazz, details.method, pending);
    }
  }

  private CallerDetails inferCaller() {
    return StackWalker.getInstance()
        .walk(frames -> frames
            .dropWhile(f -> !f.getClassName().equals(FACADE_CLASS))
            .dropWhile(f -> f.getClassName().equals(FACADE_CLASS))
            .findFirst())
        .map(f -> new CallerDetails(f.getClassName(), f.getMethodName()))
        .or(() -> Optional.of(new CallerDetails(logger.getName(), "")))
        .get();
  }

  private static class CallerDetails {
    private final String clazz;
    private final String method;

    CallerDetails(String clazz, String method) {
      this.clazz = clazz;
      this.method = method;
    }
  }
}

// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.common.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import com.meterware.simplestub.Memento;
import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.common.logging.LoggingFactory;

public class TestUtils {

  private TestUtils() {
    // no-op
  }

  /**
   * Removes the console handlers from the framework logger, in order to silence them during a test.
   *
   * @return a memento which restores the handlers on revert
   */
  public static ConsoleHandlerMemento silenceActuatorLogger() {
    return silenceLogger(LoggingFactory.getLogger());
  }

  /**
   * Removes the console handlers from the logger behind the specified facade.
   *
   * @param facade the facade whose logger should be silenced
   * @return a memento which restores the handlers on revert
   */
  public static ConsoleHandlerMemento silenceLogger(LoggingFacade facade) {
    Logger logger = facade.getUnderlyingLogger();
    List<Handler> savedHandlers = new ArrayList<>();
    for (Handler handler : logger.getHandlers()) {
      if (handler instanceof ConsoleHandler) {
        savedHandlers.add(handler);
      }
    }

    for (Handler handler : savedHandlers) {
      logger.removeHandler(handler);
    }

    TestLogHandler testHandler = new TestLogHandler();
    logger.addHandler(testHandler);
    boolean usedParentHandlers = logger.getUseParentHandlers();
    logger.setUseParentHandlers(false);

    return new ConsoleHandlerMemento(logger, testHandler, savedHandlers, usedParentHandlers);
  }

  static class TestLogHandler extends Handler {
    private Throwable throwable;
    private final List<Throwable> ignoredExceptions = new ArrayList<>();
    private final List<Class<? extends Throwable>> ignoredClasses = new ArrayList<>();
    private Collection<LogRecord> logRecords = new ArrayList<>();
    private List<String> messagesToTrack = new ArrayList<>();

    @Override
    public synchronized void publish(LogRecord logRecord) {
      if (logRecord.getThrown() != null && !shouldIgnore(logRecord.getThrown())) {
        throwable = logRecord.getThrown();
      }
      if (messagesToTrack.contains(logRecord.getMessage())) {
        logRecords.add(logRecord);
      }
    }

    @Override
    public void flush() {
      // nothing is buffered
    }

    @Override
    public void close() {
      // nothing to release
    }

    boolean shouldIgnore(Throwable thrown) {
      return ignoredExceptions.contains(thrown)
          || ignoredClasses.stream().anyMatch(c -> c.isInstance(thrown));
    }

    synchronized void throwLoggedThrowable() {
      if (throwable == null) {
        return;
      }

      throwable.printStackTrace();
      if (throwable instanceof Error error) {
        throw error;
      }
      if (throwable instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new RuntimeException(throwable);
    }

    void ignoreLoggedException(Throwable t) {
      ignoredExceptions.add(t);
    }

    void ignoreLoggedException(Class<? extends Throwable> t) {
      ignoredClasses.add(t);
    }

    synchronized void collectLogMessages(Collection<LogRecord> collection, String[] messages) {
      this.logRecords = collection;
      this.messagesToTrack = new ArrayList<>(Arrays.asList(messages));
    }

    synchronized void throwUncheckedLogMessages() {
      if (logRecords.isEmpty()) {
        return;
      }

      SimpleFormatter formatter = new SimpleFormatter();
      List<String> messageKeys = new ArrayList<>();
      for (LogRecord logRecord : logRecords) {
        messageKeys.add(formatter.format(logRecord));
      }

      throw new AssertionError("Unexpected log messages " + messageKeys);
    }
  }

  public static class ConsoleHandlerMemento implements Memento {
    private final Logger logger;
    private final TestLogHandler testHandler;
    private final List<Handler> savedHandlers;
    private final boolean usedParentHandlers;
    private Level savedLogLevel;
    // log level could be null, so need a boolean to indicate if we have saved it
    private boolean loggerLevelSaved;

    ConsoleHandlerMemento(Logger logger, TestLogHandler testHandler, List<Handler> savedHandlers,
                          boolean usedParentHandlers) {
      this.logger = logger;
      this.testHandler = testHandler;
      this.savedHandlers = savedHandlers;
      this.usedParentHandlers = usedParentHandlers;
    }

    public ConsoleHandlerMemento ignoringLoggedExceptions(Throwable... throwables) {
      for (Throwable throwable : throwables) {
        testHandler.ignoreLoggedException(throwable);
      }
      return this;
    }

    @SafeVarargs
    public final ConsoleHandlerMemento ignoringLoggedExceptions(Class<? extends Throwable>... classes) {
      for (Class<? extends Throwable> klass : classes) {
        testHandler.ignoreLoggedException(klass);
      }
      return this;
    }

    /**
     * Collects the records logged with any of the given messages, rather than failing the test on them.
     *
     * @param collection the collection to receive the records
     * @param messages the message keys to track
     * @return this memento
     */
    public ConsoleHandlerMemento collectLogMessages(Collection<LogRecord> collection, String... messages) {
      testHandler.collectLogMessages(collection, messages);
      return this;
    }

    /**
     * Sets the logger level until the memento is reverted.
     *
     * @param logLevel the level to use
     * @return this memento
     */
    public ConsoleHandlerMemento withLogLevel(Level logLevel) {
      if (!loggerLevelSaved) {
        savedLogLevel = logger.getLevel();
        loggerLevelSaved = true;
      }
      logger.setLevel(logLevel);
      return this;
    }

    @Override
    public void revert() {
      logger.removeHandler(testHandler);
      for (Handler handler : savedHandlers) {
        logger.addHandler(handler);
      }
      logger.setUseParentHandlers(usedParentHandlers);
      if (loggerLevelSaved) {
        logger.setLevel(savedLogLevel);
      }

      testHandler.throwLoggedThrowable();
      testHandler.throwUncheckedLogMessages();
    }

    @Override
    public <T> T getOriginalValue() {
      throw new UnsupportedOperationException();
    }
  }
}

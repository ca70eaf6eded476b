// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.waiter;

import java.io.IOException;
import java.io.Serial;
import java.io.UncheckedIOException;
import java.text.MessageFormat;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

import io.clusterapi.actuator.common.logging.LoggingFacade;
import io.clusterapi.actuator.common.logging.MessageKeys;
import io.kubernetes.client.openapi.ApiException;
import org.awaitility.core.ConditionEvaluationListener;
import org.awaitility.core.ConditionFactory;
import org.awaitility.core.ConditionTimeoutException;
import org.awaitility.core.EvaluatedCondition;

import static org.awaitility.Awaitility.with;

/**
 * Polls a {@link Probe} until it reports success or a deadline elapses. The first poll happens immediately and
 * later polls are spaced by the poll interval, however quickly the probe returns.
 *
 * <p>Errors thrown by the probe are classified. Transient errors are logged and polling continues; the last one
 * is attached to the {@link DeadlineExceededException} if the deadline passes. Any other error stops the wait at
 * once: a {@link FatalConfigurationException} or {@link Error} propagates unchanged, and anything else is wrapped
 * in a {@link FatalConfigurationException}.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public class ConvergenceWaiter {

  private final Duration pollInterval;
  private final Duration deadline;
  private final Predicate<Throwable> transientClassifier;
  private final LoggingFacade logger;

  /**
   * Creates a waiter using the default transient error classifier.
   *
   * @param pollInterval the time between polls
   * @param deadline the total time allowed
   * @param logger the diagnostic sink
   */
  public ConvergenceWaiter(Duration pollInterval, Duration deadline, LoggingFacade logger) {
    this(pollInterval, deadline, ConvergenceWaiter::isTransientByDefault, logger);
  }

  /**
   * Creates a waiter.
   *
   * @param pollInterval the time between polls
   * @param deadline the total time allowed
   * @param transientClassifier returns true for probe errors that should be retried
   * @param logger the diagnostic sink
   */
  public ConvergenceWaiter(Duration pollInterval, Duration deadline, Predicate<Throwable> transientClassifier,
                           LoggingFacade logger) {
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
    }
    this.pollInterval = pollInterval;
    this.deadline = deadline;
    this.transientClassifier = transientClassifier;
    this.logger = logger;
  }

  /**
   * The default classification: read failures from the cluster are transient.
   *
   * @param error a probe error
   * @return true if the error should be retried
   */
  public static boolean isTransientByDefault(Throwable error) {
    return error instanceof TransientReadException
        || error instanceof ApiException
        || error instanceof IOException
        || error instanceof UncheckedIOException;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public Duration getDeadline() {
    return deadline;
  }

  public ConvergenceWaiter withDeadline(Duration deadline) {
    return new ConvergenceWaiter(pollInterval, deadline, transientClassifier, logger);
  }

  public ConvergenceWaiter withPollInterval(Duration pollInterval) {
    return new ConvergenceWaiter(pollInterval, deadline, transientClassifier, logger);
  }

  /**
   * Waits until the probe returns true.
   *
   * @param probe the probe
   * @param msg a description of the condition, as a message pattern
   * @param params parameters to the description
   * @throws DeadlineExceededException if the probe did not succeed in time
   * @throws FatalConfigurationException if the probe reported a non-transient error
   */
  public void until(Probe probe, String msg, Object... params) {
    String description = MessageFormat.format(msg, params);
    ProbeRunner runner = new ProbeRunner(probe, description);
    try {
      createConditionFactory(description).until(runner::untilCheck);
    } catch (ConditionTimeoutException timeout) {
      logger.warning(MessageKeys.DEADLINE_EXCEEDED, description, deadline.toMillis());
      throw new DeadlineExceededException(description, deadline, runner.lastError.get());
    } catch (RuntimeException e) {
      throw unwrapAbort(e);
    }
  }

  /**
   * Verifies that the probe returns true on every poll until the deadline. The first false result or error of
   * any kind fails the check immediately.
   *
   * @param probe the probe
   * @param msg a description of the condition, as a message pattern
   * @param params parameters to the description
   * @throws ConsistencyViolationException if the condition was observed not to hold
   */
  public void consistently(Probe probe, String msg, Object... params) {
    String description = MessageFormat.format(msg, params);
    ProbeRunner runner = new ProbeRunner(probe, description);
    long start = System.nanoTime();
    try {
      createConditionFactory(description).until(runner::violationCheck);
    } catch (ConditionTimeoutException timeout) {
      logger.info(MessageKeys.CONSISTENCY_HELD, description, deadline.toMillis());
      return;
    }
    long elapsed = Duration.ofNanos(System.nanoTime() - start).toMillis();
    logger.warning(MessageKeys.CONSISTENCY_VIOLATED, description, elapsed);
    throw new ConsistencyViolationException(description, elapsed, runner.lastError.get());
  }

  private ConditionFactory createConditionFactory(String description) {
    return with()
        .pollDelay(Duration.ZERO)
        .and().with().pollInterval(pollInterval)
        .atMost(deadline)
        .alias(description)
        .dontCatchUncaughtExceptions()
        .conditionEvaluationListener(createConditionEvaluationListener(description));
  }

  private ConditionEvaluationListener<Boolean> createConditionEvaluationListener(String description) {
    return (EvaluatedCondition<Boolean> condition) -> {
      if (condition.isSatisfied()) {
        logger.fine(MessageKeys.CONDITION_MET, description, condition.getElapsedTimeInMS());
      } else {
        logger.info(MessageKeys.WAITING_FOR_CONDITION, description, condition.getElapsedTimeInMS(),
            condition.getRemainingTimeInMS());
      }
    };
  }

  private RuntimeException unwrapAbort(RuntimeException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof ProbeAborted aborted) {
        return aborted.toReported();
      }
    }
    return e;
  }

  private class ProbeRunner {
    private final Probe probe;
    private final String description;
    private final AtomicReference<Throwable> lastError = new AtomicReference<>();

    ProbeRunner(Probe probe, String description) {
      this.probe = probe;
      this.description = description;
    }

    boolean untilCheck() {
      try {
        return probe.check();
      } catch (Throwable t) {
        if (!transientClassifier.test(t)) {
          throw new ProbeAborted(description, t);
        }
        lastError.set(t);
        logger.info(MessageKeys.TRANSIENT_PROBE_ERROR, description, t.toString());
        return false;
      }
    }

    boolean violationCheck() {
      try {
        return !probe.check();
      } catch (Throwable t) {
        lastError.set(t);
        return true;
      }
    }
  }

  // carries a non-transient probe failure out of the polling thread
  private static class ProbeAborted extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String description;

    ProbeAborted(String description, Throwable cause) {
      super(cause);
      this.description = description;
    }

    RuntimeException toReported() {
      Throwable cause = getCause();
      if (cause instanceof Error error) {
        throw error;
      } else if (cause instanceof FatalConfigurationException fatal) {
        return fatal;
      } else {
        return new FatalConfigurationException("Probe for '" + description + "' failed", cause);
      }
    }
  }
}

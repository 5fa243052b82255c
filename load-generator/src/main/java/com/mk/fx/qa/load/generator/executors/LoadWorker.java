package com.mk.fx.qa.load.generator.executors;

import com.mk.fx.qa.load.generator.events.RequestEvent;
import com.mk.fx.qa.load.generator.events.RequestEventChannel;
import com.mk.fx.qa.load.generator.metrics.Counters;
import com.mk.fx.qa.load.generator.metrics.FailureTracker;
import com.mk.fx.qa.load.generator.metrics.RunState;
import com.mk.fx.qa.load.generator.rest.TransportPort;
import com.mk.fx.qa.load.generator.rest.TransportResult;
import java.time.Clock;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * One load worker: issues GET requests back to back until the run stops, recording every attempt
 * exactly once. There is no backoff or retry; a failed attempt is followed straight away by the
 * next one.
 *
 * <p>The running flag is checked once per iteration, so a stop takes effect after at most one
 * in-flight request (bounded by the request timeout).
 */
@Slf4j
public class LoadWorker implements Runnable {

  private final int workerId;
  private final LoadParameters parameters;
  private final TransportPort transport;
  private final Counters counters;
  private final FailureTracker failures;
  private final RequestEventChannel events;
  private final RunState runState;
  private final Clock clock;
  private long attempts;

  /**
   * @param events detail channel, {@code null} when detailed mode is off
   */
  public LoadWorker(
      int workerId,
      LoadParameters parameters,
      TransportPort transport,
      Counters counters,
      FailureTracker failures,
      RequestEventChannel events,
      RunState runState,
      Clock clock) {
    this.workerId = workerId;
    this.parameters = Objects.requireNonNull(parameters, "parameters");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.counters = Objects.requireNonNull(counters, "counters");
    this.failures = Objects.requireNonNull(failures, "failures");
    this.events = events;
    this.runState = Objects.requireNonNull(runState, "runState");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void run() {
    log.debug("Worker {} started against {}{}", workerId, parameters.host(), parameters.path());
    try {
      while (shouldContinue()) {
        attemptOnce();
      }
    } finally {
      closeTransport();
      log.debug("Worker {} stopped after {} attempts", workerId, attempts);
    }
  }

  /** Performs one request-and-record cycle. */
  void attemptOnce() {
    attempts++;
    TransportResult result;
    try {
      result = transport.get(parameters.host(), parameters.path(), parameters.requestTimeout());
    } catch (RuntimeException ex) {
      counters.recordAttempt(false);
      failures.recordReason(ex.getClass().getSimpleName());
      log.debug("Worker {} attempt {} failed unexpectedly: {}", workerId, attempts, ex.getMessage());
      return;
    }

    var successful = result != null && result.isSuccess();
    counters.recordAttempt(successful);
    if (!successful) {
      failures.record(result);
      return;
    }
    if (events != null) {
      events.tryPublish(new RequestEvent(workerId, result.statusCode(), clock.instant()));
    }
  }

  private boolean shouldContinue() {
    if (!runState.isRunning() || Thread.currentThread().isInterrupted()) {
      return false;
    }
    var limit = parameters.maxAttemptsPerWorker();
    return limit <= 0 || attempts < limit;
  }

  private void closeTransport() {
    if (transport instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.debug("Worker {} failed to close its transport: {}", workerId, ex.getMessage());
      }
    }
  }

  public int workerId() {
    return workerId;
  }

  public long attempts() {
    return attempts;
  }
}

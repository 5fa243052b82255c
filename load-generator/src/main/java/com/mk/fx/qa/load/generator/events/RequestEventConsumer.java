package com.mk.fx.qa.load.generator.events;

import com.mk.fx.qa.load.generator.metrics.RunState;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/** Drains a {@link RequestEventChannel} while the run is active and tallies events by status. */
@Slf4j
public class RequestEventConsumer implements Runnable {

  private static final Duration POLL_TIMEOUT = Duration.ofMillis(100);

  private final RequestEventChannel channel;
  private final RunState runState;
  private final Map<Integer, AtomicLong> statusCodes = new ConcurrentHashMap<>();
  private final AtomicLong consumed = new AtomicLong();

  public RequestEventConsumer(RequestEventChannel channel, RunState runState) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.runState = Objects.requireNonNull(runState, "runState");
  }

  @Override
  public void run() {
    log.debug("Request event consumer started (capacity={})", channel.capacity());
    try {
      while (runState.isRunning() && !Thread.currentThread().isInterrupted()) {
        var event = channel.poll(POLL_TIMEOUT);
        if (event != null) {
          accept(event);
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.debug("Request event consumer interrupted");
    }
    log.debug("Request event consumer stopped after {} events", consumed.get());
  }

  void accept(RequestEvent event) {
    consumed.incrementAndGet();
    statusCodes.computeIfAbsent(event.statusCode(), k -> new AtomicLong()).incrementAndGet();
    log.trace(
        "Worker {} got status {} at {}", event.workerId(), event.statusCode(), event.timestamp());
  }

  public long consumed() {
    return consumed.get();
  }

  /** Sorted, read-only copy of the per-status tally. */
  public Map<Integer, Long> statusCodeTally() {
    Map<Integer, Long> map = new TreeMap<>();
    for (var e : statusCodes.entrySet()) {
      map.put(e.getKey(), e.getValue().get());
    }
    return Collections.unmodifiableMap(map);
  }
}

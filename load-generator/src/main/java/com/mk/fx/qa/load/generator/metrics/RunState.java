package com.mk.fx.qa.load.generator.metrics;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Running flag and start time of the current run. The flag is the only cancellation signal seen by
 * workers and the reporter; it needs visibility, not a lock.
 */
public class RunState {

  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile Instant startTime;

  /** Marks the run as started at {@code now}. */
  public void begin(Instant now) {
    this.startTime = Objects.requireNonNull(now, "now");
    running.set(true);
  }

  /**
   * Clears the running flag.
   *
   * @return {@code true} only for the call that actually stopped a running run
   */
  public boolean stop() {
    return running.compareAndSet(true, false);
  }

  public boolean isRunning() {
    return running.get();
  }

  /** Start time of the run, {@code null} before {@link #begin(Instant)}. */
  public Instant startTime() {
    return startTime;
  }
}

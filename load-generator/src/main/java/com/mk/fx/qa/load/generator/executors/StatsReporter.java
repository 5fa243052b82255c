package com.mk.fx.qa.load.generator.executors;

import static com.mk.fx.qa.load.generator.utils.LoadUtils.toSeconds;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.generator.metrics.Counters;
import com.mk.fx.qa.load.generator.metrics.ReportSample;
import com.mk.fx.qa.load.generator.metrics.RunState;
import com.mk.fx.qa.load.generator.report.ConsoleReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Prints a live status line every {@code interval} until the run stops. Remembers only the
 * previous tick's total and time to derive the instantaneous rate. Prints nothing on stop; the
 * final summary belongs to the coordinator.
 */
@Slf4j
public class StatsReporter implements Runnable {

  private static final long SLEEP_CHUNK_MILLIS = 100L;

  private final Counters counters;
  private final RunState runState;
  private final Duration interval;
  private final IntSupplier liveWorkers;
  private final ConsoleReport console;
  private final Clock clock;

  private long lastTotal;
  private Instant lastTime;

  public StatsReporter(
      Counters counters,
      RunState runState,
      Duration interval,
      IntSupplier liveWorkers,
      ConsoleReport console,
      Clock clock) {
    this.counters = Objects.requireNonNull(counters, "counters");
    this.runState = Objects.requireNonNull(runState, "runState");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.liveWorkers = Objects.requireNonNull(liveWorkers, "liveWorkers");
    this.console = Objects.requireNonNull(console, "console");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void run() {
    lastTotal = 0;
    lastTime = runState.startTime() != null ? runState.startTime() : clock.instant();
    try {
      while (runState.isRunning()) {
        if (!sleepWhileRunning(interval)) {
          break;
        }
        console.printStatus(tick(clock.instant()));
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.debug("Stats reporter interrupted");
    }
  }

  /** Computes the sample for {@code now} and advances the remembered previous sample. */
  @VisibleForTesting
  ReportSample tick(Instant now) {
    if (lastTime == null) {
      lastTime = runState.startTime() != null ? runState.startTime() : now;
    }
    var snapshot = counters.snapshot();

    var elapsed = seconds(lastTime, now);
    var delta = snapshot.total() - lastTotal;
    var instantRate = elapsed > 0 ? delta / elapsed : 0.0;

    var start = runState.startTime() != null ? runState.startTime() : lastTime;
    var totalElapsed = seconds(start, now);
    var averageRate = totalElapsed > 0 ? snapshot.total() / totalElapsed : 0.0;

    lastTotal = snapshot.total();
    lastTime = now;

    return new ReportSample(
        snapshot.total(),
        instantRate,
        averageRate,
        snapshot.successPercent(),
        liveWorkers.getAsInt());
  }

  /**
   * Sleeps for the duration in chunks, returning early when the run stops.
   *
   * @return {@code false} if the run stopped before the duration elapsed
   */
  private boolean sleepWhileRunning(Duration duration) throws InterruptedException {
    long remaining = duration.toMillis();
    while (remaining > 0) {
      if (!runState.isRunning()) {
        return false;
      }
      var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
      TimeUnit.MILLISECONDS.sleep(chunk);
      remaining -= chunk;
    }
    return runState.isRunning();
  }

  private static double seconds(Instant from, Instant to) {
    return toSeconds(Duration.between(from, to));
  }
}

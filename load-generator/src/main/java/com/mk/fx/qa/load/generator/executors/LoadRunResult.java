package com.mk.fx.qa.load.generator.executors;

import com.mk.fx.qa.load.generator.metrics.CountersSnapshot;
import com.mk.fx.qa.load.generator.utils.LoadUtils;
import java.time.Duration;
import java.util.Map;

/**
 * Final outcome of a run, computed after the workers were drained.
 *
 * @param counters terminal counters
 * @param elapsed time from start to the final snapshot
 * @param averageRate attempts per second over the whole run, {@code 0} when nothing ran
 * @param workers configured worker count
 * @param abandonedWorkers workers that did not stop within the join timeout
 * @param droppedEvents detail events dropped because the channel was full
 * @param failureReasons failed attempts by reason
 * @param statusCodes consumed detail events by status code, empty unless detailed mode consumed them
 */
public record LoadRunResult(
    CountersSnapshot counters,
    Duration elapsed,
    double averageRate,
    int workers,
    int abandonedWorkers,
    long droppedEvents,
    Map<String, Long> failureReasons,
    Map<Integer, Long> statusCodes) {

  public double elapsedSeconds() {
    return LoadUtils.toSeconds(elapsed);
  }
}

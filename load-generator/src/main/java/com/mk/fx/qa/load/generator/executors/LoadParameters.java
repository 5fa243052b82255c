package com.mk.fx.qa.load.generator.executors;

import java.time.Duration;

/**
 * Parameters for one load generation run.
 *
 * @param host target host, optionally with port or scheme
 * @param path request path
 * @param workers number of concurrent workers
 * @param requestTimeout timeout of a single GET request
 * @param reportInterval interval between live status lines
 * @param detailed whether workers emit per-request events
 * @param eventQueueCapacity capacity of the event channel in detailed mode
 * @param workerJoinTimeout how long the coordinator waits for each worker when draining
 * @param stopPollInterval how often the coordinator checks for a stop
 * @param consumeEvents whether a consumer tallies events in detailed mode
 * @param maxAttemptsPerWorker attempts after which a worker exits on its own, {@code 0} for no limit
 */
public record LoadParameters(
    String host,
    String path,
    int workers,
    Duration requestTimeout,
    Duration reportInterval,
    boolean detailed,
    int eventQueueCapacity,
    Duration workerJoinTimeout,
    Duration stopPollInterval,
    boolean consumeEvents,
    long maxAttemptsPerWorker) {

  /**
   * Longest time a shutdown should take: every worker and the two helper threads joined with
   * {@link #workerJoinTimeout()}, plus one stop poll and a second of slack for the summary.
   */
  public Duration drainBudget() {
    return workerJoinTimeout
        .multipliedBy(workers + 2L)
        .plus(stopPollInterval)
        .plusSeconds(1);
  }
}

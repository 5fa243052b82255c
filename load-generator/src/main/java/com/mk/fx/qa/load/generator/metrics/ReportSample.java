package com.mk.fx.qa.load.generator.metrics;

/**
 * Live statistics computed on one reporter tick. Not retained beyond the tick.
 *
 * @param total completed attempts so far
 * @param instantRate attempts per second since the previous tick
 * @param averageRate attempts per second since the run started
 * @param successPercent success share of all attempts so far
 * @param liveWorkers workers that have not exited yet
 */
public record ReportSample(
    long total, double instantRate, double averageRate, double successPercent, int liveWorkers) {}

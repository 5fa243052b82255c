package com.mk.fx.qa.load.generator.metrics;

/**
 * Immutable view of {@link Counters} at one instant.
 *
 * @param total completed attempts
 * @param success attempts answered with a status in {@code [200, 400)}
 * @param fail every other attempt, including transport failures
 */
public record CountersSnapshot(long total, long success, long fail) {

  public static final CountersSnapshot EMPTY = new CountersSnapshot(0, 0, 0);

  /** Success share in percent, {@code 0} when nothing was recorded. */
  public double successPercent() {
    return total == 0 ? 0.0 : success * 100.0 / total;
  }

  /** Failure share in percent, {@code 0} when nothing was recorded. */
  public double failPercent() {
    return total == 0 ? 0.0 : fail * 100.0 / total;
  }
}

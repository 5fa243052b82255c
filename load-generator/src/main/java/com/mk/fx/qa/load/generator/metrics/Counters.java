package com.mk.fx.qa.load.generator.metrics;

/**
 * Aggregate request counters shared by every worker and the reporter for one run.
 *
 * <p>Thread-safety: all three counters are mutated and read under a single lock, so a {@link
 * #snapshot()} always satisfies {@code total == success + fail} and attempts are totally ordered.
 */
public class Counters {

  private final Object lock = new Object();
  private long total;
  private long success;
  private long fail;

  /**
   * Records one completed attempt.
   *
   * @param successful whether the attempt is counted as a success
   */
  public void recordAttempt(boolean successful) {
    synchronized (lock) {
      total++;
      if (successful) {
        success++;
      } else {
        fail++;
      }
    }
  }

  /** Returns a consistent point-in-time copy of the counters. */
  public CountersSnapshot snapshot() {
    synchronized (lock) {
      return new CountersSnapshot(total, success, fail);
    }
  }

  /** Zeroes the counters. Only called before a run starts. */
  public void reset() {
    synchronized (lock) {
      total = 0;
      success = 0;
      fail = 0;
    }
  }
}

package com.mk.fx.qa.load.generator.executors;

import java.time.Duration;

/** Short-interval parameters for executor tests. */
final class TestParameters {

  private TestParameters() {}

  static LoadParameters bounded(int workers, long maxAttempts) {
    return parameters(workers, maxAttempts, false, 1, false);
  }

  static LoadParameters parameters(
      int workers, long maxAttempts, boolean detailed, int capacity, boolean consumeEvents) {
    return new LoadParameters(
        "localhost:9",
        "/",
        workers,
        Duration.ofMillis(200),
        Duration.ofMillis(50),
        detailed,
        capacity,
        Duration.ofSeconds(1),
        Duration.ofMillis(10),
        consumeEvents,
        maxAttempts);
  }

  static LoadParameters withJoinTimeout(int workers, Duration joinTimeout) {
    return new LoadParameters(
        "localhost:9",
        "/",
        workers,
        Duration.ofMillis(200),
        Duration.ofMillis(50),
        false,
        1,
        joinTimeout,
        Duration.ofMillis(10),
        false,
        0);
  }
}

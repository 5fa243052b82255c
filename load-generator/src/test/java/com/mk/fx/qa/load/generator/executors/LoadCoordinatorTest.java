package com.mk.fx.qa.load.generator.executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

import com.mk.fx.qa.load.generator.report.ConsoleReport;
import com.mk.fx.qa.load.generator.rest.FailureType;
import com.mk.fx.qa.load.generator.rest.TransportFailure;
import com.mk.fx.qa.load.generator.rest.TransportPort;
import com.mk.fx.qa.load.generator.rest.TransportResult;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.IntFunction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadCoordinatorTest {

  private static final TransportPort OK = (host, path, timeout) -> TransportResult.response(200);

  private ByteArrayOutputStream output;
  private ExecutorService background;

  @BeforeEach
  void setUp() {
    output = new ByteArrayOutputStream();
    background = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    background.shutdownNow();
  }

  private LoadCoordinator coordinator(
      LoadParameters parameters, IntFunction<? extends TransportPort> transports) {
    return coordinator(parameters, transports, InterruptHandler.NONE);
  }

  private LoadCoordinator coordinator(
      LoadParameters parameters,
      IntFunction<? extends TransportPort> transports,
      InterruptHandler handler) {
    return new LoadCoordinator(
        parameters,
        transports,
        new ConsoleReport(new PrintStream(output, true, StandardCharsets.UTF_8)),
        handler,
        Clock.systemUTC());
  }

  private String printed() {
    return output.toString(StandardCharsets.UTF_8);
  }

  private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("Condition not reached in time");
      }
      Thread.sleep(5);
    }
  }

  private Future<LoadRunResult> runInBackground(LoadCoordinator coordinator) {
    Callable<LoadRunResult> run = coordinator::run;
    return background.submit(run);
  }

  @Test
  void boundedRun_countsEveryAttemptOfEveryWorkerExactlyOnce() throws Exception {
    int workers = 8;
    int attempts = 500;
    var refused =
        TransportResult.failed(new TransportFailure(FailureType.CONNECTION_REFUSED, "refused"));
    var coordinator =
        coordinator(
            TestParameters.bounded(workers, attempts),
            id -> id % 2 == 0 ? OK : (host, path, timeout) -> refused);

    var result = coordinator.run();

    var counters = result.counters();
    assertEquals((long) workers * attempts, counters.total());
    assertEquals(2_000, counters.success());
    assertEquals(2_000, counters.fail());
    assertEquals(counters.total(), counters.success() + counters.fail());
    assertEquals(2_000L, result.failureReasons().get("CONNECTION_REFUSED"));
    assertEquals(0, result.abandonedWorkers());
    assertEquals(counters, coordinator.getCounters().snapshot());
    assertEquals(0, coordinator.liveWorkers());
  }

  @Test
  void allSuccessfulRun_reportsOneHundredPercent() throws Exception {
    var coordinator = coordinator(TestParameters.bounded(10, 100), id -> OK);

    var result = coordinator.run();

    assertEquals(1_000, result.counters().total());
    assertEquals(100.0, result.counters().successPercent());
    assertTrue(result.averageRate() > 0);
    var out = printed();
    assertTrue(out.startsWith("Starting load test against http://localhost:9/\n"), out);
    assertTrue(out.contains("Using 10 concurrent workers\n"), out);
    assertTrue(out.contains("Press Ctrl+C to stop the test\n"), out);
    assertTrue(out.contains("--- Final Results ---\n"), out);
    assertTrue(out.contains("Total requests:    1000\n"), out);
    assertTrue(out.contains("Successful:        1000 (100.0%)\n"), out);
    assertTrue(out.contains("Failed:            0 (0.0%)\n"), out);
  }

  @Test
  void stopBeforeAnyAttempt_reportsZeroCountsWithoutDividingByZero() throws Exception {
    var coordinator = coordinator(TestParameters.bounded(4, 0), id -> OK);
    assertFalse(coordinator.stop());

    var result = coordinator.run();

    assertEquals(0, result.counters().total());
    assertEquals(0.0, result.counters().successPercent());
    assertEquals(0.0, result.averageRate());
    assertFalse(Double.isNaN(result.averageRate()));
    var out = printed();
    assertTrue(out.contains("Shutting down, please wait for workers to complete...\n"), out);
    assertTrue(out.contains("Total requests:    0\n"), out);
    assertTrue(out.contains("Successful:        0 (0.0%)\n"), out);
    assertTrue(out.contains("Average rate:      0.00 requests/second\n"), out);
    assertEquals(CoordinatorState.REPORTED, coordinator.state());
  }

  @Test
  void stop_isIdempotentAndPrintsTheNoticeOnce() throws Exception {
    var coordinator = coordinator(TestParameters.bounded(4, 0), id -> OK);
    var run = runInBackground(coordinator);
    awaitCondition(() -> coordinator.getCounters().snapshot().total() > 100);

    List<Future<Boolean>> stops = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      stops.add(background.submit(coordinator::stop));
    }
    int initiated = 0;
    for (Future<Boolean> stop : stops) {
      if (stop.get(5, TimeUnit.SECONDS)) {
        initiated++;
      }
    }
    var result = run.get(10, TimeUnit.SECONDS);

    assertEquals(1, initiated);
    assertFalse(coordinator.stop());
    assertEquals(result.counters().total(), result.counters().success());
    var out = printed();
    assertEquals(out.indexOf("Shutting down"), out.lastIndexOf("Shutting down"));
    assertEquals(CoordinatorState.REPORTED, coordinator.state());
  }

  @Test
  void stateMovesFromIdleThroughRunningToReported() throws Exception {
    var release = new CountDownLatch(1);
    var coordinator =
        coordinator(
            TestParameters.bounded(1, 0),
            id ->
                (host, path, timeout) -> {
                  try {
                    release.await(100, TimeUnit.MILLISECONDS);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                  return TransportResult.response(200);
                });
    assertEquals(CoordinatorState.IDLE, coordinator.state());

    var run = runInBackground(coordinator);
    awaitCondition(() -> coordinator.getRunState().isRunning());
    assertEquals(CoordinatorState.RUNNING, coordinator.state());
    assertFalse(coordinator.awaitReported(Duration.ofMillis(20)));

    assertTrue(coordinator.stop());
    assertNotEquals(CoordinatorState.RUNNING, coordinator.state());
    release.countDown();
    run.get(10, TimeUnit.SECONDS);

    assertEquals(CoordinatorState.REPORTED, coordinator.state());
    assertTrue(coordinator.awaitReported(Duration.ZERO));
  }

  @Test
  void secondRun_isRejected() throws Exception {
    var coordinator = coordinator(TestParameters.bounded(1, 1), id -> OK);
    coordinator.run();

    assertThrows(IllegalStateException.class, coordinator::run);
  }

  @Test
  void detailedModeWithSingleSlotQueue_dropsEventsInsteadOfBlocking() {
    var coordinator =
        coordinator(TestParameters.parameters(2, 1_000, true, 1, false), id -> OK);

    var result = assertTimeoutPreemptively(Duration.ofSeconds(10), coordinator::run);

    assertEquals(2_000, result.counters().total());
    assertEquals(1, coordinator.eventChannel().published());
    assertEquals(1_999, result.droppedEvents());
    assertEquals(0, coordinator.eventChannel().size());
    assertTrue(printed().contains("Dropped events:    1999\n"));
  }

  @Test
  void detailedModeWithConsumer_talliesConsumedStatusCodes() throws Exception {
    var coordinator =
        coordinator(TestParameters.parameters(2, 50, true, 1_000, true), id -> OK);

    var result = coordinator.run();

    assertEquals(100, coordinator.eventChannel().published());
    assertEquals(0, result.droppedEvents());
    long consumed = result.statusCodes().values().stream().mapToLong(Long::longValue).sum();
    assertTrue(consumed <= 100);
    assertTrue(result.statusCodes().keySet().stream().allMatch(code -> code == 200));
  }

  @Test
  void workerStuckInARequest_isAbandonedAfterTheJoinTimeout() throws Exception {
    var entered = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    TransportPort stuck =
        (host, path, timeout) -> {
          entered.countDown();
          try {
            release.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return TransportResult.response(200);
        };
    var coordinator =
        coordinator(
            TestParameters.withJoinTimeout(2, Duration.ofMillis(100)),
            id -> id == 0 ? stuck : OK);

    try {
      var run = runInBackground(coordinator);
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      coordinator.stop();
      var result = run.get(10, TimeUnit.SECONDS);

      assertEquals(1, result.abandonedWorkers());
      assertEquals(result.counters().total(), result.counters().success());
      assertTrue(printed().contains("Abandoned workers: 1 of 2\n"));
    } finally {
      release.countDown();
    }
  }

  @Test
  void interruptHandler_isInstalledForTheRunAndRemovedAfterwards() throws Exception {
    var handler = mock(InterruptHandler.class);
    var coordinator = coordinator(TestParameters.bounded(2, 5), id -> OK, handler);

    coordinator.run();

    var order = inOrder(handler);
    order.verify(handler).install(coordinator);
    order.verify(handler).uninstall();
  }

  @Test
  void constructor_rejectsInvalidParameters() {
    assertThrows(NullPointerException.class, () -> coordinator(null, id -> OK));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            coordinator(
                new LoadParameters(
                    "",
                    "/",
                    1,
                    Duration.ofSeconds(1),
                    Duration.ofSeconds(1),
                    false,
                    1,
                    Duration.ofSeconds(1),
                    Duration.ofMillis(100),
                    false,
                    0),
                id -> OK));
    assertThrows(
        IllegalArgumentException.class,
        () -> coordinator(TestParameters.bounded(0, 1), id -> OK));
    assertThrows(
        IllegalArgumentException.class,
        () -> coordinator(TestParameters.parameters(1, 1, true, 0, false), id -> OK));
  }

  @Test
  void drainBudget_coversEveryJoinPlusSlack() {
    var parameters = TestParameters.withJoinTimeout(3, Duration.ofSeconds(1));

    assertEquals(Duration.ofMillis(6_010), parameters.drainBudget());
  }
}

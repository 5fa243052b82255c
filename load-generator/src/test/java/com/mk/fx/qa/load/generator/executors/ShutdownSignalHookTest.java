package com.mk.fx.qa.load.generator.executors;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.generator.report.ConsoleReport;
import com.mk.fx.qa.load.generator.rest.TransportResult;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShutdownSignalHookTest {

  private final AtomicInteger haltStatus = new AtomicInteger(-1);
  private ShutdownSignalHook hook;
  private ExecutorService background;

  @BeforeEach
  void setUp() {
    hook = new ShutdownSignalHook(Duration.ofSeconds(10), haltStatus::set);
    background = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    hook.uninstall();
    background.shutdownNow();
  }

  private static LoadCoordinator coordinator(long maxAttempts) {
    return new LoadCoordinator(
        TestParameters.bounded(2, maxAttempts),
        id -> (host, path, timeout) -> TransportResult.response(200),
        new ConsoleReport(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)),
        InterruptHandler.NONE,
        Clock.systemUTC());
  }

  @Test
  void signalDuringRun_stopsWaitsForTheSummaryAndExitsWithZero() throws Exception {
    var coordinator = coordinator(0);
    Callable<LoadRunResult> run = coordinator::run;
    var future = background.submit(run);
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (coordinator.getCounters().snapshot().total() == 0 && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }

    hook.onSignal(coordinator);

    assertEquals(CoordinatorState.REPORTED, coordinator.state());
    assertEquals(0, haltStatus.get());
    assertTrue(future.get(5, TimeUnit.SECONDS).counters().total() > 0);
  }

  @Test
  void signalAfterTheRunWasReported_doesNotHalt() throws Exception {
    var coordinator = coordinator(3);
    coordinator.run();

    hook.onSignal(coordinator);

    assertEquals(-1, haltStatus.get());
  }

  @Test
  void signalWithoutARun_givesUpAfterTheDrainBudget() {
    var shortHook = new ShutdownSignalHook(Duration.ofMillis(50), haltStatus::set);

    shortHook.onSignal(coordinator(1));

    assertEquals(-1, haltStatus.get());
  }

  @Test
  void installAndUninstall_registerTheHookOnce() {
    var coordinator = coordinator(1);

    hook.install(coordinator);
    hook.install(coordinator);
    assertTrue(hook.isInstalled());

    hook.uninstall();
    assertFalse(hook.isInstalled());
    hook.uninstall();
  }
}

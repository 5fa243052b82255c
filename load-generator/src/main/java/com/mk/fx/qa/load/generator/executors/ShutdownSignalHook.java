package com.mk.fx.qa.load.generator.executors;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Objects;
import java.util.function.IntConsumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps SIGINT/SIGTERM to {@link LoadCoordinator#stop()} through a JVM shutdown hook.
 *
 * <p>The hook only flips the running flag (via {@code stop()}) and then waits, bounded by the drain
 * budget, for the coordinator's own thread to print the summary; the JVM would otherwise exit
 * underneath it. When the hook is the one that stopped the run, the process exits with status 0.
 */
@Slf4j
public class ShutdownSignalHook implements InterruptHandler {

  private final Duration drainBudget;
  private final IntConsumer halt;
  private volatile Thread hook;

  public ShutdownSignalHook(Duration drainBudget) {
    this(drainBudget, status -> Runtime.getRuntime().halt(status));
  }

  @VisibleForTesting
  ShutdownSignalHook(Duration drainBudget, IntConsumer halt) {
    this.drainBudget = Objects.requireNonNull(drainBudget, "drainBudget");
    this.halt = Objects.requireNonNull(halt, "halt");
  }

  @Override
  public synchronized void install(LoadCoordinator coordinator) {
    Objects.requireNonNull(coordinator, "coordinator");
    if (hook != null) {
      return;
    }
    var thread = new Thread(() -> onSignal(coordinator), "load-generator-shutdown");
    Runtime.getRuntime().addShutdownHook(thread);
    hook = thread;
    log.debug("Shutdown hook installed (drain budget {})", drainBudget);
  }

  @Override
  public synchronized void uninstall() {
    var thread = hook;
    hook = null;
    if (thread == null || thread == Thread.currentThread()) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(thread);
      log.debug("Shutdown hook removed");
    } catch (IllegalStateException shuttingDown) {
      log.debug("JVM is already shutting down, leaving the shutdown hook in place");
    }
  }

  @VisibleForTesting
  void onSignal(LoadCoordinator coordinator) {
    var initiated = coordinator.stop();
    try {
      if (!coordinator.awaitReported(drainBudget)) {
        log.warn("Load run was not reported within {}; exiting without a summary", drainBudget);
        return;
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the final summary");
      return;
    }
    if (initiated) {
      System.out.flush();
      halt.accept(0);
    }
  }

  @VisibleForTesting
  boolean isInstalled() {
    return hook != null;
  }
}

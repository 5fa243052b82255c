package com.mk.fx.qa.load.generator.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.mk.fx.qa.load.generator.events.RequestEventChannel;
import com.mk.fx.qa.load.generator.events.RequestEventConsumer;
import com.mk.fx.qa.load.generator.metrics.Counters;
import com.mk.fx.qa.load.generator.metrics.CountersSnapshot;
import com.mk.fx.qa.load.generator.metrics.FailureTracker;
import com.mk.fx.qa.load.generator.metrics.RunState;
import com.mk.fx.qa.load.generator.report.ConsoleReport;
import com.mk.fx.qa.load.generator.rest.TransportPort;
import com.mk.fx.qa.load.generator.utils.LoadUtils;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the lifecycle of one load run: {@code IDLE -> RUNNING -> DRAINING -> REPORTED}.
 *
 * <p>{@link #run()} resets the counters, installs the interrupt handler, starts the reporter, the
 * optional event consumer and the workers, then blocks polling for a stop. A stop comes from
 * {@link #stop()} (operator interrupt or caller) or from every worker having used up its attempt
 * budget. Draining joins each worker with a bounded wait; a worker that does not exit in time is
 * abandoned, not killed, and whatever it recorded so far is still in the summary.
 *
 * <p>Threading: workers, the reporter and the consumer run on a fixed pool of daemon threads.
 * Cancellation is cooperative only, through {@link RunState}; in-flight requests are never
 * interrupted.
 */
@Slf4j
public class LoadCoordinator {

  private final LoadParameters parameters;
  private final IntFunction<? extends TransportPort> transports;
  private final ConsoleReport console;
  private final InterruptHandler interruptHandler;
  private final Clock clock;

  @Getter private final Counters counters = new Counters();
  @Getter private final RunState runState = new RunState();
  private final FailureTracker failures = new FailureTracker();

  private final AtomicReference<CoordinatorState> state =
      new AtomicReference<>(CoordinatorState.IDLE);
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final CountDownLatch reported = new CountDownLatch(1);
  private volatile CountDownLatch workersRunning = new CountDownLatch(0);
  private volatile RequestEventChannel eventChannel;

  /**
   * @param parameters run parameters
   * @param transports creates the transport owned by the worker with the given index
   * @param console console output
   * @param interruptHandler handler installed for the duration of the run
   * @param clock time source for rates and event timestamps
   */
  public LoadCoordinator(
      LoadParameters parameters,
      IntFunction<? extends TransportPort> transports,
      ConsoleReport console,
      InterruptHandler interruptHandler,
      Clock clock) {
    validate(parameters, transports, console, interruptHandler, clock);
    this.parameters = parameters;
    this.transports = transports;
    this.console = console;
    this.interruptHandler = interruptHandler;
    this.clock = clock;
  }

  /** Validates mandatory inputs for a run. */
  private static void validate(
      LoadParameters parameters,
      IntFunction<? extends TransportPort> transports,
      ConsoleReport console,
      InterruptHandler interruptHandler,
      Clock clock) {
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(transports, "transports");
    Objects.requireNonNull(console, "console");
    Objects.requireNonNull(interruptHandler, "interruptHandler");
    Objects.requireNonNull(clock, "clock");
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(parameters.host()), "Target host must be provided");
    Preconditions.checkArgument(parameters.workers() > 0, "Worker count must be positive");
    requirePositive(parameters.requestTimeout(), "requestTimeout");
    requirePositive(parameters.reportInterval(), "reportInterval");
    requirePositive(parameters.workerJoinTimeout(), "workerJoinTimeout");
    requirePositive(parameters.stopPollInterval(), "stopPollInterval");
    Preconditions.checkArgument(
        !parameters.detailed() || parameters.eventQueueCapacity() > 0,
        "Event queue capacity must be positive in detailed mode");
  }

  private static void requirePositive(Duration duration, String name) {
    Objects.requireNonNull(duration, name);
    Preconditions.checkArgument(
        !duration.isZero() && !duration.isNegative(), "%s must be positive: %s", name, duration);
  }

  /**
   * Runs the load test until it is stopped, then drains and prints the summary.
   *
   * @return the final statistics
   * @throws IllegalStateException if this coordinator has already been started
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public LoadRunResult run() throws InterruptedException {
    if (!state.compareAndSet(CoordinatorState.IDLE, CoordinatorState.RUNNING)) {
      throw new IllegalStateException("Load run already started (state=" + state.get() + ")");
    }

    counters.reset();
    failures.reset();
    var channel =
        parameters.detailed() ? new RequestEventChannel(parameters.eventQueueCapacity()) : null;
    eventChannel = channel;
    var workersLatch = new CountDownLatch(parameters.workers());
    workersRunning = workersLatch;

    console.printBanner(parameters);
    runState.begin(clock.instant());
    interruptHandler.install(this);
    if (stopRequested.get() && runState.stop()) {
      state.compareAndSet(CoordinatorState.RUNNING, CoordinatorState.DRAINING);
      console.printShutdownNotice();
    }
    log.info(
        "Load run started: target={}{}, workers={}, timeout={}, reportInterval={}, detailed={}",
        parameters.host(),
        parameters.path(),
        parameters.workers(),
        parameters.requestTimeout(),
        parameters.reportInterval(),
        parameters.detailed());

    var executor = newFixedThreadPool(parameters.workers() + 2, daemonThreadFactory());
    try {
      var reporter =
          executor.submit(
              new StatsReporter(
                  counters,
                  runState,
                  parameters.reportInterval(),
                  () -> (int) workersLatch.getCount(),
                  console,
                  clock));

      RequestEventConsumer consumer = null;
      Future<?> consumerFuture = null;
      if (channel != null && parameters.consumeEvents()) {
        consumer = new RequestEventConsumer(channel, runState);
        consumerFuture = executor.submit(consumer);
      }

      var workers = startWorkers(executor, channel, workersLatch);

      awaitStop(workersLatch);

      var abandoned = drainWorkers(workers);
      join(reporter, "reporter");
      join(consumerFuture, "event consumer");

      var result =
          buildResult(
              counters.snapshot(),
              abandoned,
              channel != null ? channel.dropped() : 0,
              consumer != null ? consumer.statusCodeTally() : Map.of());
      console.printSummary(result);
      log.info(
          "Load run finished: total={}, success={}, fail={}, elapsed={}s, avgRate={}/s, abandoned={}",
          result.counters().total(),
          result.counters().success(),
          result.counters().fail(),
          String.format("%.2f", result.elapsedSeconds()),
          String.format("%.2f", result.averageRate()),
          abandoned);
      return result;
    } finally {
      runState.stop();
      executor.shutdown();
      if (channel != null) {
        var discarded = channel.discard();
        log.debug("Discarded {} unread request events", discarded);
      }
      state.set(CoordinatorState.REPORTED);
      reported.countDown();
      interruptHandler.uninstall();
    }
  }

  /**
   * Requests the run to stop. Idempotent: only the first call while running moves the coordinator
   * to {@code DRAINING} and prints the shutdown notice. A call before {@link #run()} makes the run
   * stop as soon as it has started.
   *
   * @return {@code true} if this call stopped the run
   */
  public boolean stop() {
    stopRequested.set(true);
    if (runState.stop()) {
      state.compareAndSet(CoordinatorState.RUNNING, CoordinatorState.DRAINING);
      console.printShutdownNotice();
      return true;
    }
    return false;
  }

  /**
   * Waits until the run has printed its summary.
   *
   * @return {@code false} if the timeout elapsed first
   */
  public boolean awaitReported(Duration timeout) throws InterruptedException {
    return reported.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public CoordinatorState state() {
    return state.get();
  }

  /** Workers that have not exited yet. */
  public int liveWorkers() {
    return (int) workersRunning.getCount();
  }

  /** Event channel of the current run, {@code null} unless detailed mode is on. */
  public RequestEventChannel eventChannel() {
    return eventChannel;
  }

  private List<Future<?>> startWorkers(
      ExecutorService executor, RequestEventChannel channel, CountDownLatch workersLatch) {
    List<Future<?>> futures = new ArrayList<>(parameters.workers());
    for (int workerId = 0; workerId < parameters.workers(); workerId++) {
      LoadWorker worker;
      try {
        worker =
            new LoadWorker(
                workerId,
                parameters,
                transports.apply(workerId),
                counters,
                failures,
                channel,
                runState,
                clock);
      } catch (RuntimeException ex) {
        // release the latch slots of the workers that will never start
        for (int i = workerId; i < parameters.workers(); i++) {
          workersLatch.countDown();
        }
        throw ex;
      }
      futures.add(
          executor.submit(
              () -> {
                try {
                  worker.run();
                } finally {
                  workersLatch.countDown();
                }
              }));
    }
    log.debug("Started {} workers", futures.size());
    return futures;
  }

  /** Blocks until a stop is requested or every worker has exited on its own. */
  private void awaitStop(CountDownLatch workersLatch) throws InterruptedException {
    var pollMillis = Math.max(1L, parameters.stopPollInterval().toMillis());
    while (runState.isRunning()) {
      if (workersLatch.await(pollMillis, TimeUnit.MILLISECONDS)) {
        if (runState.stop()) {
          log.info("All {} workers finished their attempts, draining", parameters.workers());
        }
        break;
      }
    }
    state.compareAndSet(CoordinatorState.RUNNING, CoordinatorState.DRAINING);
  }

  /**
   * Joins every worker with {@code workerJoinTimeout} each.
   *
   * @return number of workers abandoned because they did not stop in time
   */
  private int drainWorkers(List<Future<?>> workers) throws InterruptedException {
    var abandoned = new AtomicInteger();
    var timeoutMillis = parameters.workerJoinTimeout().toMillis();
    for (int workerId = 0; workerId < workers.size(); workerId++) {
      try {
        workers.get(workerId).get(timeoutMillis, TimeUnit.MILLISECONDS);
      } catch (TimeoutException timeout) {
        abandoned.incrementAndGet();
        log.warn(
            "Worker {} did not stop within {}; abandoning it",
            workerId,
            parameters.workerJoinTimeout());
      } catch (ExecutionException ex) {
        log.error(
            "Worker {} terminated with error: {}", workerId, ex.getCause().getMessage(), ex.getCause());
      }
    }
    if (abandoned.get() > 0) {
      log.warn("{} of {} workers abandoned during shutdown", abandoned.get(), workers.size());
    }
    return abandoned.get();
  }

  private void join(Future<?> future, String name) throws InterruptedException {
    if (future == null) {
      return;
    }
    try {
      future.get(parameters.workerJoinTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException timeout) {
      log.warn("The {} did not stop within {}", name, parameters.workerJoinTimeout());
    } catch (ExecutionException ex) {
      log.error("The {} terminated with error: {}", name, ex.getCause().getMessage(), ex.getCause());
    }
  }

  private LoadRunResult buildResult(
      CountersSnapshot snapshot,
      int abandoned,
      long droppedEvents,
      Map<Integer, Long> statusCodes) {
    var start = runState.startTime();
    var end = clock.instant();
    var elapsed = start != null && end.isAfter(start) ? Duration.between(start, end) : Duration.ZERO;
    var seconds = LoadUtils.toSeconds(elapsed);
    var averageRate = snapshot.total() > 0 && seconds > 0 ? snapshot.total() / seconds : 0.0;
    return new LoadRunResult(
        snapshot,
        elapsed,
        averageRate,
        parameters.workers(),
        abandoned,
        droppedEvents,
        failures.breakdownSnapshot(),
        statusCodes);
  }

  private ThreadFactory daemonThreadFactory() {
    var counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("load-generator-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}

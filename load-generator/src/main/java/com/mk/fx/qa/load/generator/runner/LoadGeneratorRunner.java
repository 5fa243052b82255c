package com.mk.fx.qa.load.generator.runner;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.generator.cfg.LoadGeneratorArguments;
import com.mk.fx.qa.load.generator.cfg.LoadGeneratorCfg;
import com.mk.fx.qa.load.generator.executors.LoadCoordinator;
import com.mk.fx.qa.load.generator.executors.LoadRunResult;
import com.mk.fx.qa.load.generator.executors.ShutdownSignalHook;
import com.mk.fx.qa.load.generator.report.ConsoleReport;
import com.mk.fx.qa.load.generator.rest.LoadHttpClient;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one load test with the parameters from the command line. Blocks until the run is stopped by
 * an interrupt (Ctrl+C) or every worker has used up {@code --max-attempts}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoadGeneratorRunner implements ApplicationRunner {

  private final LoadGeneratorCfg properties;

  @Override
  public void run(ApplicationArguments args) throws Exception {
    execute(args);
  }

  @VisibleForTesting
  LoadRunResult execute(ApplicationArguments args) throws InterruptedException {
    var parameters = LoadGeneratorArguments.resolve(args, properties);
    log.debug("Resolved load parameters {}", parameters);

    var coordinator =
        new LoadCoordinator(
            parameters,
            workerId -> new LoadHttpClient(parameters.requestTimeout()),
            new ConsoleReport(),
            new ShutdownSignalHook(parameters.drainBudget()),
            Clock.systemUTC());

    LoadRunResult result = coordinator.run();
    log.debug(
        "Load run completed with {} attempts ({} failed)",
        result.counters().total(),
        result.counters().fail());
    return result;
  }
}

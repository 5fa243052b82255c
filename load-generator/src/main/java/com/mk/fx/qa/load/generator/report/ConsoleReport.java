package com.mk.fx.qa.load.generator.report;

import com.mk.fx.qa.load.generator.executors.LoadParameters;
import com.mk.fx.qa.load.generator.executors.LoadRunResult;
import com.mk.fx.qa.load.generator.metrics.ReportSample;
import com.mk.fx.qa.load.generator.rest.LoadHttpClient;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Operator-facing console output: start banner, the overwritten live status line, the shutdown
 * notice and the final results block.
 */
public class ConsoleReport {

  private final PrintStream out;

  public ConsoleReport() {
    this(System.out);
  }

  public ConsoleReport(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  public void printBanner(LoadParameters parameters) {
    out.println("Starting load test against " + targetUrl(parameters));
    out.println("Using " + parameters.workers() + " concurrent workers");
    if (parameters.detailed()) {
      out.println(
          "Detailed per-request events enabled (queue capacity "
              + parameters.eventQueueCapacity()
              + ")");
    }
    out.println("Press Ctrl+C to stop the test");
    out.println();
    out.flush();
  }

  /** Prints the status line without a newline so the next tick overwrites it. */
  public void printStatus(ReportSample sample) {
    out.print("\r" + formatStatus(sample));
    out.flush();
  }

  public void printShutdownNotice() {
    out.println();
    out.println();
    out.println("Shutting down, please wait for workers to complete...");
    out.flush();
  }

  public void printSummary(LoadRunResult result) {
    out.print(formatSummary(result));
    out.flush();
  }

  public static String formatStatus(ReportSample sample) {
    return String.format(
        Locale.ROOT,
        "[STATS] Requests: %d | Rate: %.2f req/s | Avg: %.2f req/s | Success: %.1f%% | Workers: %d",
        sample.total(),
        sample.instantRate(),
        sample.averageRate(),
        sample.successPercent(),
        sample.liveWorkers());
  }

  public static String formatSummary(LoadRunResult result) {
    var counters = result.counters();
    var sb = new StringBuilder();
    sb.append("\n\n--- Final Results ---\n");
    sb.append(String.format(Locale.ROOT, "Total requests:    %d\n", counters.total()));
    sb.append(
        String.format(
            Locale.ROOT,
            "Successful:        %d (%.1f%%)\n",
            counters.success(),
            counters.successPercent()));
    sb.append(
        String.format(
            Locale.ROOT, "Failed:            %d (%.1f%%)\n", counters.fail(), counters.failPercent()));
    sb.append(
        String.format(Locale.ROOT, "Total time:        %.2f seconds\n", result.elapsedSeconds()));
    sb.append(
        String.format(
            Locale.ROOT, "Average rate:      %.2f requests/second\n", result.averageRate()));
    if (!result.failureReasons().isEmpty()) {
      sb.append("Failure reasons:   ").append(join(result.failureReasons())).append('\n');
    }
    if (!result.statusCodes().isEmpty()) {
      sb.append("Status codes:      ").append(join(result.statusCodes())).append('\n');
    }
    if (result.droppedEvents() > 0) {
      sb.append("Dropped events:    ").append(result.droppedEvents()).append('\n');
    }
    if (result.abandonedWorkers() > 0) {
      sb.append("Abandoned workers: ")
          .append(result.abandonedWorkers())
          .append(" of ")
          .append(result.workers())
          .append('\n');
    }
    return sb.toString();
  }

  private static String targetUrl(LoadParameters parameters) {
    return LoadHttpClient.buildUrl(parameters.host(), parameters.path());
  }

  private static String join(Map<?, Long> counts) {
    return counts.entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining(", "));
  }
}

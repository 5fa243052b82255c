package com.mk.fx.qa.load.generator.cfg;

import static com.mk.fx.qa.load.generator.utils.LoadUtils.parseDuration;

import com.google.common.base.Strings;
import com.mk.fx.qa.load.generator.executors.LoadParameters;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.springframework.boot.ApplicationArguments;

/**
 * Resolves {@link LoadParameters} from the command line on top of {@link LoadGeneratorCfg}.
 *
 * <pre>
 * load-generator &lt;host&gt; [--path=/] [--threads=50] [--timeout=3.0] [--report-interval=1.0]
 *                [--detailed] [--max-attempts=0]
 * </pre>
 *
 * <p>{@code --timeout} and {@code --report-interval} take decimal seconds or a {@code ms/s/m/h}
 * suffixed value. {@code --workers} is accepted as an alias of {@code --threads}.
 */
public final class LoadGeneratorArguments {

  static final String PATH = "path";
  static final String THREADS = "threads";
  static final String WORKERS = "workers";
  static final String TIMEOUT = "timeout";
  static final String REPORT_INTERVAL = "report-interval";
  static final String DETAILED = "detailed";
  static final String MAX_ATTEMPTS = "max-attempts";

  private LoadGeneratorArguments() {
    throw new UnsupportedOperationException("LoadGeneratorArguments cannot be instantiated");
  }

  /**
   * Builds the run parameters.
   *
   * @throws IllegalArgumentException if no host is given or an option value is invalid
   */
  public static LoadParameters resolve(ApplicationArguments args, LoadGeneratorCfg defaults) {
    Objects.requireNonNull(args, "args");
    Objects.requireNonNull(defaults, "defaults");

    var host = resolveHost(args, defaults);
    var path = normalisePath(option(args, PATH, defaults.getPath()));
    var workers =
        parseInt(
            option(args, THREADS, option(args, WORKERS, String.valueOf(defaults.getWorkers()))),
            THREADS);
    if (workers < 1) {
      throw new IllegalArgumentException("--" + THREADS + " must be at least 1, got " + workers);
    }
    var timeout = durationOption(args, TIMEOUT, defaults.getRequestTimeout());
    var reportInterval = durationOption(args, REPORT_INTERVAL, defaults.getReportInterval());
    var detailed = flag(args, DETAILED, defaults.isDetailed());
    var maxAttempts =
        parseLong(
            option(args, MAX_ATTEMPTS, String.valueOf(defaults.getMaxAttemptsPerWorker())),
            MAX_ATTEMPTS);
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("--" + MAX_ATTEMPTS + " must not be negative");
    }

    return new LoadParameters(
        host,
        path,
        workers,
        timeout,
        reportInterval,
        detailed,
        defaults.getEventQueueCapacity(),
        defaults.getWorkerJoinTimeout(),
        defaults.getStopPollInterval(),
        defaults.isConsumeEvents(),
        maxAttempts);
  }

  private static String resolveHost(ApplicationArguments args, LoadGeneratorCfg defaults) {
    List<String> positional = args.getNonOptionArgs();
    if (positional.size() > 1) {
      throw new IllegalArgumentException("Expected a single target host, got " + positional);
    }
    var host = positional.isEmpty() ? defaults.getTargetHost() : positional.get(0);
    if (Strings.isNullOrEmpty(host) || host.isBlank()) {
      throw new IllegalArgumentException(
          "Target host must be provided as the first argument or via load.generator.target-host");
    }
    return host.trim();
  }

  private static String normalisePath(String path) {
    if (path == null || path.isBlank()) {
      return "/";
    }
    var trimmed = path.trim();
    return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
  }

  private static String option(ApplicationArguments args, String name, String fallback) {
    if (!args.containsOption(name)) {
      return fallback;
    }
    var values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("--" + name + " requires a value");
    }
    return values.get(values.size() - 1);
  }

  private static boolean flag(ApplicationArguments args, String name, boolean fallback) {
    if (!args.containsOption(name)) {
      return fallback;
    }
    var values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return true;
    }
    var value = values.get(values.size() - 1).trim();
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("--" + name + " expects true or false, got '" + value + "'");
  }

  private static Duration durationOption(
      ApplicationArguments args, String name, Duration fallback) {
    if (!args.containsOption(name)) {
      return fallback;
    }
    var duration = parseDuration(option(args, name, null));
    if (duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException("--" + name + " must be positive");
    }
    return duration;
  }

  private static int parseInt(String value, String name) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " expects an integer, got '" + value + "'", e);
    }
  }

  private static long parseLong(String value, String name) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " expects an integer, got '" + value + "'", e);
    }
  }
}

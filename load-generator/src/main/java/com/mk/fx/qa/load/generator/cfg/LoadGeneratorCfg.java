package com.mk.fx.qa.load.generator.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Defaults for a load run; command-line options override them per run. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "load.generator")
public class LoadGeneratorCfg {

  /** Target host, used when no host argument is given. */
  private String targetHost;

  @NotBlank private String path = "/";

  @Min(1)
  @Max(10_000)
  private int workers = 50;

  @NotNull private Duration requestTimeout = Duration.ofSeconds(3);

  @NotNull private Duration reportInterval = Duration.ofSeconds(1);

  private boolean detailed = false;

  @Positive private int eventQueueCapacity = 10_000;

  private boolean consumeEvents = true;

  @NotNull private Duration workerJoinTimeout = Duration.ofSeconds(1);

  @NotNull private Duration stopPollInterval = Duration.ofMillis(100);

  /** Attempts after which each worker stops on its own; 0 runs until interrupted. */
  @PositiveOrZero private long maxAttemptsPerWorker = 0;
}

package com.mk.fx.qa.loadster.cfg;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "loadster")
public class LoadsterCfg {

  /** Value of the identifying User-Agent header sent with every request. */
  @NotBlank private String userAgent = "loadster 1.0.0";

  @Min(1)
  private int defaultConcurrency = 10;

  @NotNull private Duration defaultTimeout = Duration.ofSeconds(30);

  /** Upper bound on workers per run; every worker gets its own thread. */
  @Min(1)
  private int maxConcurrency = 10_000;

  @Positive private int historySize = 50;
}

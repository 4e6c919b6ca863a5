package com.mk.fx.qa.loadster.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Loadster API")
                .version("1.0.0")
                .description(
                    "Fires a fixed number of concurrent one-shot HTTP requests at a target and"
                        + " reports latency, throughput and status-code statistics."));
  }
}

package com.mk.fx.qa.loadster;

import com.mk.fx.qa.loadster.cli.LoadsterCommandLine;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Starts either the HTTP service or, when invoked with {@code -u/--url}, a single command-line run
 * that prints its report and exits.
 */
@SpringBootApplication
public class LoadsterApplication {

  public static void main(String[] args) {
    if (LoadsterCommandLine.isInvocation(args)) {
      var context =
          new SpringApplicationBuilder(LoadsterApplication.class)
              .web(WebApplicationType.NONE)
              .bannerMode(Banner.Mode.OFF)
              .profiles("cli")
              .properties("loadster.cli.enabled=true")
              .run(args);
      System.exit(SpringApplication.exit(context));
    } else {
      SpringApplication.run(LoadsterApplication.class, args);
    }
  }
}

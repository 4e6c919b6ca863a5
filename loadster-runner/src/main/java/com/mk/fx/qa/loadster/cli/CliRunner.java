package com.mk.fx.qa.loadster.cli;

import com.mk.fx.qa.loadster.processors.DispatchSetupException;
import com.mk.fx.qa.loadster.resource.LoadTestRequestMapper;
import com.mk.fx.qa.loadster.service.LoadTestService;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kohsuke.args4j.CmdLineException;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * Runs one load test from command-line options, prints the report and records the exit code:
 * {@code 0} on a finished run, {@code 1} when the run could not start or the sample file could not
 * be written, {@code 2} on invalid arguments.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "loadster.cli.enabled", havingValue = "true")
@RequiredArgsConstructor
public class CliRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final String WORKER_LOGGER = "com.mk.fx.qa.loadster.executors";

  private final LoadTestService loadTestService;
  private final LoadTestRequestMapper requestMapper;
  private final LoggingSystem loggingSystem;

  private int exitCode = EXIT_OK;

  @Override
  public void run(ApplicationArguments args) {
    exitCode = execute(args.getSourceArgs(), System.out, System.err);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  int execute(String[] argv, PrintStream out, PrintStream err) {
    LoadsterCommandLine options;
    try {
      options = LoadsterCommandLine.parse(argv);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      LoadsterCommandLine.printUsage(err);
      return EXIT_USAGE;
    }
    if (options.help) {
      LoadsterCommandLine.printUsage(out);
      return EXIT_OK;
    }
    if (options.verbose) {
      loggingSystem.setLogLevel(WORKER_LOGGER, LogLevel.DEBUG);
    }

    try {
      var spec = requestMapper.toSpec(options.toRequest());
      var completed = loadTestService.run(spec);
      new ReportPrinter(out).print(completed.report());

      if (options.output != null && !options.output.isBlank()) {
        SampleFileWriter.write(completed.samples(), Path.of(options.output));
      }
      return EXIT_OK;
    } catch (IllegalArgumentException e) {
      err.println("Invalid arguments: " + e.getMessage());
      return EXIT_USAGE;
    } catch (DispatchSetupException e) {
      log.error("Load test could not start", e);
      err.println("Fatal: " + e.getMessage());
      return EXIT_FAILED;
    } catch (IOException e) {
      log.error("Unable to write samples to {}", options.output, e);
      err.println("Unable to write samples to " + options.output + ": " + e.getMessage());
      return EXIT_FAILED;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      err.println("Interrupted before all requests completed");
      return EXIT_FAILED;
    }
  }
}

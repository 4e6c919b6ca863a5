package com.mk.fx.qa.loadster.cli;

import com.mk.fx.qa.loadster.model.Sample;
import com.mk.fx.qa.loadster.utils.JsonUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Writes samples as newline-delimited JSON. */
@Slf4j
public final class SampleFileWriter {

  private SampleFileWriter() {
    // Utility class, no instantiation
  }

  public static void write(List<Sample> samples, Path output) throws IOException {
    var parent = output.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (var writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
      for (Sample sample : samples) {
        writer.write(
            JsonUtil.toJsonLine(
                new SampleLine(
                    sample.status(), sample.latency().toNanos() / 1_000_000.0, sample.timestamp())));
        writer.newLine();
      }
    }
    log.info("Saved {} samples to {}", samples.size(), output);
  }

  record SampleLine(int status, double latencyMs, Instant timestamp) {}
}

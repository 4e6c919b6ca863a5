package com.mk.fx.qa.loadster.executors;

import com.mk.fx.qa.loadster.metrics.ErrorSample;
import com.mk.fx.qa.loadster.model.Sample;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a one-shot run produced.
 *
 * @param samples one sample per completed call, in no particular order
 * @param issuedRequests number of workers launched
 * @param networkErrors calls that produced no response and therefore no sample
 * @param errorBreakdown network errors by category
 * @param errorSamples a few representative network errors
 * @param startedAt instant the workers were released
 * @param finishedAt instant the last worker finished
 */
public record DispatchResult(
    List<Sample> samples,
    int issuedRequests,
    long networkErrors,
    Map<String, Long> errorBreakdown,
    List<ErrorSample> errorSamples,
    Instant startedAt,
    Instant finishedAt) {

  public DispatchResult {
    samples = List.copyOf(samples);
    errorBreakdown = Map.copyOf(errorBreakdown);
    errorSamples = List.copyOf(errorSamples);
  }

  public Duration wallClock() {
    return Duration.between(startedAt, finishedAt);
  }
}

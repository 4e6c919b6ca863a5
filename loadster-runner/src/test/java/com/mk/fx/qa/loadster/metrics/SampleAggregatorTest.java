package com.mk.fx.qa.loadster.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.loadster.model.Sample;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SampleAggregatorTest {

  private static final double EPS = 1e-9;

  private static Sample sample(int status, long millis) {
    return new Sample(status, Duration.ofMillis(millis), Instant.now());
  }

  @Test
  void aggregate_emptyInput_allZero() {
    var report = SampleAggregator.aggregate(List.of());

    assertEquals(0, report.totalRequests());
    assertEquals(0, report.successfulRequests());
    assertEquals(0, report.failedRequests());
    assertEquals(0.0, report.totalLatencyMs());
    assertEquals(0.0, report.averageLatencyMs());
    assertEquals(0.0, report.medianLatencyMs());
    assertEquals(0.0, report.p99LatencyMs());
    assertEquals(0.0, report.throughputRps());
    assertTrue(report.statusCodes().isEmpty());
    assertEquals(LoadReport.SuccessLatency.NONE, report.successLatency());
  }

  @Test
  void aggregate_fiveFastSuccesses() {
    List<Sample> samples = new ArrayList<>();
    for (int i = 0; i < 5; i++) samples.add(sample(200, 10));

    var report = SampleAggregator.aggregate(samples);

    assertEquals(5, report.totalRequests());
    assertEquals(5, report.successfulRequests());
    assertEquals(0, report.failedRequests());
    assertEquals(50.0, report.totalLatencyMs(), EPS);
    assertEquals(10.0, report.averageLatencyMs(), EPS);
    assertEquals(10.0, report.minLatencyMs(), EPS);
    assertEquals(10.0, report.maxLatencyMs(), EPS);
    assertEquals(100.0, report.throughputRps(), EPS);
    assertEquals(1, report.statusCodes().size());
    assertEquals(5L, report.statusCodes().get(200).count());
    assertEquals(100.0, report.statusCodes().get(200).percentage(), EPS);
  }

  @Test
  void aggregate_mixedStatuses_histogramAndSuccessOnlyStats() {
    var samples = List.of(sample(500, 30), sample(200, 20), sample(500, 40), sample(200, 10));

    var report = SampleAggregator.aggregate(samples);

    assertEquals(4, report.totalRequests());
    assertEquals(2, report.successfulRequests());
    assertEquals(2, report.failedRequests());
    assertEquals(25.0, report.averageLatencyMs(), EPS);
    assertEquals(10.0, report.minLatencyMs(), EPS);
    // index floor(0.5 * 4) = 2 of [10, 20, 30, 40]
    assertEquals(30.0, report.medianLatencyMs(), EPS);
    assertEquals(40.0, report.p75LatencyMs(), EPS);
    assertEquals(40.0, report.p95LatencyMs(), EPS);
    assertEquals(40.0, report.maxLatencyMs(), EPS);

    assertEquals(50.0, report.statusCodes().get(200).percentage(), EPS);
    assertEquals(50.0, report.statusCodes().get(500).percentage(), EPS);

    var success = report.successLatency();
    assertEquals(10.0, success.minMs(), EPS);
    assertEquals(20.0, success.maxMs(), EPS);
    assertEquals(15.0, success.averageMs(), EPS);
  }

  @Test
  void aggregate_noSuccesses_successLatencyIsZero() {
    var report = SampleAggregator.aggregate(List.of(sample(404, 5), sample(503, 7)));

    assertEquals(0, report.successfulRequests());
    assertEquals(2, report.failedRequests());
    assertEquals(LoadReport.SuccessLatency.NONE, report.successLatency());
  }

  @Test
  void aggregate_statusCodesRenderedAscending() {
    var report =
        SampleAggregator.aggregate(List.of(sample(503, 1), sample(200, 1), sample(301, 1)));
    assertEquals(List.of(200, 301, 503), new ArrayList<>(report.statusCodes().keySet()));
  }

  @Test
  void aggregate_randomSamples_satisfyInvariants() {
    var random = new Random(42);
    int[] statuses = {200, 201, 204, 301, 404, 500, 503};

    for (int round = 0; round < 50; round++) {
      int n = 1 + random.nextInt(300);
      List<Sample> samples = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        samples.add(
            new Sample(
                statuses[random.nextInt(statuses.length)],
                Duration.ofNanos(1 + random.nextInt(500_000_000)),
                Instant.now()));
      }
      var before = new ArrayList<>(samples);

      var report = SampleAggregator.aggregate(samples);

      assertEquals(before, samples, "input must not be mutated");
      assertEquals(n, report.totalRequests());
      assertEquals(report.totalRequests(), report.successfulRequests() + report.failedRequests());
      assertEquals(report.totalLatencyMs(), report.averageLatencyMs() * n, 1e-6);

      long[] sorted = samples.stream().mapToLong(s -> s.latency().toNanos()).toArray();
      Arrays.sort(sorted);
      for (long nanos : sorted) {
        double ms = nanos / 1_000_000.0;
        assertTrue(report.minLatencyMs() <= ms && ms <= report.maxLatencyMs());
      }
      assertEquals(expectedPercentileMs(sorted, 50), report.medianLatencyMs(), EPS);
      assertEquals(expectedPercentileMs(sorted, 75), report.p75LatencyMs(), EPS);
      assertEquals(expectedPercentileMs(sorted, 95), report.p95LatencyMs(), EPS);
      assertEquals(expectedPercentileMs(sorted, 99), report.p99LatencyMs(), EPS);

      long histogramTotal = 0;
      for (var e : report.statusCodes().entrySet()) {
        histogramTotal += e.getValue().count();
        assertEquals(100.0 * e.getValue().count() / n, e.getValue().percentage(), EPS);
      }
      assertEquals(n, histogramTotal);

      long successes = samples.stream().filter(Sample::isSuccess).count();
      assertEquals(successes, report.successfulRequests());
    }
  }

  @Test
  void percentile_clampsAndUsesFloorIndex() {
    long[] single = {7};
    assertEquals(7, SampleAggregator.percentile(single, 0));
    assertEquals(7, SampleAggregator.percentile(single, 99));
    assertEquals(7, SampleAggregator.percentile(single, 100));

    long[] ten = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
    assertEquals(1, SampleAggregator.percentile(ten, 0));
    assertEquals(6, SampleAggregator.percentile(ten, 50));
    assertEquals(10, SampleAggregator.percentile(ten, 95));
    assertEquals(10, SampleAggregator.percentile(ten, 100));
  }

  @Test
  void percentile_rejectsInvalidInput() {
    assertThrows(IllegalArgumentException.class, () -> SampleAggregator.percentile(new long[] {1}, 101));
    assertThrows(IllegalArgumentException.class, () -> SampleAggregator.percentile(new long[] {1}, -1));
    assertThrows(IllegalArgumentException.class, () -> SampleAggregator.percentile(new long[0], 50));
  }

  @Test
  void aggregate_rejectsNull() {
    assertThrows(NullPointerException.class, () -> SampleAggregator.aggregate(null));
  }

  private static double expectedPercentileMs(long[] sorted, int k) {
    int index = (int) Math.floor(sorted.length * (k / 100.0));
    index = Math.min(sorted.length - 1, Math.max(0, index));
    return sorted[index] / 1_000_000.0;
  }
}

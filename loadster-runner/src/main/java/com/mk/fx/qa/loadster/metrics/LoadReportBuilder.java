package com.mk.fx.qa.loadster.metrics;

import com.mk.fx.qa.loadster.dto.LoadTestRunReport;
import com.mk.fx.qa.loadster.executors.DispatchResult;
import com.mk.fx.qa.loadster.model.RequestSpec;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Assembles the {@link LoadTestRunReport} of a run from its dispatch result and sample statistics. */
public final class LoadReportBuilder {

  public LoadTestRunReport build(
      UUID runId, RequestSpec spec, DispatchResult dispatch, LoadReport results) {

    var r = new LoadTestRunReport();

    // identifiers & request
    r.runId = runId;
    r.url = spec.url();
    r.method = spec.method();
    r.concurrency = spec.concurrency();
    r.timeout = spec.timeout();

    // timing
    r.startTime = dispatch.startedAt();
    r.endTime = dispatch.finishedAt();
    r.wallClockSec = Math.max(0.0, dispatch.wallClock().toNanos() / 1_000_000_000.0);
    r.wallClockThroughputRps =
        r.wallClockSec > 0 ? results.totalRequests() / r.wallClockSec : 0.0;

    // accounting
    r.issuedRequests = dispatch.issuedRequests();
    r.completedRequests = results.totalRequests();
    r.networkErrors = dispatch.networkErrors();

    List<LoadTestRunReport.ErrorItem> errs = new ArrayList<>();
    for (Map.Entry<String, Long> e : dispatch.errorBreakdown().entrySet()) {
      LoadTestRunReport.ErrorItem item = new LoadTestRunReport.ErrorItem();
      item.type = e.getKey();
      item.count = e.getValue();
      errs.add(item);
    }
    errs.sort(Comparator.comparingLong((LoadTestRunReport.ErrorItem item) -> item.count).reversed());
    r.errorBreakdown = List.copyOf(errs);
    r.errorSamples = dispatch.errorSamples();

    r.results = results;
    r.summary = computeSummary(r);
    return r;
  }

  private LoadTestRunReport.Summary computeSummary(LoadTestRunReport r) {
    var m = r.results;
    double successRate =
        r.issuedRequests == 0 ? 0.0 : (double) m.successfulRequests() / r.issuedRequests;

    LoadTestRunReport.Summary s = new LoadTestRunReport.Summary();
    String status =
        successRate >= 1.0 ? "SUCCESS" : (successRate >= 0.95 ? "PARTIAL_SUCCESS" : "FAILED");
    s.status = status;
    s.message =
        switch (status) {
          case "SUCCESS" -> "Every issued request completed with a 2xx response.";
          case "PARTIAL_SUCCESS" -> "Minor failures observed; overall run largely successful.";
          default -> "Failures observed; review status codes and network errors.";
        };

    s.highlights = new ArrayList<>();
    s.concerns = new ArrayList<>();

    s.highlights.add(String.format("successRate=%.2f%%", successRate * 100));
    s.highlights.add(String.format("latency.avg=%.2fms", m.averageLatencyMs()));
    s.highlights.add(String.format("latency.p95=%.2fms", m.p95LatencyMs()));
    s.highlights.add(
        String.format(
            "throughput=%.2f req/s (summed latency), %.2f req/s (wall clock)",
            m.throughputRps(), r.wallClockThroughputRps));

    if (r.networkErrors > 0) s.concerns.add("networkErrors=" + r.networkErrors);
    if (m.failedRequests() > 0) s.concerns.add("non2xxResponses=" + m.failedRequests());
    if (m.totalRequests() == 0) s.concerns.add("noCompletedRequests");
    return s;
  }
}

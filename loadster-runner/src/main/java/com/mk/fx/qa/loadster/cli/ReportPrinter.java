package com.mk.fx.qa.loadster.cli;

import com.mk.fx.qa.loadster.dto.LoadTestRunReport;
import com.mk.fx.qa.loadster.metrics.LoadReport;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;

/** Renders a run report for the console. */
public final class ReportPrinter {

  private final PrintStream out;

  public ReportPrinter(PrintStream out) {
    this.out = out;
  }

  public void print(LoadTestRunReport report) {
    printResults(report.results);
    printReport(report);
  }

  private void printResults(LoadReport r) {
    out.println();
    out.println("Load Test Results:");
    line("Total Requests: %d", r.totalRequests());
    line("Successful Requests: %d", r.successfulRequests());
    line("Failed Requests: %d", r.failedRequests());
    line("Total Time: %.2f ms", r.totalLatencyMs());
    line("Average Time per Request: %.2f ms", r.averageLatencyMs());
    line("Median Time: %.2f ms", r.medianLatencyMs());
    line("Minimum Time: %.2f ms", r.minLatencyMs());
    line("Maximum Time: %.2f ms", r.maxLatencyMs());
  }

  private void printReport(LoadTestRunReport report) {
    var r = report.results;
    out.println();
    out.println("Load Test Report");
    out.println("Summary");
    out.println("Metric\tValue");
    line("Target URL\t%s", report.url);
    line("Method\t%s", report.method);
    line("Issued Requests\t%d", report.issuedRequests);
    line("Total Requests\t%d", r.totalRequests());
    line("Successful Requests\t%d", r.successfulRequests());
    line("Failed Requests\t%d", r.failedRequests());
    line("Network Errors\t%d", report.networkErrors);
    line("Duration\t%.2f seconds", r.totalLatencySeconds());
    line("Throughput\t%.2f req/s", r.throughputRps());
    line("Wall-clock Throughput\t%.2f req/s over %.2f seconds", report.wallClockThroughputRps, report.wallClockSec);
    line("Avg Latency\t%.2f ms", r.averageLatencyMs());
    line("P95 Latency\t%.2f ms", r.p95LatencyMs());
    line("P99 Latency\t%.2f ms", r.p99LatencyMs());

    out.println();
    out.println("Response Codes");
    out.println("Code\tCount\tPercentage");
    for (Map.Entry<Integer, LoadReport.StatusCodeShare> e : r.statusCodes().entrySet()) {
      line("%d\t%d\t%.2f%%", e.getKey(), e.getValue().count(), e.getValue().percentage());
    }

    if (report.errorBreakdown != null && !report.errorBreakdown.isEmpty()) {
      out.println();
      out.println("Network Errors");
      out.println("Type\tCount");
      for (LoadTestRunReport.ErrorItem item : report.errorBreakdown) {
        line("%s\t%d", item.type, item.count);
      }
    }

    out.println();
    out.println("Latency Distribution");
    out.println("Percentile\tLatency (ms)");
    line("P50\t%.2f", r.medianLatencyMs());
    line("P75\t%.2f", r.p75LatencyMs());
    line("P95\t%.2f", r.p95LatencyMs());
    line("P99\t%.2f", r.p99LatencyMs());
    line("Max\t%.2f", r.maxLatencyMs());

    var success = r.successLatency();
    out.println();
    out.println("Additional Metrics");
    line("Min Successful Request Time: %.2f ms", success.minMs());
    line("Max Successful Request Time: %.2f ms", success.maxMs());
    line("Avg Successful Request Time: %.2f ms", success.averageMs());
    line("Status: %s", report.summary != null ? report.summary.status : "UNKNOWN");
  }

  private void line(String format, Object... args) {
    out.println(String.format(Locale.ROOT, format, args));
  }
}

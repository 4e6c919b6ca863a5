package com.mk.fx.qa.loadster.dto;

import com.mk.fx.qa.loadster.rest.HttpMethod;
import java.time.Instant;
import java.util.UUID;

public record LoadTestHistoryEntry(
    UUID runId,
    String url,
    HttpMethod method,
    int concurrency,
    Instant startTime,
    long completedRequests,
    long successfulRequests,
    String status) {

  public static LoadTestHistoryEntry of(LoadTestRunReport report) {
    return new LoadTestHistoryEntry(
        report.runId,
        report.url,
        report.method,
        report.concurrency,
        report.startTime,
        report.completedRequests,
        report.results.successfulRequests(),
        report.summary.status);
  }
}

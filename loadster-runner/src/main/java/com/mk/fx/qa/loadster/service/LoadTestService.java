package com.mk.fx.qa.loadster.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.loadster.dto.LoadTestHistoryEntry;
import com.mk.fx.qa.loadster.dto.LoadTestRunReport;
import com.mk.fx.qa.loadster.metrics.LoadReportBuilder;
import com.mk.fx.qa.loadster.metrics.LoadReportRegistry;
import com.mk.fx.qa.loadster.metrics.SampleAggregator;
import com.mk.fx.qa.loadster.model.RequestSpec;
import com.mk.fx.qa.loadster.processors.Dispatcher;
import com.mk.fx.qa.loadster.utils.JsonUtil;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs load tests end to end: dispatch, aggregation, report assembly and retention.
 *
 * <p>Runs are synchronous; concurrent callers each get their own run with its own worker threads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadTestService {

  private final Dispatcher dispatcher;
  private final LoadReportRegistry registry;
  private final LoadReportBuilder reportBuilder = new LoadReportBuilder();

  /**
   * Executes one run and stores its report.
   *
   * @param spec validated run description
   * @return the samples and the report
   * @throws com.mk.fx.qa.loadster.processors.DispatchSetupException if the run cannot start
   * @throws InterruptedException if interrupted while the workers are running
   */
  public CompletedRun run(RequestSpec spec) throws InterruptedException {
    Objects.requireNonNull(spec, "spec");
    var runId = UUID.randomUUID();
    log.info("Run {} started: {} {} users={} timeout={}", runId, spec.method(), spec.url(), spec.concurrency(), spec.timeout());

    var dispatch = dispatcher.dispatch(runId, spec);
    var results = SampleAggregator.aggregate(dispatch.samples());
    var report = reportBuilder.build(runId, spec, dispatch, results);
    registry.save(report);

    log.info(
        "Run {} summary status={} issued={} completed={} successful={} networkErrors={} avg={}ms p95={}ms",
        runId,
        report.summary.status,
        report.issuedRequests,
        report.completedRequests,
        results.successfulRequests(),
        report.networkErrors,
        String.format("%.2f", results.averageLatencyMs()),
        String.format("%.2f", results.p95LatencyMs()));
    if (log.isDebugEnabled()) {
      try {
        log.debug("Run {} report:\n{}", runId, JsonUtil.toJson(report));
      } catch (JsonProcessingException e) {
        log.debug("Run {} report (unformatted): {}", runId, report);
      }
    }
    return new CompletedRun(dispatch.samples(), report);
  }

  public Optional<LoadTestRunReport> getReport(UUID runId) {
    return registry.getReport(runId);
  }

  /** Most recent runs first. */
  public List<LoadTestHistoryEntry> getHistory() {
    return registry.history().stream().map(LoadTestHistoryEntry::of).toList();
  }
}

package com.mk.fx.qa.loadster.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.loadster.cfg.LoadsterCfg;
import com.mk.fx.qa.loadster.executors.DispatchResult;
import com.mk.fx.qa.loadster.metrics.LoadReportRegistry;
import com.mk.fx.qa.loadster.model.RequestSpec;
import com.mk.fx.qa.loadster.model.Sample;
import com.mk.fx.qa.loadster.processors.DispatchSetupException;
import com.mk.fx.qa.loadster.processors.Dispatcher;
import com.mk.fx.qa.loadster.rest.HttpMethod;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadTestServiceTest {

  private Dispatcher dispatcher;
  private LoadReportRegistry registry;
  private LoadTestService service;

  private static final RequestSpec SPEC =
      new RequestSpec(
          "http://localhost:9000/orders", HttpMethod.POST, List.of(), "{}", Duration.ofSeconds(1), 3);

  @BeforeEach
  void setUp() {
    dispatcher = mock(Dispatcher.class);
    var cfg = new LoadsterCfg();
    cfg.setHistorySize(10);
    registry = new LoadReportRegistry(cfg);
    service = new LoadTestService(dispatcher, registry);
  }

  private static DispatchResult result(List<Sample> samples, int issued, Map<String, Long> errors) {
    var start = Instant.now();
    long errorCount = errors.values().stream().mapToLong(Long::longValue).sum();
    return new DispatchResult(samples, issued, errorCount, errors, List.of(), start, start.plusMillis(50));
  }

  @Test
  void run_aggregatesAndStoresReport() throws Exception {
    var samples =
        List.of(
            new Sample(201, Duration.ofMillis(10), Instant.now()),
            new Sample(201, Duration.ofMillis(20), Instant.now()));
    when(dispatcher.dispatch(any(), eq(SPEC)))
        .thenReturn(result(samples, 3, Map.of("CONNECTION_REFUSED", 1L)));

    var completed = service.run(SPEC);

    assertEquals(samples, completed.samples());
    var report = completed.report();
    assertNotNull(report.runId);
    assertEquals(HttpMethod.POST, report.method);
    assertEquals(3, report.issuedRequests);
    assertEquals(2, report.completedRequests);
    assertEquals(1, report.networkErrors);
    assertEquals(2, report.results.successfulRequests());
    assertEquals(15.0, report.results.averageLatencyMs(), 1e-9);
    assertEquals("FAILED", report.summary.status);

    assertSame(report, service.getReport(report.runId).orElseThrow());
    var history = service.getHistory();
    assertEquals(1, history.size());
    assertEquals(report.runId, history.get(0).runId());
    assertEquals(2, history.get(0).successfulRequests());
    verify(dispatcher).dispatch(report.runId, SPEC);
  }

  @Test
  void run_setupFailure_propagates_andStoresNothing() throws Exception {
    when(dispatcher.dispatch(any(), any()))
        .thenThrow(new DispatchSetupException("bad header", new IllegalArgumentException()));

    assertThrows(DispatchSetupException.class, () -> service.run(SPEC));
    assertTrue(service.getHistory().isEmpty());
  }

  @Test
  void run_interrupted_propagates() throws Exception {
    when(dispatcher.dispatch(any(), any())).thenThrow(new InterruptedException("stop"));
    assertThrows(InterruptedException.class, () -> service.run(SPEC));
  }

  @Test
  void getReport_unknownRun_isEmpty() {
    assertTrue(service.getReport(UUID.randomUUID()).isEmpty());
  }
}

package com.mk.fx.qa.loadster.resource;

import com.mk.fx.qa.loadster.cfg.ErrorResponse;
import com.mk.fx.qa.loadster.dto.HealthResponse;
import com.mk.fx.qa.loadster.dto.LoadTestHistoryEntry;
import com.mk.fx.qa.loadster.dto.LoadTestRequest;
import com.mk.fx.qa.loadster.dto.LoadTestRunReport;
import com.mk.fx.qa.loadster.service.LoadTestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Load Tests", description = "Endpoints for running one-shot load tests and reading their reports")
@RestController
@RequestMapping("/api/load-tests")
@Validated
@RequiredArgsConstructor
public class LoadTestController {

  private final LoadTestService loadTestService;
  private final LoadTestRequestMapper requestMapper;

  @Operation(
      summary = "Run a load test",
      description =
          "Fires the configured number of simultaneous requests, waits for all of them and returns"
              + " the run report.")
  @PostMapping
  public ResponseEntity<LoadTestRunReport> run(@Valid @RequestBody LoadTestRequest request)
      throws InterruptedException {
    log.info("Received load test for {} {} x{}", request.getMethod(), request.getUrl(), request.getConcurrency());
    var spec = requestMapper.toSpec(request);
    var completed = loadTestService.run(spec);
    return ResponseEntity.ok(completed.report());
  }

  @Operation(summary = "Run report", description = "Returns the report of a retained run.")
  @GetMapping("/{runId}/report")
  public ResponseEntity<?> getReport(@PathVariable UUID runId) {
    return loadTestService
        .getReport(runId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Report not found for run {}", runId);
              return ResponseEntity.status(HttpStatus.NOT_FOUND)
                  .body(new ErrorResponse("Not Found", "Report not found for run: " + runId));
            });
  }

  @Operation(summary = "Run history", description = "Returns the most recent runs, newest first.")
  @GetMapping("/history")
  public ResponseEntity<List<LoadTestHistoryEntry>> getHistory() {
    return ResponseEntity.ok(loadTestService.getHistory());
  }

  @Operation(summary = "Health check", description = "Verifies service health.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(new HealthResponse("UP"));
  }
}

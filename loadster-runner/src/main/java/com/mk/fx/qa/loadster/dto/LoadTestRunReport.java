package com.mk.fx.qa.loadster.dto;

import com.mk.fx.qa.loadster.metrics.ErrorSample;
import com.mk.fx.qa.loadster.metrics.LoadReport;
import com.mk.fx.qa.loadster.rest.HttpMethod;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Report of one run: the request that was issued, the sample statistics and the accounting of calls
 * that never produced a sample.
 */
public class LoadTestRunReport {

  public UUID runId;
  public String url;
  public HttpMethod method;
  public int concurrency;
  public Duration timeout;
  public Instant startTime;
  public Instant endTime;
  public double wallClockSec;
  /** Completed calls divided by the wall-clock span of the run. */
  public double wallClockThroughputRps;

  public int issuedRequests;
  public long completedRequests;
  public long networkErrors;
  public List<ErrorItem> errorBreakdown;
  public List<ErrorSample> errorSamples;

  public LoadReport results;
  public Summary summary;

  public static class ErrorItem {
    public String type;
    public long count;
  }

  public static class Summary {
    public String status; // SUCCESS, PARTIAL_SUCCESS, FAILED
    public String message;
    public List<String> highlights;
    public List<String> concerns;
  }
}

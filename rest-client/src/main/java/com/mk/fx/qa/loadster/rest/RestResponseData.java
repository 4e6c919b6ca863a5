package com.mk.fx.qa.loadster.rest;

import java.time.Duration;
import java.time.Instant;
import lombok.Data;

@Data
public class RestResponseData {
  private int statusCode;
  /** Time from send until the response headers arrived. */
  private Duration responseTime;
  private Instant completedAt;
}

package com.mk.fx.qa.loadster.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one completed call.
 *
 * @param status HTTP status code of the response, whatever its class
 * @param latency time from request start until the response headers were received
 * @param timestamp instant the call completed
 */
public record Sample(int status, Duration latency, Instant timestamp) {

  public Sample {
    Objects.requireNonNull(latency, "latency");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /** True for 2xx responses. */
  @JsonIgnore
  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }
}

package com.mk.fx.qa.loadster.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Inbound description of a run, as received over HTTP or assembled from command-line options.
 * Missing values fall back to the configured defaults.
 */
@Data
public class LoadTestRequest {

  @NotBlank(message = "url is required")
  private String url;

  /** GET, POST, PUT, DELETE or PATCH, case-insensitive; defaults to GET. */
  private String method;

  @Min(value = 1, message = "concurrency must be at least 1")
  private Integer concurrency;

  /** Per-call timeout such as {@code 30}, {@code 500ms}, {@code 5s} or {@code 1m}; bare numbers are seconds. */
  private String timeout;

  /** Raw {@code "Name: Value"} headers; entries without a colon are ignored. */
  private List<String> headers = new ArrayList<>();

  private String body;
}

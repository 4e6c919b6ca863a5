package com.mk.fx.qa.loadster.model;

import com.mk.fx.qa.loadster.rest.Header;
import com.mk.fx.qa.loadster.rest.HttpMethod;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one load run, shared by all of its workers.
 *
 * @param url absolute target URL
 * @param method HTTP method issued by every worker
 * @param headers extra headers, applied in order after the {@code User-Agent} header
 * @param body optional request body, sent only for methods that carry one
 * @param timeout deadline for each individual call
 * @param concurrency number of workers, each issuing exactly one call
 */
public record RequestSpec(
    String url,
    HttpMethod method,
    List<Header> headers,
    String body,
    Duration timeout,
    int concurrency) {

  public RequestSpec {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(timeout, "timeout");
    headers = headers == null ? List.of() : List.copyOf(headers);
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1 but was " + concurrency);
    }
  }
}

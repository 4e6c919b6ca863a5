package com.mk.fx.qa.loadster.resource;

import com.mk.fx.qa.loadster.cfg.LoadsterCfg;
import com.mk.fx.qa.loadster.dto.LoadTestRequest;
import com.mk.fx.qa.loadster.model.RequestSpec;
import com.mk.fx.qa.loadster.rest.Headers;
import com.mk.fx.qa.loadster.rest.HttpMethod;
import com.mk.fx.qa.loadster.utils.LoadUtils;
import java.net.URI;
import java.net.URISyntaxException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Validates an inbound {@link LoadTestRequest} and turns it into a {@link RequestSpec}. */
@Component
@RequiredArgsConstructor
public class LoadTestRequestMapper {

  private final LoadsterCfg cfg;

  /**
   * @throws IllegalArgumentException if the URL, method, timeout or concurrency is invalid
   */
  public RequestSpec toSpec(LoadTestRequest request) {
    var url = validateUrl(request.getUrl());
    var method =
        request.getMethod() == null || request.getMethod().isBlank()
            ? HttpMethod.GET
            : HttpMethod.fromValue(request.getMethod());
    var timeout =
        request.getTimeout() == null || request.getTimeout().isBlank()
            ? cfg.getDefaultTimeout()
            : LoadUtils.parseDuration(request.getTimeout());
    var concurrency =
        request.getConcurrency() != null ? request.getConcurrency() : cfg.getDefaultConcurrency();

    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be at least 1");
    }
    if (concurrency > cfg.getMaxConcurrency()) {
      throw new IllegalArgumentException(
          "concurrency " + concurrency + " exceeds the configured maximum of " + cfg.getMaxConcurrency());
    }

    return new RequestSpec(
        url, method, Headers.parse(request.getHeaders()), request.getBody(), timeout, concurrency);
  }

  private String validateUrl(String url) {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("url is required");
    }
    var trimmed = url.trim();
    try {
      var uri = new URI(trimmed);
      var scheme = uri.getScheme();
      if (!uri.isAbsolute()
          || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
          || uri.getHost() == null) {
        throw new IllegalArgumentException("url must be an absolute http(s) URL: " + url);
      }
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("url is not a valid URL: " + url, e);
    }
    return trimmed;
  }
}

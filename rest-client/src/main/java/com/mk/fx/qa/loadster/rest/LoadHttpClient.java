package com.mk.fx.qa.loadster.rest;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client used by a single load run. One instance is shared by every worker of the run: the
 * underlying {@link HttpClient} and the prepared {@link HttpRequest} are both immutable. This
 * implementation does not include retry logic.
 */
@Slf4j
public class LoadHttpClient {

  /** Identifying header added to every request ahead of the caller's headers. */
  public static final String USER_AGENT = "User-Agent";

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Deadline applied to each request, also used as the connect timeout. */
  private final Duration requestTimeout;

  /** Value sent as the {@code User-Agent} header. */
  private final String userAgent;

  /**
   * Constructs a client whose connect timeout and per-request deadline are both {@code
   * requestTimeout}.
   *
   * @param requestTimeout per-request deadline, must be positive
   * @param userAgent value of the identifying {@code User-Agent} header
   * @throws IllegalArgumentException if the timeout is not positive or the user agent is blank
   */
  public LoadHttpClient(Duration requestTimeout, String userAgent) {
    Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("Request timeout must be positive but was " + requestTimeout);
    }
    if (userAgent == null || userAgent.isBlank()) {
      throw new IllegalArgumentException("User agent cannot be blank");
    }
    this.requestTimeout = requestTimeout;
    this.userAgent = userAgent;
    this.httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();

    log.debug("LoadHttpClient initialised - Request timeout: {}, User-Agent: {}", requestTimeout, userAgent);
  }

  /**
   * Builds the immutable HTTP request sent by every worker. Headers are added in order after the
   * {@code User-Agent} header; repeated names become multiple values. The body is attached only
   * when the method carries one.
   *
   * @param request the request description
   * @return the prepared request
   * @throws IllegalArgumentException if the URL is not an absolute http(s) URL or a header is
   *     refused by the JDK client
   */
  public HttpRequest prepare(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");
    Objects.requireNonNull(request.getMethod(), "Request method cannot be null");

    var uri = toUri(request.getUrl());
    var builder = HttpRequest.newBuilder().uri(uri).timeout(requestTimeout).header(USER_AGENT, userAgent);

    if (request.getHeaders() != null) {
      for (Header header : request.getHeaders()) {
        builder.header(header.name(), header.value());
      }
    }

    var method = request.getMethod();
    if (request.getBody() != null && method.carriesBody()) {
      builder.method(method.name(), HttpRequest.BodyPublishers.ofString(request.getBody()));
    } else {
      if (request.getBody() != null) {
        log.warn("Ignoring request body for {} request to {}", method, uri);
      }
      builder.method(method.name(), HttpRequest.BodyPublishers.noBody());
    }
    return builder.build();
  }

  /**
   * Sends a prepared request and waits for its response headers. The response time runs from the
   * moment the request is handed to the client until the headers arrive; the body is never read and
   * its stream is closed straight away, so a slow body cannot hold the call past its timeout.
   *
   * @param httpRequest request obtained from {@link #prepare(Request)}
   * @return status code, response time and completion instant
   * @throws RestClientException if no response was received
   */
  public RestResponseData execute(HttpRequest httpRequest) {
    Objects.requireNonNull(httpRequest, "HttpRequest cannot be null");

    var startTime = System.nanoTime();
    try {
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
      var elapsed = Duration.ofNanos(System.nanoTime() - startTime);
      var completedAt = Instant.now();
      closeQuietly(response.body());

      var result = new RestResponseData();
      result.setStatusCode(response.statusCode());
      result.setResponseTime(elapsed);
      result.setCompletedAt(completedAt);

      log.debug("Request completed in {} ms with status {}", elapsed.toMillis(), response.statusCode());
      return result;

    } catch (HttpTimeoutException e) {
      log.debug("Request timed out after {}: {}", requestTimeout, e.getMessage());
      throw new RestClientException("Request timed out after " + requestTimeout + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RestClientException("Request interrupted", e);
    } catch (IOException e) {
      log.debug("Error executing request: {}", e.toString());
      throw new RestClientException("Error executing request: " + e, e);
    }
  }

  /** Abandons the unread body; the connection is dropped rather than drained. */
  private static void closeQuietly(InputStream body) {
    try {
      body.close();
    } catch (IOException e) {
      log.debug("Unable to close response body: {}", e.toString());
    }
  }

  private URI toUri(String url) {
    Objects.requireNonNull(url, "URL cannot be null");
    var trimmed = url.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("URL cannot be empty");
    }
    URI uri = URI.create(trimmed);
    var scheme = uri.getScheme();
    if (!uri.isAbsolute()
        || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
        || uri.getHost() == null) {
      throw new IllegalArgumentException("URL must be an absolute http(s) URL: " + url);
    }
    return uri;
  }
}

package com.mk.fx.qa.loadster.metrics;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import javax.net.ssl.SSLException;

/** Counts network errors by category and keeps a handful of samples. Safe for concurrent workers. */
public final class ErrorTracker {
  private static final int MAX_ERROR_SAMPLES = 5;

  private final AtomicLong totalErrors = new AtomicLong();
  private final Map<String, AtomicLong> errorBreakdown = new ConcurrentHashMap<>();
  private final List<ErrorSample> errorSamples = new CopyOnWriteArrayList<>();

  public void recordFailure(Throwable t) {
    totalErrors.incrementAndGet();
    String key = classifyError(t);
    errorBreakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    if (t != null && errorSamples.size() < MAX_ERROR_SAMPLES) {
      var sample = buildErrorSample(key, t);
      synchronized (errorSamples) {
        if (errorSamples.size() < MAX_ERROR_SAMPLES) errorSamples.add(sample);
      }
    }
  }

  public long totalErrors() {
    return totalErrors.get();
  }

  public Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new HashMap<>();
    for (var e : errorBreakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return Map.copyOf(map);
  }

  public List<ErrorSample> samplesSnapshot() {
    return List.copyOf(errorSamples);
  }

  /** Category of a failed call, decided by the innermost cause. */
  static String classifyError(Throwable t) {
    if (t == null) return "UNKNOWN";
    Throwable root = rootCause(t);
    if (root instanceof HttpTimeoutException) return "HTTP_TIMEOUT";
    if (root instanceof ConnectException) return "CONNECTION_REFUSED";
    if (root instanceof SocketTimeoutException) return "SOCKET_TIMEOUT";
    if (root instanceof UnknownHostException || root instanceof UnresolvedAddressException) {
      return "UNKNOWN_HOST";
    }
    if (root instanceof SSLException) return "SSL_ERROR";
    if (root instanceof InterruptedException) return "INTERRUPTED";
    var name = root.getClass().getSimpleName();
    return name.isBlank() ? root.getClass().getName() : name;
  }

  private static Throwable rootCause(Throwable t) {
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    return rootCause;
  }

  private ErrorSample buildErrorSample(String type, Throwable t) {
    Throwable rootCause = rootCause(t);

    String msg = t.getMessage();
    if (msg == null || msg.equals("null")) {
      msg = rootCause.getMessage();
    }
    if (msg == null || msg.equals("null")) {
      msg = rootCause.getClass().getSimpleName() + " occurred";
    }

    List<String> frames = new ArrayList<>();
    if (rootCause != t) {
      frames.add(
          "ROOT CAUSE: "
              + rootCause.getClass().getSimpleName()
              + " - "
              + (rootCause.getMessage() != null ? rootCause.getMessage() : "no message"));
    }
    frames.add("WRAPPED BY: " + t.getClass().getSimpleName());
    StackTraceElement[] stackTrace = t.getStackTrace();
    int limit = Math.min(5, stackTrace.length);
    for (int i = 0; i < limit; i++) {
      frames.add("  at " + stackTrace[i]);
    }
    return new ErrorSample(type, msg, frames);
  }
}

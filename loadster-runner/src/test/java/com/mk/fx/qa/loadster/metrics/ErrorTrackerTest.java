package com.mk.fx.qa.loadster.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.loadster.rest.RestClientException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.Test;

class ErrorTrackerTest {

  @Test
  void recordFailure_classifiesCommonNetworkErrors_andSamplesCapped() {
    ErrorTracker t = new ErrorTracker();
    t.recordFailure(new ConnectException("refused"));
    t.recordFailure(new SocketTimeoutException("so slow"));
    t.recordFailure(new UnknownHostException("nohost"));
    t.recordFailure(new SSLHandshakeException("ssl"));
    t.recordFailure(new HttpTimeoutException("http timeout"));
    t.recordFailure(new HttpConnectTimeoutException("connect timeout"));
    t.recordFailure(new InterruptedException("stop"));
    t.recordFailure(new IllegalStateException("other"));

    assertEquals(8, t.totalErrors());
    var breakdown = t.breakdownSnapshot();
    assertEquals(1L, breakdown.get("CONNECTION_REFUSED"));
    assertEquals(1L, breakdown.get("SOCKET_TIMEOUT"));
    assertEquals(1L, breakdown.get("UNKNOWN_HOST"));
    assertEquals(1L, breakdown.get("SSL_ERROR"));
    assertEquals(2L, breakdown.get("HTTP_TIMEOUT"));
    assertEquals(1L, breakdown.get("INTERRUPTED"));
    assertEquals(1L, breakdown.get("IllegalStateException"));

    assertEquals(5, t.samplesSnapshot().size());
  }

  @Test
  void classifyError_usesRootCause() {
    var wrapped = new RestClientException("Request timed out", new HttpTimeoutException("timed out"));
    assertEquals("HTTP_TIMEOUT", ErrorTracker.classifyError(wrapped));
    assertEquals("UNKNOWN", ErrorTracker.classifyError(null));
  }

  @Test
  void samplesContainRootCauseFrames_whenWrapped() {
    ErrorTracker t = new ErrorTracker();
    t.recordFailure(new RuntimeException("wrapper", new IllegalStateException("cause")));

    var samples = t.samplesSnapshot();
    assertEquals(1, samples.size());
    ErrorSample s = samples.get(0);
    assertEquals("IllegalStateException", s.type());
    assertEquals("wrapper", s.message());
    assertTrue(s.stack().get(0).startsWith("ROOT CAUSE: IllegalStateException"));
  }

  @Test
  void samples_fallBackToRootCauseMessage() {
    ErrorTracker t = new ErrorTracker();
    t.recordFailure(new RuntimeException(null, new ConnectException("Connection refused")));
    assertEquals("Connection refused", t.samplesSnapshot().get(0).message());
  }
}

package com.mk.fx.qa.loadster.processors.rest;

import com.mk.fx.qa.loadster.cfg.LoadsterCfg;
import com.mk.fx.qa.loadster.executors.DispatchResult;
import com.mk.fx.qa.loadster.executors.OneShotExecutor;
import com.mk.fx.qa.loadster.model.RequestSpec;
import com.mk.fx.qa.loadster.model.Sample;
import com.mk.fx.qa.loadster.processors.DispatchSetupException;
import com.mk.fx.qa.loadster.processors.Dispatcher;
import com.mk.fx.qa.loadster.rest.LoadHttpClient;
import com.mk.fx.qa.loadster.rest.Request;
import java.net.http.HttpRequest;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dispatches a run over HTTP: builds one {@link LoadHttpClient} and one prepared request for the
 * run, then lets {@link OneShotExecutor} fire it once per worker.
 */
@Slf4j
@Component
public class HttpDispatcher implements Dispatcher {

  private final LoadsterCfg cfg;

  public HttpDispatcher(LoadsterCfg cfg) {
    this.cfg = cfg;
  }

  @Override
  public DispatchResult dispatch(UUID runId, RequestSpec spec) throws InterruptedException {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(spec, "spec");

    LoadHttpClient client;
    HttpRequest prepared;
    try {
      client = new LoadHttpClient(spec.timeout(), cfg.getUserAgent());
      prepared = client.prepare(toRequest(spec));
    } catch (RuntimeException ex) {
      log.error("Run {} cannot start: {}", runId, ex.getMessage());
      throw new DispatchSetupException("Cannot build HTTP client for run: " + ex.getMessage(), ex);
    }

    log.info(
        "Run {} dispatching {} {} x{} (timeout={}, headers={})",
        runId,
        spec.method(),
        spec.url(),
        spec.concurrency(),
        spec.timeout(),
        spec.headers().size());

    return OneShotExecutor.execute(
        runId,
        spec.concurrency(),
        workerIndex -> {
          var response = client.execute(prepared);
          return new Sample(
              response.getStatusCode(), response.getResponseTime(), response.getCompletedAt());
        });
  }

  private Request toRequest(RequestSpec spec) {
    var request = new Request();
    request.setMethod(spec.method());
    request.setUrl(spec.url());
    request.setHeaders(spec.headers());
    request.setBody(spec.body());
    return request;
  }
}

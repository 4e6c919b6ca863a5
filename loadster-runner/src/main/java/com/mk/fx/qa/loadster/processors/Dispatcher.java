package com.mk.fx.qa.loadster.processors;

import com.mk.fx.qa.loadster.executors.DispatchResult;
import com.mk.fx.qa.loadster.model.RequestSpec;
import java.util.UUID;

public interface Dispatcher {

  /**
   * Issues {@code spec.concurrency()} simultaneous calls and collects one sample per completed call.
   *
   * @throws DispatchSetupException if the client or request cannot be built; no call is made
   * @throws InterruptedException if interrupted while waiting for the workers
   */
  DispatchResult dispatch(UUID runId, RequestSpec spec) throws InterruptedException;
}

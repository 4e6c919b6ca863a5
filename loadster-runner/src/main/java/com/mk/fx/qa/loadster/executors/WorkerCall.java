package com.mk.fx.qa.loadster.executors;

import com.mk.fx.qa.loadster.model.Sample;

/**
 * Callback used by {@link OneShotExecutor} to perform the single call of one worker. Returning a
 * sample records it; throwing drops the worker's sample and counts a network error, while the other
 * workers continue.
 */
@FunctionalInterface
public interface WorkerCall {
  /**
   * Performs the call for the given worker.
   *
   * @param workerIndex zero-based index of the worker
   * @return the sample describing the completed call
   * @throws Exception if no response was obtained
   */
  Sample call(int workerIndex) throws Exception;
}

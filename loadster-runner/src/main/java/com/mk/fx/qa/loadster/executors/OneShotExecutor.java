package com.mk.fx.qa.loadster.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.loadster.metrics.ErrorTracker;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes a "one-shot" load model: a fixed number of workers, all launched up front, each
 * performing exactly one call. Completed calls are appended to a shared {@link SampleCollector};
 * failed calls contribute no sample and are recorded in an {@link ErrorTracker}. No call is retried
 * and no worker failure stops the others.
 *
 * <p>Threading: Creates a fixed thread pool sized to the number of workers so every worker has its
 * own thread. Workers wait on a start gate that opens once all of them have been submitted.
 */
@Slf4j
public final class OneShotExecutor {

  private OneShotExecutor() {
    throw new UnsupportedOperationException("OneShotExecutor cannot be instantiated");
  }

  /**
   * Runs a one-shot execution and blocks until every worker has finished.
   *
   * @param runId run identifier used for thread names and logs
   * @param workers number of workers, at least 1
   * @param call callback performing the call of one worker
   * @return collected samples plus failure accounting
   * @throws InterruptedException if interrupted while waiting; outstanding workers are cancelled
   */
  public static DispatchResult execute(UUID runId, int workers, WorkerCall call)
      throws InterruptedException {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(call, "call");
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1 but was " + workers);
    }

    var collector = new SampleCollector(workers);
    var errors = new ErrorTracker();
    var startGate = new CountDownLatch(1);

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("loadster-worker-" + runId + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    var executor = newFixedThreadPool(workers, threadFactory);
    List<Future<?>> futures = new ArrayList<>(workers);
    Instant startedAt;

    try {
      log.info("Run {} launching {} workers", runId, workers);
      try {
        for (int workerIndex = 0; workerIndex < workers; workerIndex++) {
          final var currentWorker = workerIndex;
          futures.add(
              executor.submit(() -> runWorker(runId, currentWorker, startGate, call, collector, errors)));
        }
      } finally {
        startedAt = Instant.now();
        startGate.countDown();
      }
      waitForWorkers(futures);
    } finally {
      executor.shutdownNow();
      try {
        executor.awaitTermination(30, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw interrupted;
      }
    }

    var finishedAt = Instant.now();
    var samples = collector.snapshot();
    log.info(
        "Run {} finished: workers={} completed={} networkErrors={}",
        runId,
        workers,
        samples.size(),
        errors.totalErrors());

    return new DispatchResult(
        samples,
        workers,
        errors.totalErrors(),
        errors.breakdownSnapshot(),
        errors.samplesSnapshot(),
        startedAt,
        finishedAt);
  }

  /** Performs the single call of one worker once the start gate opens. */
  private static void runWorker(
      UUID runId,
      int workerIndex,
      CountDownLatch startGate,
      WorkerCall call,
      SampleCollector collector,
      ErrorTracker errors) {
    try {
      startGate.await();
      var sample = call.call(workerIndex);
      collector.append(sample);
      log.debug("Run {} worker {} status {} in {} ms", runId, workerIndex, sample.status(), sample.latency().toMillis());
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      errors.recordFailure(interrupted);
      log.warn("Run {} worker {} interrupted before completing its call", runId, workerIndex);
    } catch (Exception ex) {
      errors.recordFailure(ex);
      log.warn("Run {} worker {} request failed: {}", runId, workerIndex, ex.getMessage());
    }
  }

  /** Waits for every submitted worker; there is no run-level deadline. */
  private static void waitForWorkers(List<Future<?>> futures) throws InterruptedException {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (ExecutionException ex) {
        throw new IllegalStateException("Worker terminated abnormally", ex.getCause());
      }
    }
  }
}

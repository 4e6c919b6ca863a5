package com.mk.fx.qa.loadster.executors;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.loadster.model.Sample;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sample set shared by the workers of one run. Appends happen under a single lock that is released
 * right after each append; the collected samples are read once every worker has finished.
 */
public final class SampleCollector {

  private final ReentrantLock lock = new ReentrantLock();
  private final List<Sample> samples;

  // exclusion detector, updated without relying on the lock it observes
  private final AtomicInteger writersInside = new AtomicInteger();
  private final AtomicInteger peakWriters = new AtomicInteger();

  public SampleCollector(int expectedSize) {
    this.samples = new ArrayList<>(Math.max(0, expectedSize));
  }

  public void append(Sample sample) {
    Objects.requireNonNull(sample, "sample");
    lock.lock();
    try {
      peakWriters.accumulateAndGet(writersInside.incrementAndGet(), Math::max);
      samples.add(sample);
      writersInside.decrementAndGet();
    } finally {
      lock.unlock();
    }
  }

  /** Immutable copy of the samples appended so far. */
  public List<Sample> snapshot() {
    lock.lock();
    try {
      return List.copyOf(samples);
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return samples.size();
    } finally {
      lock.unlock();
    }
  }

  /** Highest number of writers ever observed inside the append critical section at once. */
  @VisibleForTesting
  int peakWriters() {
    return peakWriters.get();
  }
}

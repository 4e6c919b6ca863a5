package com.mk.fx.qa.loadster.metrics;

import java.util.List;

/**
 * A representative network error kept for the run report.
 *
 * @param type error category, see {@link ErrorTracker}
 * @param message best available message
 * @param stack abbreviated stack, root cause first
 */
public record ErrorSample(String type, String message, List<String> stack) {

  public ErrorSample {
    stack = stack == null ? List.of() : List.copyOf(stack);
  }
}

package org.ratewatch.currency.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ratewatch.currency.exception.DependencyException;

/**
 * Runs a cache write-back or invalidation whose failure must not fail the request.
 *
 * <p>Only {@link DependencyException}s are absorbed. They are logged at WARN and returned in the
 * {@link Outcome}; anything else propagates.
 */
public final class BestEffort {

  private static final Logger log = LoggerFactory.getLogger(BestEffort.class);

  private BestEffort() {}

  public static Outcome attempt(String operation, Runnable action) {
    try {
      action.run();
      return new Outcome(operation, null);
    } catch (DependencyException e) {
      log.warn("Best-effort {} failed: {}", operation, e.getMessage(), e);
      return new Outcome(operation, e);
    }
  }

  /** Result of a best-effort operation. {@code failure} is null when it succeeded. */
  public record Outcome(String operation, DependencyException failure) {

    public boolean succeeded() {
      return failure == null;
    }
  }
}

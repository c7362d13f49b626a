package com.onthegomap.terrainpack.fetch;

import java.time.Duration;

/**
 * How many times to attempt a request and how long to wait between attempts.
 *
 * @param maxAttempts total attempts including the first
 * @param baseDelay   wait before the second attempt
 * @param multiplier  factor each successive wait grows by
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
    }
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative: " + baseDelay);
    }
    if (multiplier < 1) {
      throw new IllegalArgumentException("multiplier must be at least 1: " + multiplier);
    }
  }

  /** Returns the wait after failed attempt number {@code attempt}, counting from 1. */
  public Duration delayAfterAttempt(int attempt) {
    double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
    return Duration.ofNanos((long) (baseDelay.toNanos() * factor));
  }
}

package io.filesurf.retrywork;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bounds a retry sequence either by a number of attempts or by a wall-clock deadline.
 *
 * <p>A policy is an immutable description. Every invocation of the executor calls {@link
 * #start(Clock)} to obtain a fresh {@link Budget} that tracks the sequence in progress.
 */
public interface StoppingPolicy {

  int DEFAULT_MAX_ATTEMPTS = 2;

  /** Starts tracking a new retry sequence. Called once, before the first attempt. */
  Budget start(Clock clock);

  /** Per-invocation state of a stopping policy. */
  interface Budget {

    /**
     * Records a retryable failure and tells whether another attempt is permitted.
     *
     * @return {@code true} if the operation may be attempted again
     */
    boolean permitsRetry();
  }

  /** Policy allowing {@link #DEFAULT_MAX_ATTEMPTS} attempts. */
  static StoppingPolicy defaults() {
    return attempts(DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * Policy allowing at most {@code maxAttempts} attempts, the first one included.
   *
   * @throws IllegalArgumentException if {@code maxAttempts < 1}
   */
  static StoppingPolicy attempts(int maxAttempts) {
    return new MaxAttempts(maxAttempts);
  }

  /**
   * Policy allowing retries until {@code timeout} has elapsed since the invocation started.
   *
   * @throws IllegalArgumentException if {@code timeout} is negative
   */
  static StoppingPolicy deadline(Duration timeout) {
    return new Deadline(timeout);
  }

  record MaxAttempts(int maxAttempts) implements StoppingPolicy {

    public MaxAttempts {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
      }
    }

    @Override
    public Budget start(Clock clock) {
      int[] remaining = {maxAttempts};
      return () -> --remaining[0] > 0;
    }

    @Override
    public String toString() {
      return "attempts(" + maxAttempts + ")";
    }
  }

  record Deadline(Duration timeout) implements StoppingPolicy {

    public Deadline {
      Objects.requireNonNull(timeout, "timeout");
      if (timeout.isNegative()) {
        throw new IllegalArgumentException("timeout must not be negative, got " + timeout);
      }
    }

    @Override
    public Budget start(Clock clock) {
      Instant startTime = clock.instant();
      // Compares elapsed time; startTime.plus(timeout) overflows for very large timeouts.
      // Checked only between attempts, an attempt in flight runs to completion.
      return () -> Duration.between(startTime, clock.instant()).compareTo(timeout) <= 0;
    }

    @Override
    public String toString() {
      return "deadline(" + timeout + ")";
    }
  }
}

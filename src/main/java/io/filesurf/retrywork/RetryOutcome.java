package io.filesurf.retrywork;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a retried invocation: either the value produced by the successful attempt or the
 * failure surfaced when no further attempt was permitted.
 *
 * @param <T> type of the produced value; {@code Void} for actions
 */
public final class RetryOutcome<T> {

  private final T value;
  private final Exception failure;
  private final int attempts;

  private RetryOutcome(T value, Exception failure, int attempts) {
    this.value = value;
    this.failure = failure;
    this.attempts = attempts;
  }

  static <T> RetryOutcome<T> success(T value, int attempts) {
    return new RetryOutcome<>(value, null, attempts);
  }

  static <T> RetryOutcome<T> failure(Exception failure, int attempts) {
    return new RetryOutcome<>(null, Objects.requireNonNull(failure, "failure"), attempts);
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public boolean isFailure() {
    return failure != null;
  }

  /** Number of times the operation was invoked. */
  public int attempts() {
    return attempts;
  }

  /**
   * Value of the successful attempt, which may be {@code null}.
   *
   * @throws IllegalStateException if the invocation failed
   */
  public T value() {
    if (failure != null) {
      throw new IllegalStateException("outcome is a failure", failure);
    }
    return value;
  }

  /** The surfaced failure, empty on success. */
  public Optional<Exception> failure() {
    return Optional.ofNullable(failure);
  }

  /** Returns the value, or rethrows the surfaced failure as is. */
  public T getOrThrow() throws Exception {
    if (failure != null) {
      throw failure;
    }
    return value;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "RetryOutcome[success, attempts=" + attempts + ", value=" + value + "]"
        : "RetryOutcome[failure, attempts=" + attempts + ", failure=" + failure + "]";
  }
}

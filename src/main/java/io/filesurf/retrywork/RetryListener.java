package io.filesurf.retrywork;

import java.time.Duration;

/**
 * Observer of retry events. This allows callers to collect metrics or traces without the executor
 * being coupled to a specific monitoring system. All methods default to no-ops.
 *
 * <p>Listeners are notified synchronously on the calling thread. An exception thrown by a listener
 * is logged and ignored; it never changes the outcome of the invocation.
 */
public interface RetryListener {

  /**
   * Called before each attempt.
   *
   * @param attempt the attempt number (1-based)
   */
  default void onAttemptStart(int attempt) {}

  /**
   * Called when a failed attempt will be retried, before the recovery target is reloaded.
   *
   * @param category the failure category of the classifier that accepted the failure
   * @param failure the failure that triggered the retry
   * @param attempt the attempt number that failed
   */
  default void onRetryTriggered(String category, Exception failure, int attempt) {}

  /**
   * Called right before the recovery target is reloaded.
   *
   * @param target the recovery target
   */
  default void onReload(Reloadable target) {}

  /**
   * Called right before the executor blocks for the configured delay.
   *
   * @param delay the delay about to elapse
   */
  default void onWait(Duration delay) {}

  /**
   * Called when the operation is about to be attempted again.
   *
   * @param nextAttempt the number of the upcoming attempt
   */
  default void onRetrying(int nextAttempt) {}

  /**
   * Called when an attempt succeeds.
   *
   * @param attempts total number of attempts made
   */
  default void onSuccess(int attempts) {}

  /**
   * Called when the invocation ends with a failure that is surfaced to the caller.
   *
   * @param attempts total number of attempts made
   * @param failure the surfaced failure
   */
  default void onFinalFailure(int attempts, Exception failure) {}
}

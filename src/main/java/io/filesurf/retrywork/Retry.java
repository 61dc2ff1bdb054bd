package io.filesurf.retrywork;

import java.time.Duration;

/**
 * Shortcuts for one-off retried calls. Each method builds a {@link RetryConfig} and delegates to
 * {@link RetryExecutor}; callers needing reloads, delays or listeners pass a config directly.
 */
public final class Retry {

  private Retry() {}

  /** Retries any failure once (two attempts in total). */
  public static <T> T execute(Operation<T> operation) throws Exception {
    return execute(RetryConfig.defaults(), operation);
  }

  public static <T> T execute(Operation<T> operation, int maxAttempts) throws Exception {
    return execute(RetryConfig.builder().maxAttempts(maxAttempts).build(), operation);
  }

  public static <T> T execute(Operation<T> operation, Duration timeout) throws Exception {
    return execute(RetryConfig.builder().timeout(timeout).build(), operation);
  }

  public static <T> T execute(RetryConfig config, Operation<T> operation) throws Exception {
    return new RetryExecutor(config).execute(operation);
  }

  /** Retries any failure once (two attempts in total). */
  public static void run(Action action) throws Exception {
    run(RetryConfig.defaults(), action);
  }

  public static void run(Action action, int maxAttempts) throws Exception {
    run(RetryConfig.builder().maxAttempts(maxAttempts).build(), action);
  }

  public static void run(Action action, Duration timeout) throws Exception {
    run(RetryConfig.builder().timeout(timeout).build(), action);
  }

  public static void run(RetryConfig config, Action action) throws Exception {
    new RetryExecutor(config).run(action);
  }
}

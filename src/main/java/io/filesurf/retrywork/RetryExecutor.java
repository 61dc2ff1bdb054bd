package io.filesurf.retrywork;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryExecutor {

  private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

  private final RetryConfig config;
  private final Clock clock;

  public RetryExecutor(RetryConfig config) {
    this(config, Clock.systemUTC());
  }

  /**
   * @param config options applied to every invocation
   * @param clock time source for deadline policies
   */
  public RetryExecutor(RetryConfig config, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Invokes {@code operation}, retrying it as configured.
   *
   * @return the value of the first successful attempt
   * @throws Exception the failure of the last attempt, or of the recovery target, unwrapped
   */
  public <T> T execute(Operation<T> operation) throws Exception {
    return attempt(operation).getOrThrow();
  }

  /**
   * Runs {@code action}, retrying it as configured.
   *
   * @throws Exception the failure of the last attempt, or of the recovery target, unwrapped
   */
  public void run(Action action) throws Exception {
    Objects.requireNonNull(action, "action");
    attempt(action.asOperation()).getOrThrow();
  }

  /**
   * Invokes {@code operation}, retrying it as configured, and reports the result as a value
   * instead of throwing the surfaced failure.
   */
  public <T> RetryOutcome<T> attempt(Operation<T> operation) {
    Objects.requireNonNull(operation, "operation");
    StoppingPolicy.Budget budget = config.stoppingPolicy().start(clock);

    int attempt = 0;
    while (true) {
      attempt++;
      int current = attempt;
      LOG.debug("Starting attempt {} ({})", attempt, config.stoppingPolicy());
      notifyListener(listener -> listener.onAttemptStart(current));

      T result;
      try {
        result = operation.call();
      } catch (Exception e) {
        if (!config.classifier().isRetryable(e)) {
          LOG.warn(
              "Non-retryable {} on attempt {}, expected '{}': {}",
              e.getClass().getSimpleName(),
              attempt,
              config.classifier().category(),
              e.getMessage());
          return giveUp(e, attempt);
        }
        if (!budget.permitsRetry()) {
          LOG.warn(
              "Retries exhausted after {} attempts ({}) - final error: {}",
              attempt,
              config.stoppingPolicy(),
              e.getMessage());
          return giveUp(e, attempt);
        }
        try {
          prepareForRetry(e, attempt);
        } catch (Exception prepareFailure) {
          return giveUp(prepareFailure, attempt);
        }
        continue;
      }

      if (attempt > 1) {
        LOG.info("Retry succeeded on attempt {}", attempt);
      } else {
        LOG.debug("Operation succeeded on first attempt");
      }
      notifyListener(listener -> listener.onSuccess(current));
      return RetryOutcome.success(result, attempt);
    }
  }

  private void prepareForRetry(Exception failure, int attempt) throws Exception {
    String category = config.classifier().category();
    LOG.info(
        "Preparing to retry the operation after '{}' was caught: {}",
        failure.getClass().getSimpleName(),
        failure.getMessage());
    notifyListener(listener -> listener.onRetryTriggered(category, failure, attempt));

    Reloadable target = config.recoveryTarget();
    if (target != null) {
      LOG.info("Reloading '{}' instance", target.getClass().getSimpleName());
      notifyListener(listener -> listener.onReload(target));
      try {
        target.reload();
      } catch (Exception reloadFailure) {
        LOG.warn(
            "Reloading '{}' failed, not retrying: {}",
            target.getClass().getSimpleName(),
            reloadFailure.getMessage());
        throw reloadFailure;
      }
    }

    Duration delay = config.delay();
    if (delay != null && !delay.isZero()) {
      LOG.info("Waiting {} before retrying", delay);
      notifyListener(listener -> listener.onWait(delay));
      sleep(delay);
    }

    LOG.info("Retrying the operation (attempt {})", attempt + 1);
    notifyListener(listener -> listener.onRetrying(attempt + 1));
  }

  private <T> RetryOutcome<T> giveUp(Exception failure, int attempts) {
    notifyListener(listener -> listener.onFinalFailure(attempts, failure));
    return RetryOutcome.failure(failure, attempts);
  }

  private static void sleep(Duration delay) {
    try {
      Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new RetryException("Interrupted while waiting to retry", ie);
    }
  }

  private void notifyListener(Consumer<RetryListener> event) {
    RetryListener listener = config.listener();
    if (listener == null) {
      return;
    }
    try {
      event.accept(listener);
    } catch (RuntimeException listenerException) {
      LOG.warn("Retry listener threw exception: {}", listenerException.getMessage());
    }
  }
}

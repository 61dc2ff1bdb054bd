package io.filesurf.retrywork;

import java.time.Duration;

/**
 * Options of a retried invocation. Built once and reused across invocations; immutable.
 *
 * @param classifier which failures are retried
 * @param stoppingPolicy when retrying stops
 * @param recoveryTarget reloaded before every retry, may be {@code null}
 * @param delay waited before every retry, after the reload; may be {@code null}
 * @param listener notified of retry events, may be {@code null}
 */
public record RetryConfig(
    FailureClassifier classifier,
    StoppingPolicy stoppingPolicy,
    Reloadable recoveryTarget,
    Duration delay,
    RetryListener listener) {

  public RetryConfig {
    if (classifier == null) {
      throw new IllegalStateException("classifier is required");
    }
    if (stoppingPolicy == null) {
      throw new IllegalStateException("stoppingPolicy is required");
    }
    if (delay != null && delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative, got " + delay);
    }
    if (delay != null && delay.compareTo(MAX_DELAY) > 0) {
      throw new IllegalArgumentException("delay must not exceed " + MAX_DELAY + ", got " + delay);
    }
  }

  /** Longest delay that can be waited, {@code Long.MAX_VALUE} milliseconds. */
  public static final Duration MAX_DELAY = Duration.ofMillis(Long.MAX_VALUE);

  /** Any failure, {@value StoppingPolicy#DEFAULT_MAX_ATTEMPTS} attempts, no reload, no delay. */
  public static RetryConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized with the options of this config. */
  public Builder toBuilder() {
    return new Builder()
        .classifier(classifier)
        .stoppingPolicy(stoppingPolicy)
        .recoveryTarget(recoveryTarget)
        .delay(delay)
        .listener(listener);
  }

  public static class Builder {
    private FailureClassifier classifier = FailureClassifier.any();
    private StoppingPolicy stoppingPolicy = StoppingPolicy.defaults();
    private Reloadable recoveryTarget;
    private Duration delay;
    private RetryListener listener;

    public Builder classifier(FailureClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /** Retries only failures that are instances of {@code type}. */
    public Builder retryOn(Class<? extends Exception> type) {
      return classifier(FailureClassifier.ofType(type));
    }

    public Builder stoppingPolicy(StoppingPolicy stoppingPolicy) {
      this.stoppingPolicy = stoppingPolicy;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      return stoppingPolicy(StoppingPolicy.attempts(maxAttempts));
    }

    public Builder timeout(Duration timeout) {
      return stoppingPolicy(StoppingPolicy.deadline(timeout));
    }

    public Builder recoveryTarget(Reloadable recoveryTarget) {
      this.recoveryTarget = recoveryTarget;
      return this;
    }

    public Builder delay(Duration delay) {
      this.delay = delay;
      return this;
    }

    public Builder listener(RetryListener listener) {
      this.listener = listener;
      return this;
    }

    public RetryConfig build() {
      return new RetryConfig(classifier, stoppingPolicy, recoveryTarget, delay, listener);
    }
  }
}

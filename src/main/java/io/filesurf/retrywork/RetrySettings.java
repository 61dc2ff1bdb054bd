package io.filesurf.retrywork;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retry options read from a configuration document. Only the options that can be expressed as
 * data live here; the recovery target and listener are added in code through {@link
 * #toConfigBuilder()}.
 *
 * @param maxAttempts attempt limit, exclusive with {@code timeout}
 * @param timeout deadline measured from the start of an invocation, exclusive with {@code
 *     maxAttempts}
 * @param delay wait before every retry
 * @param retryOn fully-qualified names of the retried exception types; empty means any failure
 */
public record RetrySettings(
    Integer maxAttempts, Duration timeout, Duration delay, List<String> retryOn) {

  public RetrySettings {
    if (maxAttempts != null && timeout != null) {
      throw new IllegalArgumentException("maxAttempts and timeout are mutually exclusive");
    }
    retryOn = retryOn == null ? List.of() : List.copyOf(retryOn);
  }

  public StoppingPolicy stoppingPolicy() {
    if (timeout != null) {
      return StoppingPolicy.deadline(timeout);
    }
    if (maxAttempts != null) {
      return StoppingPolicy.attempts(maxAttempts);
    }
    return StoppingPolicy.defaults();
  }

  /** Resolves {@link #retryOn()} with the given class loader. */
  public FailureClassifier classifier(ClassLoader classLoader) {
    if (retryOn.isEmpty()) {
      return FailureClassifier.any();
    }
    List<Class<? extends Exception>> types = new ArrayList<>();
    for (String name : retryOn) {
      types.add(loadExceptionType(name, classLoader));
    }
    return new FailureClassifier.TypeClassifier(types);
  }

  public RetryConfig.Builder toConfigBuilder() {
    return RetryConfig.builder()
        .classifier(classifier(defaultClassLoader()))
        .stoppingPolicy(stoppingPolicy())
        .delay(delay);
  }

  /** Context class loader of the current thread, or the library's own loader when unset. */
  static ClassLoader defaultClassLoader() {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    return classLoader != null ? classLoader : RetrySettings.class.getClassLoader();
  }

  private static Class<? extends Exception> loadExceptionType(
      String name, ClassLoader classLoader) {
    Class<?> type;
    try {
      type = Class.forName(name, false, classLoader);
    } catch (ClassNotFoundException e) {
      throw new IllegalArgumentException("Unknown exception type in retryOn: " + name, e);
    }
    if (!Exception.class.isAssignableFrom(type)) {
      throw new IllegalArgumentException("Not an exception type in retryOn: " + name);
    }
    return type.asSubclass(Exception.class);
  }
}

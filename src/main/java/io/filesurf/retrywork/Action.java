package io.filesurf.retrywork;

/** A unit of work that produces no value and may fail. */
@FunctionalInterface
public interface Action {

  void run() throws Exception;

  /** Adapts this action to an {@link Operation} that yields {@code null} on success. */
  default Operation<Void> asOperation() {
    return () -> {
      run();
      return null;
    };
  }
}

package io.filesurf.retrywork;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Decides whether a failure raised by an operation is eligible for retry.
 *
 * <p>Type-based classifiers match like a {@code catch} clause: a failure matches when it is an
 * instance of one of the configured types, subtypes included.
 */
public interface FailureClassifier {

  /** Returns {@code true} when the given failure may be retried. */
  boolean isRetryable(Exception failure);

  /** Name of the failure category this classifier accepts, used in log messages and events. */
  String category();

  /** Classifier accepting every failure. */
  static FailureClassifier any() {
    return TypeClassifier.ANY;
  }

  /** Classifier accepting failures that are instances of {@code type}. */
  static FailureClassifier ofType(Class<? extends Exception> type) {
    Objects.requireNonNull(type, "type");
    return new TypeClassifier(List.of(type));
  }

  /** Classifier accepting failures that are instances of any of {@code types}. */
  @SafeVarargs
  static FailureClassifier anyOf(Class<? extends Exception>... types) {
    if (types.length == 0) {
      throw new IllegalArgumentException("at least one failure type is required");
    }
    return new TypeClassifier(List.of(types));
  }

  /**
   * Classifier backed by an arbitrary predicate.
   *
   * @param category name reported for failures accepted by the predicate
   * @param predicate the retry decision
   */
  static FailureClassifier matching(
      String category, Predicate<? super Exception> predicate) {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(predicate, "predicate");
    return new FailureClassifier() {
      @Override
      public boolean isRetryable(Exception failure) {
        return predicate.test(failure);
      }

      @Override
      public String category() {
        return category;
      }

      @Override
      public String toString() {
        return "FailureClassifier[" + category + "]";
      }
    };
  }

  /** Matches by exception type. */
  final class TypeClassifier implements FailureClassifier {

    static final TypeClassifier ANY = new TypeClassifier(List.of(Exception.class));

    private final List<Class<? extends Exception>> types;

    TypeClassifier(List<Class<? extends Exception>> types) {
      this.types = List.copyOf(types);
    }

    @Override
    public boolean isRetryable(Exception failure) {
      return types.stream().anyMatch(type -> type.isInstance(failure));
    }

    @Override
    public String category() {
      return types.stream().map(Class::getSimpleName).collect(Collectors.joining(" | "));
    }

    @Override
    public String toString() {
      return "FailureClassifier" + Arrays.toString(types.stream().map(Class::getName).toArray());
    }
  }
}

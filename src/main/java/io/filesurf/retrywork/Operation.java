package io.filesurf.retrywork;

/**
 * A unit of work that produces a value and may fail.
 *
 * @param <T> the type of the produced value
 */
@FunctionalInterface
public interface Operation<T> {

  T call() throws Exception;
}

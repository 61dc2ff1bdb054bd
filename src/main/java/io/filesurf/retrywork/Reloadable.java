package io.filesurf.retrywork;

/**
 * Capability of an object whose state or configuration can be re-initialized between attempts.
 *
 * <p>The executor calls {@link #reload()} once before every retry, ahead of the configured delay.
 * The target may be the very object whose operation is retried, or an unrelated collaborator.
 * The executor never creates or disposes it.
 */
@FunctionalInterface
public interface Reloadable {

  /**
   * Re-initializes the reloadable state.
   *
   * @throws Exception if reloading fails; the failure ends the retry sequence and is surfaced to
   *     the caller in place of the failure that triggered the retry
   */
  void reload() throws Exception;
}

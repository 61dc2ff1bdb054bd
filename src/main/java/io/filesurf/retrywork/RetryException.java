package io.filesurf.retrywork;

/**
 * Exception raised by the retry executor itself. Failures of the retried operation and of the
 * recovery target are never wrapped in this type; they reach the caller unchanged. This exception
 * only reports conditions that belong to the executor, such as the calling thread being
 * interrupted while waiting between attempts.
 */
public class RetryException extends RuntimeException {

  /**
   * Constructs a new RetryException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of this exception
   */
  public RetryException(String message, Throwable cause) {
    super(message, cause);
  }
}

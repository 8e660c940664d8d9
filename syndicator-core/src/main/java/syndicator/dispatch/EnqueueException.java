package syndicator.dispatch;

/**
 * Unchecked exception thrown when jobs cannot be written to the job store.
 */
public final class EnqueueException extends RuntimeException {
  public EnqueueException(String message, Throwable cause) {
    super(message, cause);
  }
}

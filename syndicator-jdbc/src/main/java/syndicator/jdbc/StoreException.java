package syndicator.jdbc;

/**
 * Unchecked exception wrapping JDBC and serialization errors thrown by the JDBC ledger and
 * job stores.
 */
public final class StoreException extends RuntimeException {
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

package syndicator.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for job queue operations (enqueue, status updates, polling).
 *
 * <p>Callers are responsible for closing the returned connection.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}

package eventsource.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to relational event and snapshot stores.
 *
 * <p>Stores acquire one connection per logical operation and close it when the
 * operation completes; connections are never shared between concurrent operations.
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}

/**
 * JDBC implementations of {@link syndicator.spi.JobStore}.
 *
 * @see syndicator.jdbc.store.JdbcJobStores
 */
package syndicator.jdbc.store;

/**
 * JDBC persistence for the ledger and the job queues, with H2 and PostgreSQL support.
 *
 * <p>Schemas live on the classpath under {@code db/syndicator-<name>.sql}.
 */
package syndicator.jdbc;

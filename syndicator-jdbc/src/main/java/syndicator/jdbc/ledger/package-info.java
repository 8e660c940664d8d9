/**
 * JDBC implementations of {@link syndicator.ledger.Ledger}.
 *
 * @see syndicator.jdbc.ledger.JdbcLedgers
 */
package syndicator.jdbc.ledger;

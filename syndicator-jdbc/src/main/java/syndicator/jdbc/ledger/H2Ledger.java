package syndicator.jdbc.ledger;

import syndicator.spi.ConnectionProvider;

import java.time.Clock;
import java.util.List;

/**
 * H2 ledger. Primarily for testing.
 *
 * <p>Uses the portable update-then-insert upserts from {@link AbstractJdbcLedger}.
 */
public final class H2Ledger extends AbstractJdbcLedger {

  public H2Ledger() {
    super();
  }

  public H2Ledger(ConnectionProvider connectionProvider) {
    this(connectionProvider, Clock.systemUTC());
  }

  public H2Ledger(ConnectionProvider connectionProvider, Clock clock) {
    super(connectionProvider, clock);
  }

  @Override
  public AbstractJdbcLedger withConnectionProvider(ConnectionProvider connectionProvider, Clock clock) {
    return new H2Ledger(connectionProvider, clock);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}

package syndicator.jdbc.ledger;

import syndicator.jdbc.DataSourceConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC ledgers with auto-detection support.
 *
 * <p>Ledgers are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/syndicator.jdbc.ledger.AbstractJdbcLedger}. The registered
 * instances are unbound; {@link #detect(DataSource)} and {@link #forDataSource} return
 * ledgers bound to the data source.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Ledger ledger = JdbcLedgers.forDataSource(dataSource);
 * AbstractJdbcLedger pg = JdbcLedgers.get("postgresql").withConnectionProvider(provider);
 * }</pre>
 */
public final class JdbcLedgers {

  private static final List<AbstractJdbcLedger> LEDGERS;
  private static final Map<String, AbstractJdbcLedger> BY_NAME = new ConcurrentHashMap<>();

  static {
    LEDGERS = ServiceLoader.load(AbstractJdbcLedger.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcLedger ledger : LEDGERS) {
      BY_NAME.put(ledger.name().toLowerCase(Locale.ROOT), ledger);
    }
  }

  private JdbcLedgers() {
  }

  /** Returns all registered (unbound) ledgers. */
  public static List<AbstractJdbcLedger> all() {
    return LEDGERS;
  }

  /**
   * Gets an unbound ledger by name.
   *
   * @param name ledger name (case-insensitive)
   * @throws IllegalArgumentException if no ledger is registered under that name
   */
  public static AbstractJdbcLedger get(String name) {
    AbstractJdbcLedger ledger = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (ledger == null) {
      throw new IllegalArgumentException("Unknown ledger: " + name + ". Available: " + BY_NAME.keySet());
    }
    return ledger;
  }

  /**
   * Detects the database of {@code dataSource} and returns a ledger bound to it.
   *
   * @throws IllegalStateException if the URL cannot be read
   */
  public static AbstractJdbcLedger forDataSource(DataSource dataSource) {
    return forDataSource(dataSource, Clock.systemUTC());
  }

  public static AbstractJdbcLedger forDataSource(DataSource dataSource, Clock clock) {
    return detect(dataSource).withConnectionProvider(new DataSourceConnectionProvider(dataSource), clock);
  }

  /**
   * Auto-detects the (unbound) ledger from a DataSource.
   *
   * @throws IllegalStateException if detection fails
   */
  public static AbstractJdbcLedger detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect ledger from DataSource", e);
    }
  }

  /**
   * Auto-detects the (unbound) ledger from a JDBC URL.
   *
   * @throws IllegalArgumentException if no ledger matches
   */
  public static AbstractJdbcLedger detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcLedger ledger : LEDGERS) {
      for (String prefix : ledger.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return ledger;
        }
      }
    }
    throw new IllegalArgumentException("No ledger found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + LEDGERS.stream().flatMap(l -> l.jdbcUrlPrefixes().stream()).toList());
  }
}

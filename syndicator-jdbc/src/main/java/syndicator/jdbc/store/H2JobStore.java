package syndicator.jdbc.store;

import syndicator.spi.PayloadCodec;

import java.util.List;

/**
 * H2 job store. Primarily for testing.
 *
 * <p>H2 keeps a transaction usable after a failed statement, so the plain insert from
 * {@link AbstractJdbcJobStore} is safe inside transactions.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(String tableName, PayloadCodec payloadCodec) {
    super(tableName, payloadCodec);
  }

  @Override
  public AbstractJdbcJobStore with(String tableName, PayloadCodec payloadCodec) {
    return new H2JobStore(tableName, payloadCodec);
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

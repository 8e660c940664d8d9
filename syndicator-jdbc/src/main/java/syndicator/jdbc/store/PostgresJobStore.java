package syndicator.jdbc.store;

import syndicator.jdbc.JdbcTemplate;
import syndicator.model.Job;
import syndicator.spi.PayloadCodec;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL job store.
 *
 * <p>Inserts with {@code ON CONFLICT DO NOTHING}: a failed statement would abort the
 * surrounding transaction of a deferral.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String tableName, PayloadCodec payloadCodec) {
    super(tableName, payloadCodec);
  }

  @Override
  public AbstractJdbcJobStore with(String tableName, PayloadCodec payloadCodec) {
    return new PostgresJobStore(tableName, payloadCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean insertIfAbsent(Connection conn, Job job) {
    return JdbcTemplate.update(conn, insertSql() + " ON CONFLICT (job_key) DO NOTHING", insertParams(job)) > 0;
  }
}

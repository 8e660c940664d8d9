package syndicator.jdbc.ledger;

import syndicator.jdbc.JdbcTemplate;
import syndicator.ledger.PublishStatus;
import syndicator.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL ledger.
 *
 * <p>Uses {@code INSERT ... ON CONFLICT} for single-statement upserts and
 * {@code RETURNING} for the counter increment.
 */
public final class PostgresLedger extends AbstractJdbcLedger {

  public PostgresLedger() {
    super();
  }

  public PostgresLedger(ConnectionProvider connectionProvider) {
    this(connectionProvider, Clock.systemUTC());
  }

  public PostgresLedger(ConnectionProvider connectionProvider, Clock clock) {
    super(connectionProvider, clock);
  }

  @Override
  public AbstractJdbcLedger withConnectionProvider(ConnectionProvider connectionProvider, Clock clock) {
    return new PostgresLedger(connectionProvider, clock);
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
  protected void insertSeen(Connection conn, String sourceId, String contentCid, Instant createdAt) {
    JdbcTemplate.update(conn,
        "INSERT INTO source_item (source_id, content_cid, created_at, seen_at, deleted_at) VALUES (?,?,?,?,NULL)"
            + " ON CONFLICT (source_id) DO UPDATE SET deleted_at = NULL",
        sourceId, contentCid, Timestamp.from(createdAt), now());
  }

  @Override
  protected void upsertRecord(Connection conn, String sourceId, String target, PublishStatus status,
      String remoteIdsJson, String remoteUrl, String error) {
    JdbcTemplate.update(conn,
        "INSERT INTO publish_record (source_id, target, status, remote_ids, remote_url, error, updated_at)"
            + " VALUES (?,?,?,?,?,?,?)"
            + " ON CONFLICT (source_id, target) DO UPDATE SET status=EXCLUDED.status,"
            + " remote_ids=EXCLUDED.remote_ids, remote_url=EXCLUDED.remote_url, error=EXCLUDED.error,"
            + " updated_at=EXCLUDED.updated_at",
        sourceId, target, status.code(), remoteIdsJson, remoteUrl, error, now());
  }

  @Override
  protected int incrementCount(Connection conn, String target, String dayKey, int by) {
    return JdbcTemplate.updateReturning(conn,
        "INSERT INTO budget_counter (target, day_key, post_count) VALUES (?,?,?)"
            + " ON CONFLICT (target, day_key) DO UPDATE SET post_count=budget_counter.post_count+EXCLUDED.post_count"
            + " RETURNING post_count",
        rs -> rs.getInt(1), target, dayKey, by).get(0);
  }
}

package syndicator.jdbc.ledger;

import syndicator.jdbc.JdbcTemplate;
import syndicator.jdbc.JsonSupport;
import syndicator.jdbc.StoreException;
import syndicator.ledger.Ledger;
import syndicator.ledger.LedgerEntry;
import syndicator.ledger.PublishRecord;
import syndicator.ledger.PublishStatus;
import syndicator.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base JDBC ledger over the {@code source_item}, {@code publish_record} and
 * {@code budget_counter} tables.
 *
 * <p>Every call runs on its own connection. Upserts use the portable update-then-insert
 * pattern, retrying the update when a concurrent insert wins the primary key; subclasses
 * override them with native upsert syntax where available.
 *
 * <p>Instances registered via {@code META-INF/services/syndicator.jdbc.ledger.AbstractJdbcLedger}
 * are unbound prototypes; {@link #withConnectionProvider} returns a usable copy.
 *
 * @see JdbcLedgers
 */
public abstract class AbstractJdbcLedger implements Ledger {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final JdbcTemplate.RowMapper<LedgerEntry> ENTRY_ROW_MAPPER = rs -> new LedgerEntry(
      rs.getString("source_id"),
      rs.getString("content_cid"),
      toInstant(rs.getTimestamp("created_at")),
      toInstant(rs.getTimestamp("seen_at")),
      toInstant(rs.getTimestamp("deleted_at")));

  protected static final JdbcTemplate.RowMapper<PublishRecord> RECORD_ROW_MAPPER = rs -> new PublishRecord(
      rs.getString("source_id"),
      rs.getString("target"),
      PublishStatus.fromCode(rs.getInt("status")),
      JsonSupport.readIds(rs.getString("remote_ids")),
      rs.getString("remote_url"),
      rs.getString("error"),
      toInstant(rs.getTimestamp("updated_at")));

  private final ConnectionProvider connectionProvider;
  private final Clock clock;

  protected AbstractJdbcLedger() {
    this(null, Clock.systemUTC());
  }

  protected AbstractJdbcLedger(ConnectionProvider connectionProvider, Clock clock) {
    this.connectionProvider = connectionProvider;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Unique identifier of this ledger (e.g. "postgresql", "h2"). */
  public abstract String name();

  /** JDBC URL prefixes this ledger handles. */
  public abstract List<String> jdbcUrlPrefixes();

  /** Copy of this ledger bound to {@code connectionProvider}. */
  public abstract AbstractJdbcLedger withConnectionProvider(ConnectionProvider connectionProvider, Clock clock);

  public AbstractJdbcLedger withConnectionProvider(ConnectionProvider connectionProvider) {
    return withConnectionProvider(connectionProvider, Clock.systemUTC());
  }

  protected Clock clock() {
    return clock;
  }

  protected Timestamp now() {
    return Timestamp.from(clock.instant());
  }

  // ── Source items ────────────────────────────────────────────────

  @Override
  public boolean hasSeen(String sourceId) {
    return withConnection(conn -> !JdbcTemplate.query(conn,
        "SELECT 1 FROM source_item WHERE source_id=?", rs -> 1, sourceId).isEmpty());
  }

  @Override
  public void markSeen(String sourceId, String contentCid, Instant createdAt) {
    withConnection(conn -> {
      insertSeen(conn, sourceId, contentCid, createdAt);
      return null;
    });
  }

  /** Inserts the source item row, or clears the deletion marker of an existing one. */
  protected void insertSeen(Connection conn, String sourceId, String contentCid, Instant createdAt) {
    if (JdbcTemplate.update(conn,
        "UPDATE source_item SET deleted_at=NULL WHERE source_id=?", sourceId) > 0) {
      return;
    }
    try {
      JdbcTemplate.update(conn,
          "INSERT INTO source_item (source_id, content_cid, created_at, seen_at, deleted_at) VALUES (?,?,?,?,NULL)",
          sourceId, contentCid, Timestamp.from(createdAt), now());
    } catch (StoreException e) {
      if (!JdbcTemplate.isConstraintViolation(e)) {
        throw e;
      }
    }
  }

  @Override
  public void markDeleted(String sourceId) {
    withConnection(conn -> JdbcTemplate.update(conn,
        "UPDATE source_item SET deleted_at=? WHERE source_id=? AND deleted_at IS NULL", now(), sourceId));
  }

  @Override
  public boolean isDeleted(String sourceId) {
    return findEntry(sourceId).map(LedgerEntry::isDeleted).orElse(false);
  }

  @Override
  public Optional<LedgerEntry> findEntry(String sourceId) {
    return withConnection(conn -> JdbcTemplate.queryOne(conn,
        "SELECT source_id, content_cid, created_at, seen_at, deleted_at FROM source_item WHERE source_id=?",
        ENTRY_ROW_MAPPER, sourceId));
  }

  @Override
  public Set<String> listActiveIds() {
    return withConnection(conn -> new LinkedHashSet<>(JdbcTemplate.query(conn,
        "SELECT source_id FROM source_item WHERE deleted_at IS NULL ORDER BY created_at",
        rs -> rs.getString(1))));
  }

  // ── Publish records ─────────────────────────────────────────────

  @Override
  public void recordSuccess(String sourceId, String target, List<String> remoteIds, String remoteUrl) {
    if (remoteIds == null || remoteIds.isEmpty()) {
      throw new IllegalArgumentException("remoteIds cannot be empty");
    }
    withConnection(conn -> {
      upsertRecord(conn, sourceId, target, PublishStatus.SUCCESS, JsonSupport.writeIds(remoteIds), remoteUrl, null);
      return null;
    });
  }

  /**
   * Inserts or overwrites the (source, target) row, including its remote ids.
   */
  protected void upsertRecord(Connection conn, String sourceId, String target, PublishStatus status,
      String remoteIdsJson, String remoteUrl, String error) {
    String update = "UPDATE publish_record SET status=?, remote_ids=?, remote_url=?, error=?, updated_at=?"
        + " WHERE source_id=? AND target=?";
    Object[] updateParams = {status.code(), remoteIdsJson, remoteUrl, error, now(), sourceId, target};
    if (JdbcTemplate.update(conn, update, updateParams) > 0) {
      return;
    }
    try {
      JdbcTemplate.update(conn,
          "INSERT INTO publish_record (source_id, target, status, remote_ids, remote_url, error, updated_at)"
              + " VALUES (?,?,?,?,?,?,?)",
          sourceId, target, status.code(), remoteIdsJson, remoteUrl, error, now());
    } catch (StoreException e) {
      if (!JdbcTemplate.isConstraintViolation(e)) {
        throw e;
      }
      JdbcTemplate.update(conn, update, updateParams);
    }
  }

  /**
   * Records a terminal failure. A row already marked as successfully published keeps its status,
   * remote ids and URL; only the error and timestamp are updated.
   */
  @Override
  public void recordFailure(String sourceId, String target, String error) {
    String truncated = truncateError(error);
    withConnection(conn -> {
      int updated = JdbcTemplate.update(conn,
          "UPDATE publish_record SET status=?, error=?, updated_at=?"
              + " WHERE source_id=? AND target=? AND status<>" + PublishStatus.SUCCESS.code(),
          PublishStatus.FAILED.code(), truncated, now(), sourceId, target);
      if (updated == 0) {
        updated = JdbcTemplate.update(conn,
            "UPDATE publish_record SET error=?, updated_at=?"
                + " WHERE source_id=? AND target=? AND status=" + PublishStatus.SUCCESS.code(),
            truncated, now(), sourceId, target);
      }
      if (updated == 0) {
        try {
          JdbcTemplate.update(conn,
              "INSERT INTO publish_record (source_id, target, status, remote_ids, remote_url, error, updated_at)"
                  + " VALUES (?,?,?,?,NULL,?,?)",
              sourceId, target, PublishStatus.FAILED.code(), JsonSupport.writeIds(List.of()), truncated, now());
        } catch (StoreException e) {
          if (!JdbcTemplate.isConstraintViolation(e)) {
            throw e;
          }
        }
      }
      return null;
    });
  }

  @Override
  public void recordDeletion(String sourceId, String target) {
    withConnection(conn -> JdbcTemplate.update(conn,
        "UPDATE publish_record SET status=?, updated_at=? WHERE source_id=? AND target=?",
        PublishStatus.DELETED.code(), now(), sourceId, target));
  }

  @Override
  public Optional<PublishRecord> findRecord(String sourceId, String target) {
    return withConnection(conn -> JdbcTemplate.queryOne(conn,
        "SELECT source_id, target, status, remote_ids, remote_url, error, updated_at"
            + " FROM publish_record WHERE source_id=? AND target=?",
        RECORD_ROW_MAPPER, sourceId, target));
  }

  @Override
  public List<String> getRemoteIds(String sourceId, String target) {
    return findRecord(sourceId, target)
        .filter(PublishRecord::hasRemoteIds)
        .map(PublishRecord::remoteIds)
        .orElse(List.of());
  }

  @Override
  public String getRemoteUrl(String sourceId, String target) {
    return findRecord(sourceId, target)
        .filter(PublishRecord::hasRemoteIds)
        .map(PublishRecord::remoteUrl)
        .orElse(null);
  }

  @Override
  public Set<String> getTargetsWithRemoteIds(String sourceId) {
    List<PublishRecord> records = withConnection(conn -> JdbcTemplate.query(conn,
        "SELECT source_id, target, status, remote_ids, remote_url, error, updated_at"
            + " FROM publish_record WHERE source_id=? AND status=? ORDER BY target",
        RECORD_ROW_MAPPER, sourceId, PublishStatus.SUCCESS.code()));
    Set<String> targets = new LinkedHashSet<>();
    for (PublishRecord record : records) {
      if (record.hasRemoteIds()) {
        targets.add(record.target());
      }
    }
    return targets;
  }

  // ── Daily budget ────────────────────────────────────────────────

  @Override
  public int getCount(String target, String dayKey) {
    return withConnection(conn -> JdbcTemplate.queryOne(conn,
        "SELECT post_count FROM budget_counter WHERE target=? AND day_key=?",
        rs -> rs.getInt(1), target, dayKey).orElse(0));
  }

  @Override
  public int incrementCount(String target, String dayKey, int by) {
    if (by < 0) {
      throw new IllegalArgumentException("by must be >= 0");
    }
    return inTransaction(conn -> incrementCount(conn, target, dayKey, by));
  }

  /**
   * Adds {@code by} to the counter inside the caller's transaction and returns the new value.
   */
  protected int incrementCount(Connection conn, String target, String dayKey, int by) {
    String update = "UPDATE budget_counter SET post_count=post_count+? WHERE target=? AND day_key=?";
    if (JdbcTemplate.update(conn, update, by, target, dayKey) == 0) {
      try {
        JdbcTemplate.update(conn,
            "INSERT INTO budget_counter (target, day_key, post_count) VALUES (?,?,?)", target, dayKey, by);
      } catch (StoreException e) {
        if (!JdbcTemplate.isConstraintViolation(e)) {
          throw e;
        }
        JdbcTemplate.update(conn, update, by, target, dayKey);
      }
    }
    return JdbcTemplate.queryOne(conn,
        "SELECT post_count FROM budget_counter WHERE target=? AND day_key=?",
        rs -> rs.getInt(1), target, dayKey).orElseThrow();
  }

  // ── Connections ─────────────────────────────────────────────────

  @FunctionalInterface
  protected interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }

  protected <T> T withConnection(ConnectionCallback<T> callback) {
    try (Connection conn = requireProvider().getConnection()) {
      conn.setAutoCommit(true);
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new StoreException("Ledger operation failed", e);
    }
  }

  protected <T> T inTransaction(ConnectionCallback<T> callback) {
    try (Connection conn = requireProvider().getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = callback.apply(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new StoreException("Ledger transaction failed", e);
    }
  }

  private ConnectionProvider requireProvider() {
    if (connectionProvider == null) {
      throw new IllegalStateException("Ledger " + name() + " is not bound to a connection provider");
    }
    return connectionProvider;
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}

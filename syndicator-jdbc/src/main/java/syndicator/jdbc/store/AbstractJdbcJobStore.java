package syndicator.jdbc.store;

import syndicator.jdbc.JacksonPayloadCodec;
import syndicator.jdbc.JdbcTemplate;
import syndicator.jdbc.StoreException;
import syndicator.jdbc.TableNames;
import syndicator.model.Job;
import syndicator.model.JobAction;
import syndicator.model.JobStatus;
import syndicator.spi.JobStore;
import syndicator.spi.PayloadCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #insertIfAbsent} where the database offers a conflict-free
 * insert. Register custom implementations via
 * {@code META-INF/services/syndicator.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String PENDING_STATUS_IN =
      "(" + JobStatus.NEW.code() + "," + JobStatus.RETRY.code() + ")";

  protected static final String TERMINAL_STATUS_IN =
      "(" + JobStatus.DONE.code() + "," + JobStatus.DEAD.code() + "," + JobStatus.DEFERRED.code() + ")";

  protected static final String COLUMNS =
      "job_key, job_id, target, action, source_id, payload, status, attempts, not_before, created_at, last_error";

  private final String tableName;
  private final PayloadCodec payloadCodec;
  private final JdbcTemplate.RowMapper<Job> rowMapper;

  protected AbstractJdbcJobStore() {
    this(TableNames.JOB, new JacksonPayloadCodec());
  }

  protected AbstractJdbcJobStore(String tableName, PayloadCodec payloadCodec) {
    this.tableName = TableNames.validate(tableName);
    this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
    this.rowMapper = rs -> {
      String payload = rs.getString("payload");
      return new Job(
          rs.getString("job_id"),
          rs.getString("job_key"),
          rs.getString("target"),
          JobAction.valueOf(rs.getString("action")),
          rs.getString("source_id"),
          payload == null ? null : this.payloadCodec.decode(payload),
          JobStatus.fromCode(rs.getInt("status")),
          rs.getInt("attempts"),
          rs.getTimestamp("not_before").toInstant(),
          rs.getTimestamp("created_at").toInstant(),
          rs.getString("last_error"));
    };
  }

  /** Unique identifier for this job store (e.g. "postgresql", "h2"). */
  public abstract String name();

  /** JDBC URL prefixes this job store handles. */
  public abstract List<String> jdbcUrlPrefixes();

  /** Copy of this store using another table or payload codec. */
  public abstract AbstractJdbcJobStore with(String tableName, PayloadCodec payloadCodec);

  protected String tableName() {
    return tableName;
  }

  protected JdbcTemplate.RowMapper<Job> rowMapper() {
    return rowMapper;
  }

  protected Object[] insertParams(Job job) {
    Timestamp now = Timestamp.from(job.createdAt());
    return new Object[]{
        job.jobKey(), job.jobId(), job.target(), job.action().name(), job.sourceId(),
        job.payload() == null ? null : payloadCodec.encode(job.payload()),
        job.status().code(), job.attempts(), Timestamp.from(job.notBefore()), now,
        truncateError(job.lastError()), now};
  }

  protected String insertSql() {
    return "INSERT INTO " + tableName() + " (" + COLUMNS + ", updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
  }

  /**
   * Plain insert; a primary key violation means the key is taken. Callers inside a
   * transaction on databases that abort on errors need a subclass override.
   */
  @Override
  public boolean insertIfAbsent(Connection conn, Job job) {
    try {
      return JdbcTemplate.update(conn, insertSql(), insertParams(job)) > 0;
    } catch (StoreException e) {
      if (JdbcTemplate.isConstraintViolation(e)) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public int markDone(Connection conn, String jobKey) {
    String sql = "UPDATE " + tableName() + " SET status=" + JobStatus.DONE.code() + ", updated_at=?"
        + " WHERE job_key=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, Timestamp.from(Instant.now()), jobKey);
  }

  @Override
  public int markRetry(Connection conn, String jobKey, Instant nextAt, String error) {
    String sql = "UPDATE " + tableName() + " SET status=" + JobStatus.RETRY.code()
        + ", attempts=attempts+1, not_before=?, last_error=?, updated_at=?"
        + " WHERE job_key=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, Timestamp.from(nextAt), truncateError(error),
        Timestamp.from(Instant.now()), jobKey);
  }

  @Override
  public int markDead(Connection conn, String jobKey, String error) {
    return markTerminal(conn, jobKey, JobStatus.DEAD, error);
  }

  @Override
  public int markDeferred(Connection conn, String jobKey, String reason) {
    return markTerminal(conn, jobKey, JobStatus.DEFERRED, reason);
  }

  private int markTerminal(Connection conn, String jobKey, JobStatus status, String error) {
    String sql = "UPDATE " + tableName() + " SET status=" + status.code() + ", last_error=?, updated_at=?"
        + " WHERE job_key=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, truncateError(error), Timestamp.from(Instant.now()), jobKey);
  }

  @Override
  public List<Job> pollDue(Connection conn, String target, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE target=? AND status IN " + PENDING_STATUS_IN + " AND not_before <= ?"
        + " ORDER BY not_before, job_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, target, Timestamp.from(now), limit);
  }

  @Override
  public Optional<Job> find(Connection conn, String jobKey) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE job_key=?";
    return JdbcTemplate.queryOne(conn, sql, rowMapper, jobKey);
  }

  @Override
  public int countPending(Connection conn, String target) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE target=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt(1), target).orElse(0);
  }

  /**
   * Deletes terminal jobs with a subquery bounding the batch, which works for H2 and PostgreSQL.
   */
  @Override
  public int purgeTerminal(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE job_key IN ("
        + "SELECT job_key FROM " + tableName()
        + " WHERE status IN " + TERMINAL_STATUS_IN + " AND updated_at < ?"
        + " ORDER BY updated_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}

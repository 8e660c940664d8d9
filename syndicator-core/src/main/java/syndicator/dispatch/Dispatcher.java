package syndicator.dispatch;

import syndicator.PublishException;
import syndicator.SourceItem;
import syndicator.TargetProfile;
import syndicator.ledger.Ledger;
import syndicator.model.Job;
import syndicator.spi.ConnectionProvider;
import syndicator.spi.JobStore;
import syndicator.spi.MetricsExporter;
import syndicator.spi.Publisher;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the delivery pipeline: owns one durable job queue and worker pool per target.
 *
 * <p>Publish jobs are keyed by {@link JobKeys#publish}, so enqueueing the same item twice is a
 * no-op. Delete jobs are only created for targets that hold remote ids for the item.
 * Failures of one target never block another: each target has its own fetch loop, workers
 * and pacing.
 *
 * <p>Create instances via {@link #builder()}, then call {@link #start()}. This class is
 * thread-safe and implements {@link AutoCloseable} for graceful shutdown with a drain timeout.
 *
 * @see Dispatcher.Builder
 */
public final class Dispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

  private final Map<String, TargetDispatcher> targets;
  private final Set<String> disabled = Collections.synchronizedSet(new LinkedHashSet<>());
  private final TargetDispatcher.Shared shared;
  private final long drainTimeoutMs;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private volatile boolean started;

  private Dispatcher(Builder builder) {
    ConnectionProvider connectionProvider =
        Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    JobStore jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    Ledger ledger = Objects.requireNonNull(builder.ledger, "ledger");
    if (builder.targets.isEmpty()) {
      throw new IllegalArgumentException("At least one target is required");
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.fetchIntervalMs <= 0) {
      throw new IllegalArgumentException("fetchIntervalMs must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.shared = new TargetDispatcher.Shared(
        connectionProvider,
        jobStore,
        ledger,
        builder.inFlightTracker != null ? builder.inFlightTracker : new DefaultInFlightTracker(),
        builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(),
        new FailureClassifier(builder.rateLimitFloor),
        builder.metrics != null ? builder.metrics : MetricsExporter.NOOP,
        builder.clock != null ? builder.clock : Clock.systemUTC(),
        builder.maxAttempts,
        builder.batchSize,
        builder.fetchIntervalMs);

    Map<String, TargetDispatcher> byName = new LinkedHashMap<>();
    for (Map.Entry<TargetProfile, Publisher> entry : builder.targets.entrySet()) {
      TargetProfile profile = entry.getKey();
      byName.put(profile.name(), new TargetDispatcher(profile, entry.getValue(), shared));
    }
    this.targets = Collections.unmodifiableMap(byName);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Initializes every publisher and starts the per-target fetch loops. A target whose
   * publisher fails to initialize is disabled and logged; the remaining targets run.
   *
   * @throws IllegalStateException if no target could be initialized or the dispatcher is closed
   */
  public synchronized void start() {
    if (!accepting.get()) {
      throw new IllegalStateException("Dispatcher has been closed");
    }
    if (started) {
      return;
    }
    for (TargetDispatcher target : targets.values()) {
      try {
        target.publisher().init();
      } catch (PublishException | RuntimeException e) {
        disabled.add(target.name());
        logger.log(Level.WARNING, "Target " + target.name() + " disabled: publisher init failed", e);
      }
    }
    if (activeTargets().isEmpty()) {
      throw new IllegalStateException("No target could be initialized: " + targets.keySet());
    }
    for (TargetDispatcher target : targets.values()) {
      if (!disabled.contains(target.name())) {
        target.start();
      }
    }
    started = true;
  }

  /** Names of the configured targets that are not disabled, in configuration order. */
  public List<String> activeTargets() {
    List<String> active = new ArrayList<>();
    for (String name : targets.keySet()) {
      if (!disabled.contains(name)) {
        active.add(name);
      }
    }
    return active;
  }

  public TargetProfile profile(String target) {
    return requireTarget(target).profile();
  }

  /**
   * Enqueues publish jobs for the item on every active target.
   *
   * @return number of jobs inserted; existing keys are collapsed and not counted
   * @throws EnqueueException if the job store cannot be reached
   */
  public int enqueuePublish(SourceItem item) {
    return enqueuePublish(item, activeTargets());
  }

  /**
   * Enqueues publish jobs for the item on the given targets.
   *
   * @return number of jobs inserted; existing keys are collapsed and not counted
   * @throws EnqueueException if the job store cannot be reached
   */
  public int enqueuePublish(SourceItem item, Collection<String> targetNames) {
    Objects.requireNonNull(item, "item");
    Instant now = shared.clock().instant();
    List<Job> jobs = new ArrayList<>();
    for (String target : targetNames) {
      requireTarget(target);
      jobs.add(Job.publish(JobKeys.publish(target, item.id()), target, item, now, now));
    }
    return insertAll(jobs, item.id());
  }

  /**
   * Enqueues delete jobs for every configured target holding remote ids for the item.
   *
   * @return number of jobs inserted
   * @throws EnqueueException if the job store cannot be reached
   */
  public int enqueueDelete(String sourceId) {
    Objects.requireNonNull(sourceId, "sourceId");
    Instant now = shared.clock().instant();
    List<Job> jobs = new ArrayList<>();
    for (String target : shared.ledger().getTargetsWithRemoteIds(sourceId)) {
      if (!targets.containsKey(target)) {
        logger.log(Level.WARNING, "Cannot delete {0} from unconfigured target {1}",
            new Object[]{sourceId, target});
        continue;
      }
      jobs.add(Job.delete(JobKeys.delete(target, sourceId), target, sourceId, now, now));
    }
    return insertAll(jobs, sourceId);
  }

  private int insertAll(List<Job> jobs, String sourceId) {
    if (!accepting.get()) {
      throw new IllegalStateException("Dispatcher has been closed");
    }
    if (jobs.isEmpty()) {
      return 0;
    }
    int inserted = 0;
    try (Connection conn = shared.connectionProvider().getConnection()) {
      conn.setAutoCommit(true);
      for (Job job : jobs) {
        if (shared.jobStore().insertIfAbsent(conn, job)) {
          inserted++;
          shared.metrics().incrementEnqueued(job.target());
          logger.log(Level.INFO, "Queued {0} {1} for {2} as {3}",
              new Object[]{job.action(), sourceId, job.target(), job.jobKey()});
        }
      }
    } catch (SQLException e) {
      throw new EnqueueException("Failed to enqueue jobs for " + sourceId, e);
    }
    return inserted;
  }

  /**
   * Runs one attempt of {@code job} in the calling thread and applies its outcome.
   */
  public DispatchOutcome dispatch(Job job) {
    Objects.requireNonNull(job, "job");
    return requireTarget(job.target()).dispatch(job);
  }

  /**
   * Dispatches every due job of every active target in the calling thread.
   *
   * @return number of jobs dispatched
   */
  public int dispatchDue() {
    int dispatched = 0;
    for (String target : activeTargets()) {
      dispatched += targets.get(target).dispatchDue();
    }
    return dispatched;
  }

  private TargetDispatcher requireTarget(String name) {
    TargetDispatcher target = targets.get(name);
    if (target == null) {
      throw new IllegalArgumentException("Unknown target: " + name + ". Configured: " + targets.keySet());
    }
    return target;
  }

  /**
   * Stops accepting jobs, drains in-flight attempts of every target within the drain timeout
   * and shuts the publishers down.
   */
  @Override
  public synchronized void close() {
    if (!accepting.getAndSet(false)) {
      return;
    }
    for (TargetDispatcher target : targets.values()) {
      target.close(drainTimeoutMs);
    }
    logger.info("Dispatcher closed");
  }

  /** Builder for {@link Dispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private Ledger ledger;
    private final Map<TargetProfile, Publisher> targets = new LinkedHashMap<>();
    private final Set<String> targetNames = new LinkedHashSet<>();
    private RetryPolicy retryPolicy;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private Clock clock;
    private int maxAttempts = 5;
    private int batchSize = 50;
    private long fetchIntervalMs = 1000;
    private long drainTimeoutMs = 5000;
    private Duration rateLimitFloor = Duration.ofSeconds(30);

    private Builder() {}

    /**
     * Sets the connection provider used for all job store operations.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the durable job queue.
     *
     * <p><b>Required.</b>
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Sets the ledger consulted before and written after each attempt.
     *
     * <p><b>Required.</b>
     */
    public Builder ledger(Ledger ledger) {
      this.ledger = ledger;
      return this;
    }

    /**
     * Adds a target served by {@code publisher}. At least one target is required.
     *
     * @throws IllegalArgumentException if the names differ or the target was already added
     */
    public Builder target(TargetProfile profile, Publisher publisher) {
      Objects.requireNonNull(profile, "profile");
      Objects.requireNonNull(publisher, "publisher");
      if (!profile.name().equals(publisher.name())) {
        throw new IllegalArgumentException("Publisher " + publisher.name()
            + " does not match target " + profile.name());
      }
      if (!targetNames.add(profile.name())) {
        throw new IllegalArgumentException("Duplicate target: " + profile.name());
      }
      targets.put(profile, publisher);
      return this;
    }

    /**
     * Sets the backoff for transient failures and unresolved reply dependencies.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 10 s base and a
     * one hour cap, without jitter.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the number of attempts after which a job is recorded as failed and marked DEAD.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the maximum number of due jobs fetched per target and cycle.
     *
     * <p>Optional. Defaults to {@code 50}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the delay between fetch cycles of each target.
     *
     * <p>Optional. Defaults to {@code 1000} ms.
     */
    public Builder fetchIntervalMs(long fetchIntervalMs) {
      this.fetchIntervalMs = fetchIntervalMs;
      return this;
    }

    /**
     * Sets the maximum time to wait for in-flight attempts during shutdown.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the minimum delay applied to rate-limited jobs, whatever the reset hints say.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder rateLimitFloor(Duration rateLimitFloor) {
      this.rateLimitFloor = Objects.requireNonNull(rateLimitFloor, "rateLimitFloor");
      return this;
    }

    /**
     * Optional. Defaults to {@link DefaultInFlightTracker}.
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock for due times, backoff and budget days.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the dispatcher. Call {@link Dispatcher#start()} to begin processing.
     *
     * @throws NullPointerException     if {@code connectionProvider}, {@code jobStore} or
     *                                  {@code ledger} is null
     * @throws IllegalArgumentException if no target was added or a setting is out of range
     */
    public Dispatcher build() {
      return new Dispatcher(this);
    }
  }
}

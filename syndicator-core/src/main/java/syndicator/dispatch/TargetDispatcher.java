package syndicator.dispatch;

import syndicator.PublishException;
import syndicator.PublishRequest;
import syndicator.PublishResult;
import syndicator.SourceItem;
import syndicator.TargetProfile;
import syndicator.ledger.Ledger;
import syndicator.ledger.PublishRecord;
import syndicator.model.Job;
import syndicator.resolve.DependencyResolver;
import syndicator.resolve.QuoteComposer;
import syndicator.resolve.Resolution;
import syndicator.segment.Segmenter;
import syndicator.spi.ConnectionProvider;
import syndicator.spi.JobStore;
import syndicator.spi.MetricsExporter;
import syndicator.spi.Publisher;
import syndicator.util.DaemonThreadFactory;
import syndicator.util.UtcDays;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Job queue worker of a single target.
 *
 * <p>A fetch loop pulls due jobs of the target from the {@link JobStore} in
 * {@code notBefore}/enqueue order and hands them to a pool of {@code concurrency} workers. Each
 * attempt ends in a {@link DispatchOutcome} which is applied as a job state transition:
 * success marks the job DONE, rate limits and budget exhaustion move the work to a derived
 * job, permanent rejections and exhausted retries are recorded in the ledger and mark the job
 * DEAD, and anything else is retried with backoff.
 */
final class TargetDispatcher {
  private static final Logger logger = Logger.getLogger(TargetDispatcher.class.getName());

  private final TargetProfile profile;
  private final Publisher publisher;
  private final Shared shared;
  private final DependencyResolver resolver;
  private final QuoteComposer quoteComposer;
  private final MinIntervalPacer pacer;
  private final ReentrantLock budgetLock = new ReentrantLock();
  private final AtomicBoolean running = new AtomicBoolean(false);

  private ScheduledExecutorService fetcher;
  private ExecutorService workers;

  TargetDispatcher(TargetProfile profile, Publisher publisher, Shared shared) {
    this.profile = profile;
    this.publisher = publisher;
    this.shared = shared;
    this.resolver = new DependencyResolver(shared.ledger());
    this.quoteComposer = new QuoteComposer(shared.ledger());
    this.pacer = new MinIntervalPacer(profile.minInterval());
  }

  String name() {
    return profile.name();
  }

  TargetProfile profile() {
    return profile;
  }

  Publisher publisher() {
    return publisher;
  }

  synchronized void start() {
    if (running.get()) {
      return;
    }
    running.set(true);
    workers = Executors.newFixedThreadPool(profile.concurrency(),
        new DaemonThreadFactory("syndicator-" + name() + "-worker-"));
    fetcher = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("syndicator-" + name() + "-fetch-"));
    fetcher.scheduleWithFixedDelay(this::fetch, 0, shared.fetchIntervalMs(), TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Started dispatcher for target {0} ({1})", new Object[]{name(), profile});
  }

  /**
   * Fetches due jobs and queues them on the worker pool. Jobs already in flight are skipped, and
   * each worker re-reads its job before the attempt so a job finished since the poll is not run
   * again. Attempts still queued when the dispatcher closes are dropped.
   */
  void fetch() {
    if (!running.get()) {
      return;
    }
    try {
      List<Job> due = pollDue();
      for (Job job : due) {
        if (!running.get()) {
          break;
        }
        if (!shared.inFlight().tryAcquire(job.jobKey())) {
          continue;
        }
        try {
          workers.execute(() -> {
            try {
              if (running.get()) {
                claim(job).ifPresent(this::dispatch);
              }
            } finally {
              shared.inFlight().release(job.jobKey());
            }
          });
        } catch (RejectedExecutionException e) {
          shared.inFlight().release(job.jobKey());
          break;
        }
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Fetch cycle failed for target " + name(), t);
    }
  }

  /**
   * Dispatches every due job in the calling thread, one after another.
   *
   * @return number of jobs dispatched
   */
  int dispatchDue() {
    int dispatched = 0;
    for (Job job : pollDue()) {
      if (!shared.inFlight().tryAcquire(job.jobKey())) {
        continue;
      }
      try {
        Optional<Job> current = claim(job);
        if (current.isPresent()) {
          dispatch(current.get());
          dispatched++;
        }
      } finally {
        shared.inFlight().release(job.jobKey());
      }
    }
    return dispatched;
  }

  /**
   * Re-reads a polled job while its key is held in flight. Returns the stored row if it is still
   * pending and due, empty otherwise.
   */
  private Optional<Job> claim(Job polled) {
    Instant now = shared.clock().instant();
    Optional<Job> current;
    try (Connection conn = shared.connectionProvider().getConnection()) {
      conn.setAutoCommit(true);
      current = shared.jobStore().find(conn, polled.jobKey());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to re-read jobKey=" + polled.jobKey(), e);
      return Optional.empty();
    }
    if (current.isEmpty() || !current.get().status().isPending() || current.get().notBefore().isAfter(now)) {
      logger.log(Level.FINE, "Skipping {0}: no longer due", polled.jobKey());
      return Optional.empty();
    }
    return current;
  }

  /**
   * Runs one attempt of {@code job} and applies its outcome to the job store and ledger.
   * An attempt interrupted while waiting for its pacing slot leaves the job untouched.
   */
  DispatchOutcome dispatch(Job job) {
    DispatchOutcome outcome;
    try {
      outcome = job.isPublish() ? attemptPublish(job) : attemptDelete(job);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.INFO, "Dispatch of {0} interrupted; job stays pending", job.jobKey());
      return new DispatchOutcome.TransientFailure("interrupted", e);
    } catch (RuntimeException e) {
      outcome = new DispatchOutcome.TransientFailure(FailureClassifier.describe(e), e);
    }
    apply(job, outcome);
    return outcome;
  }

  private DispatchOutcome attemptPublish(Job job) throws InterruptedException {
    SourceItem item = job.payload();
    Ledger ledger = shared.ledger();
    if (ledger.isDeleted(item.id())) {
      logger.log(Level.INFO, "Skipping {0}: source item {1} was deleted", new Object[]{job.jobKey(), item.id()});
      return DispatchOutcome.Success.nothingToDo();
    }
    Optional<PublishRecord> existing = ledger.findRecord(item.id(), name());
    if (existing.isPresent() && existing.get().hasRemoteIds()) {
      logger.log(Level.INFO, "Skipping {0}: already published to {1}", new Object[]{job.jobKey(), name()});
      return new DispatchOutcome.Success(existing.get().remoteIds());
    }

    Resolution resolution = resolver.resolve(item, name());
    if (resolution instanceof Resolution.DependencyNotReady notReady) {
      return new DispatchOutcome.DependencyNotReady(notReady.describe());
    }
    String replyTo = ((Resolution.Postable) resolution).replyToRemoteId();

    String text = quoteComposer.compose(item, profile);
    List<String> segments = Segmenter.segment(text, profile.maxLength(), profile.lengthCounter(),
        profile.reserveForCounter());

    if (!profile.hasDailyLimit()) {
      pacer.awaitTurn();
      return post(item, segments, replyTo);
    }
    if (segments.size() > profile.dailyLimit()) {
      return new DispatchOutcome.PermanentRejection("thread of " + segments.size()
          + " posts exceeds daily limit of " + profile.dailyLimit());
    }

    // budget check, post and count run as one step per target
    budgetLock.lockInterruptibly();
    try {
      Instant now = shared.clock().instant();
      String dayKey = UtcDays.dayKey(now);
      int used = ledger.getCount(name(), dayKey);
      if (used + segments.size() > profile.dailyLimit()) {
        return new DispatchOutcome.BudgetExceeded(UtcDays.nextMidnight(now), dayKey, used, segments.size());
      }
      pacer.awaitTurn();
      DispatchOutcome outcome = post(item, segments, replyTo);
      if (outcome instanceof DispatchOutcome.Success success) {
        countAgainstBudget(success.remoteIds().size());
      }
      return outcome;
    } finally {
      budgetLock.unlock();
    }
  }

  private DispatchOutcome post(SourceItem item, List<String> segments, String replyTo) {
    PublishResult result;
    try {
      result = publisher.publish(new PublishRequest(item, segments, replyTo));
    } catch (PublishException e) {
      return shared.classifier().classify(e, shared.clock().instant());
    }
    shared.ledger().recordSuccess(item.id(), name(), result.remoteIds(), result.url());
    return new DispatchOutcome.Success(result.remoteIds());
  }

  private void countAgainstBudget(int posts) {
    String dayKey = UtcDays.dayKey(shared.clock().instant());
    try {
      shared.ledger().incrementCount(name(), dayKey, posts);
    } catch (RuntimeException e) {
      // the thread is posted and recorded; a lost increment only loosens today's budget
      logger.log(Level.SEVERE, "Failed to count " + posts + " posts against budget " + name() + "/" + dayKey, e);
    }
  }

  private DispatchOutcome attemptDelete(Job job) {
    Ledger ledger = shared.ledger();
    Optional<PublishRecord> record = ledger.findRecord(job.sourceId(), name());
    if (record.isEmpty() || !record.get().hasRemoteIds()) {
      logger.log(Level.FINE, "Nothing to delete for {0} on {1}", new Object[]{job.sourceId(), name()});
      return DispatchOutcome.Success.nothingToDo();
    }
    List<String> remoteIds = new ArrayList<>(record.get().remoteIds());
    Collections.reverse(remoteIds);
    for (String remoteId : remoteIds) {
      try {
        publisher.delete(remoteId);
      } catch (PublishException e) {
        if (!e.isNotFound()) {
          return shared.classifier().classify(e, shared.clock().instant());
        }
        logger.log(Level.FINE, "Remote {0} on {1} already gone", new Object[]{remoteId, name()});
      }
    }
    ledger.recordDeletion(job.sourceId(), name());
    return new DispatchOutcome.Success(remoteIds);
  }

  private void apply(Job job, DispatchOutcome outcome) {
    if (outcome instanceof DispatchOutcome.Success) {
      markDone(job);
    } else if (outcome instanceof DispatchOutcome.RateLimited limited) {
      defer(job, JobKeys.rateLimitDeferral(JobKeys.base(job), limited.resumeAt()),
          limited.resumeAt(), "rate limited: " + limited.reason());
    } else if (outcome instanceof DispatchOutcome.BudgetExceeded budget) {
      defer(job, JobKeys.budgetDeferral(JobKeys.base(job), budget.dayKey()),
          budget.resumeAt(), budget.reason());
    } else if (outcome instanceof DispatchOutcome.PermanentRejection rejection) {
      fail(job, "rejected: " + rejection.reason(), null);
    } else if (outcome instanceof DispatchOutcome.DependencyNotReady notReady) {
      retryOrFail(job, notReady.reason(), null);
    } else if (outcome instanceof DispatchOutcome.TransientFailure transientFailure) {
      retryOrFail(job, transientFailure.reason(), transientFailure.cause());
    }
  }

  private void markDone(Job job) {
    withConnection("mark DONE", job.jobKey(), conn -> shared.jobStore().markDone(conn, job.jobKey()));
    shared.metrics().incrementSuccess(name());
    logger.log(Level.INFO, "Completed {0} {1} on {2}",
        new Object[]{job.action(), job.sourceId(), name()});
  }

  private void retryOrFail(Job job, String reason, Throwable cause) {
    int nextAttempt = job.attempts() + 1;
    if (nextAttempt >= shared.maxAttempts()) {
      fail(job, "gave up after " + nextAttempt + " attempts: " + reason, cause);
      return;
    }
    long delayMs = shared.retryPolicy().computeDelayMs(nextAttempt);
    Instant nextAt = shared.clock().instant().plusMillis(delayMs);
    withConnection("mark RETRY", job.jobKey(),
        conn -> shared.jobStore().markRetry(conn, job.jobKey(), nextAt, reason));
    shared.metrics().incrementRetry(name());
    logger.log(Level.WARNING, "Attempt {0} of {1} failed ({2}); retrying at {3}",
        new Object[]{nextAttempt, job.jobKey(), reason, nextAt});
  }

  private void fail(Job job, String reason, Throwable cause) {
    if (job.isPublish()) {
      try {
        shared.ledger().recordFailure(job.sourceId(), name(), reason);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to record failure of " + job.jobKey() + " in ledger", e);
      }
    }
    withConnection("mark DEAD", job.jobKey(), conn -> shared.jobStore().markDead(conn, job.jobKey(), reason));
    shared.metrics().incrementDead(name());
    logger.log(Level.SEVERE, "Job " + job.jobKey() + " moved to DEAD: " + reason, cause);
  }

  private void defer(Job job, String derivedKey, Instant resumeAt, String reason) {
    Job derived = job.deferredCopy(derivedKey, resumeAt, shared.clock().instant());
    boolean[] inserted = new boolean[1];
    withTransaction("defer", job.jobKey(), conn -> {
      inserted[0] = shared.jobStore().insertIfAbsent(conn, derived);
      shared.jobStore().markDeferred(conn, job.jobKey(), reason + "; continued as " + derivedKey);
    });
    shared.metrics().incrementDeferred(name());
    logger.log(Level.WARNING, "Deferred {0} until {1} ({2}); {3} {4}",
        new Object[]{job.jobKey(), resumeAt, reason, inserted[0] ? "queued" : "collapsed onto", derivedKey});
  }

  private List<Job> pollDue() {
    Instant now = shared.clock().instant();
    try (Connection conn = shared.connectionProvider().getConnection()) {
      conn.setAutoCommit(true);
      List<Job> due = shared.jobStore().pollDue(conn, name(), now, shared.batchSize());
      shared.metrics().recordPending(name(), shared.jobStore().countPending(conn, name()));
      return due;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to fetch due jobs for target " + name(), e);
      return List.of();
    }
  }

  private void withConnection(String action, String jobKey, SqlAction op) {
    try (Connection conn = shared.connectionProvider().getConnection()) {
      conn.setAutoCommit(true);
      op.execute(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for jobKey=" + jobKey, e);
    }
  }

  private void withTransaction(String action, String jobKey, SqlAction op) {
    try (Connection conn = shared.connectionProvider().getConnection()) {
      conn.setAutoCommit(false);
      try {
        op.execute(conn);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for jobKey=" + jobKey, e);
    }
  }

  @FunctionalInterface
  private interface SqlAction {
    void execute(Connection conn) throws SQLException;
  }

  /**
   * Stops fetching, lets running attempts finish within {@code drainTimeoutMs}, then shuts the
   * publisher down. Queued attempts that have not started are dropped and stay pending.
   */
  synchronized void close(long drainTimeoutMs) {
    if (running.getAndSet(false)) {
      fetcher.shutdownNow();
      workers.shutdown();
      try {
        if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "Drain timeout exceeded for target {0}; forcing shutdown", name());
          workers.shutdownNow();
          workers.awaitTermination(5, TimeUnit.SECONDS);
        }
      } catch (InterruptedException e) {
        workers.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    try {
      publisher.shutdown();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Publisher shutdown failed for target " + name(), e);
    }
  }

  /** Collaborators and settings shared by all target dispatchers of one {@link Dispatcher}. */
  record Shared(
      ConnectionProvider connectionProvider,
      JobStore jobStore,
      Ledger ledger,
      InFlightTracker inFlight,
      RetryPolicy retryPolicy,
      FailureClassifier classifier,
      MetricsExporter metrics,
      Clock clock,
      int maxAttempts,
      int batchSize,
      long fetchIntervalMs) {}
}

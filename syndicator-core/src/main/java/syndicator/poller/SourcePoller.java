package syndicator.poller;

import syndicator.SourceItem;
import syndicator.dispatch.Dispatcher;
import syndicator.ledger.Ledger;
import syndicator.spi.MetricsExporter;
import syndicator.spi.SourceFeed;
import syndicator.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled scanner of the source feed.
 *
 * <p>Each poll fetches the most recent items, processes the unseen ones oldest first so that a
 * parent is always queued before its replies, enqueues publish jobs and only then marks the
 * item seen. An enqueue failure ends the batch; the remaining items are picked up by the next
 * poll. On a slower cadence {@link #reconcile()} compares the feed's live ids with the ledger
 * and propagates deletions.
 *
 * <p>Create instances via {@link #builder()}. Polls and reconciliations run on one scheduler
 * thread and never overlap; direct calls to {@link #poll()} while a poll is running return
 * immediately.
 *
 * @see SourcePoller.Builder
 */
public final class SourcePoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(SourcePoller.class.getName());

    private final SourceFeed feed;
    private final Ledger ledger;
    private final Dispatcher dispatcher;
    private final MetricsExporter metrics;
    private final int feedLimit;
    private final long intervalMs;
    private final long reconcileIntervalMs;
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final AtomicBoolean reconciling = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private volatile boolean closed;

    private SourcePoller(Builder builder) {
        this.feed = Objects.requireNonNull(builder.feed, "feed");
        this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");

        if (builder.feedLimit <= 0) {
            throw new IllegalArgumentException("feedLimit must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.reconcileIntervalMs <= 0L) {
            throw new IllegalArgumentException("reconcileIntervalMs must be > 0");
        }
        this.feedLimit = builder.feedLimit;
        this.intervalMs = builder.intervalMs;
        this.reconcileIntervalMs = builder.reconcileIntervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts polling immediately and reconciling after one reconcile interval. Subsequent
     * calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("SourcePoller has been closed");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("syndicator-poller-"));
        scheduler.scheduleWithFixedDelay(this::poll, 0, intervalMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::reconcile, reconcileIntervalMs, reconcileIntervalMs,
                TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single poll cycle. Called by the scheduler, but may also be invoked directly.
     *
     * @return number of items newly enqueued and marked seen
     */
    public int poll() {
        if (closed || !polling.compareAndSet(false, true)) {
            return 0;
        }
        try {
            List<SourceItem> fetched = feed.fetchRecentOwnItems(feedLimit);
            int processed = 0;
            for (SourceItem item : oldestFirst(fetched)) {
                if (ledger.hasSeen(item.id())) {
                    continue;
                }
                try {
                    dispatcher.enqueuePublish(item);
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to enqueue " + item.id() + "; retrying on next poll", e);
                    break;
                }
                ledger.markSeen(item.id(), item.contentCid(), item.createdAt());
                processed++;
            }
            if (processed > 0) {
                metrics.incrementItemsPolled(processed);
                logger.log(Level.INFO, "Queued {0} new source items", processed);
            }
            return processed;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed", t);
            return 0;
        } finally {
            polling.set(false);
        }
    }

    /**
     * Propagates deletions: every ledger-active id missing from the feed's live ids gets delete
     * jobs for the targets holding its remote ids, then is marked deleted.
     *
     * @return number of items marked deleted
     */
    public int reconcile() {
        if (closed || !reconciling.compareAndSet(false, true)) {
            return 0;
        }
        try {
            Set<String> liveIds = feed.fetchAllLiveIds();
            Set<String> vanished = new TreeSet<>(ledger.listActiveIds());
            vanished.removeAll(liveIds);
            int deleted = 0;
            for (String sourceId : vanished) {
                try {
                    int jobs = dispatcher.enqueueDelete(sourceId);
                    ledger.markDeleted(sourceId);
                    deleted++;
                    logger.log(Level.INFO, "Source item {0} deleted; {1} delete jobs queued",
                            new Object[]{sourceId, jobs});
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to propagate deletion of " + sourceId, e);
                }
            }
            if (deleted > 0) {
                metrics.incrementDeletionsReconciled(deleted);
            }
            return deleted;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Deletion reconcile failed", t);
            return 0;
        } finally {
            reconciling.set(false);
        }
    }

    static List<SourceItem> oldestFirst(List<SourceItem> newestFirst) {
        List<SourceItem> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        ordered.sort(Comparator.comparing(SourceItem::createdAt));
        return ordered;
    }

    /**
     * Cancels both schedules and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link SourcePoller}.
     */
    public static final class Builder {
        private SourceFeed feed;
        private Ledger ledger;
        private Dispatcher dispatcher;
        private MetricsExporter metrics;
        private int feedLimit = 50;
        private long intervalMs = 15_000;
        private long reconcileIntervalMs = 60_000;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder feed(SourceFeed feed) {
            this.feed = feed;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder ledger(Ledger ledger) {
            this.ledger = ledger;
            return this;
        }

        /**
         * Sets the dispatcher receiving publish and delete jobs.
         *
         * <p><b>Required.</b>
         */
        public Builder dispatcher(Dispatcher dispatcher) {
            this.dispatcher = dispatcher;
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
         * Sets how many recent items are fetched per poll.
         *
         * <p>Optional. Defaults to {@code 50}.
         */
        public Builder feedLimit(int feedLimit) {
            this.feedLimit = feedLimit;
            return this;
        }

        /**
         * Optional. Defaults to {@code 15000} ms.
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Optional. Defaults to {@code 60000} ms.
         */
        public Builder reconcileIntervalMs(long reconcileIntervalMs) {
            this.reconcileIntervalMs = reconcileIntervalMs;
            return this;
        }

        /**
         * @throws NullPointerException     if {@code feed}, {@code ledger} or {@code dispatcher} is null
         * @throws IllegalArgumentException if an interval or the feed limit is not positive
         */
        public SourcePoller build() {
            return new SourcePoller(this);
        }
    }
}

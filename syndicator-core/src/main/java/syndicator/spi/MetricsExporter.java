package syndicator.spi;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of jobs inserted for a target (collapsed duplicates excluded).
     */
    void incrementEnqueued(String target);

    /**
     * Increments the count of jobs completed successfully.
     */
    void incrementSuccess(String target);

    /**
     * Increments the count of failed attempts scheduled for retry.
     */
    void incrementRetry(String target);

    /**
     * Increments the count of jobs moved to a derived job by a rate limit or the daily budget.
     */
    void incrementDeferred(String target);

    /**
     * Increments the count of jobs moved to DEAD.
     */
    void incrementDead(String target);

    /**
     * Records the number of pending jobs of a target seen by the last fetch.
     */
    void recordPending(String target, int pending);

    /**
     * Increments the count of new source items picked up by the poller.
     */
    default void incrementItemsPolled(int count) {
    }

    /**
     * Increments the count of source deletions found by reconciliation.
     */
    default void incrementDeletionsReconciled(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued(String target) {
        }

        @Override
        public void incrementSuccess(String target) {
        }

        @Override
        public void incrementRetry(String target) {
        }

        @Override
        public void incrementDeferred(String target) {
        }

        @Override
        public void incrementDead(String target) {
        }

        @Override
        public void recordPending(String target, int pending) {
        }
    }
}

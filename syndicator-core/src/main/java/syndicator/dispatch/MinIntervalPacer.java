package syndicator.dispatch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Spaces publisher calls of one target by at least a fixed interval.
 *
 * <p>Each caller reserves the next free slot under the lock and sleeps outside it, so
 * concurrent callers are served in reservation order. The first call never waits.
 */
public final class MinIntervalPacer {
  private final long intervalNanos;
  private long nextSlotNanos;
  private boolean started;

  public MinIntervalPacer(Duration minInterval) {
    Objects.requireNonNull(minInterval, "minInterval");
    if (minInterval.isNegative()) {
      throw new IllegalArgumentException("minInterval must be >= 0");
    }
    this.intervalNanos = minInterval.toNanos();
  }

  /**
   * Blocks until this caller's slot is reached.
   *
   * @throws InterruptedException if interrupted while waiting; the slot is consumed anyway
   */
  public void awaitTurn() throws InterruptedException {
    if (intervalNanos == 0) {
      return;
    }
    long waitNanos;
    synchronized (this) {
      long now = System.nanoTime();
      long slot = started ? Math.max(now, nextSlotNanos) : now;
      started = true;
      nextSlotNanos = slot + intervalNanos;
      waitNanos = slot - now;
    }
    if (waitNanos > 0) {
      TimeUnit.NANOSECONDS.sleep(waitNanos);
    }
  }
}

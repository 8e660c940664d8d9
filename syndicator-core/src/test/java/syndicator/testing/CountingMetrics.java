package syndicator.testing;

import syndicator.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Metrics exporter counting calls per {@code event:target}. */
public class CountingMetrics implements MetricsExporter {
  private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
  public final Map<String, Integer> pending = new ConcurrentHashMap<>();

  public int count(String event, String target) {
    AtomicInteger n = counts.get(event + ":" + target);
    return n == null ? 0 : n.get();
  }

  private void inc(String event, String target, int by) {
    counts.computeIfAbsent(event + ":" + target, k -> new AtomicInteger()).addAndGet(by);
  }

  @Override
  public void incrementEnqueued(String target) {
    inc("enqueued", target, 1);
  }

  @Override
  public void incrementSuccess(String target) {
    inc("success", target, 1);
  }

  @Override
  public void incrementRetry(String target) {
    inc("retry", target, 1);
  }

  @Override
  public void incrementDeferred(String target) {
    inc("deferred", target, 1);
  }

  @Override
  public void incrementDead(String target) {
    inc("dead", target, 1);
  }

  @Override
  public void recordPending(String target, int count) {
    pending.put(target, count);
  }

  @Override
  public void incrementItemsPolled(int count) {
    inc("polled", "*", count);
  }

  @Override
  public void incrementDeletionsReconciled(int count) {
    inc("reconciled", "*", count);
  }
}

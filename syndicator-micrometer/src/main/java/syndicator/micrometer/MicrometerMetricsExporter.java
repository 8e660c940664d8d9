package syndicator.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import syndicator.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Per-target meters carry a {@code target} tag and are registered the first time a
 * target reports.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code syndicator.jobs.enqueued}: jobs inserted into the queue</li>
 *   <li>{@code syndicator.jobs.success}: jobs completed</li>
 *   <li>{@code syndicator.jobs.retry}: attempts rescheduled</li>
 *   <li>{@code syndicator.jobs.deferred}: jobs deferred for rate limit or budget</li>
 *   <li>{@code syndicator.jobs.dead}: jobs given up on</li>
 *   <li>{@code syndicator.poller.items}: new source items picked up (untagged)</li>
 *   <li>{@code syndicator.poller.deletions}: source deletions reconciled (untagged)</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code syndicator.jobs.pending}: pending jobs seen at the last fetch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, TargetMeters> targets = new ConcurrentHashMap<>();
  private final Counter itemsPolled;
  private final Counter deletionsReconciled;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "syndicator"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "syndicator");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "blog.syndicator"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.itemsPolled = Counter.builder(namePrefix + ".poller.items")
        .description("New source items picked up by the poller")
        .register(registry);
    this.deletionsReconciled = Counter.builder(namePrefix + ".poller.deletions")
        .description("Source deletions reconciled")
        .register(registry);
  }

  @Override
  public void incrementEnqueued(String target) {
    if (closed) return;
    meters(target).enqueued.increment();
  }

  @Override
  public void incrementSuccess(String target) {
    if (closed) return;
    meters(target).success.increment();
  }

  @Override
  public void incrementRetry(String target) {
    if (closed) return;
    meters(target).retry.increment();
  }

  @Override
  public void incrementDeferred(String target) {
    if (closed) return;
    meters(target).deferred.increment();
  }

  @Override
  public void incrementDead(String target) {
    if (closed) return;
    meters(target).dead.increment();
  }

  @Override
  public void recordPending(String target, int pending) {
    if (closed) return;
    meters(target).pending.set(pending);
  }

  @Override
  public void incrementItemsPolled(int count) {
    if (closed) return;
    itemsPolled.increment(count);
  }

  @Override
  public void incrementDeletionsReconciled(int count) {
    if (closed) return;
    deletionsReconciled.increment(count);
  }

  private TargetMeters meters(String target) {
    return targets.computeIfAbsent(target, t -> new TargetMeters(registry, namePrefix, t));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(itemsPolled, deletionsReconciled));
    for (TargetMeters target : targets.values()) {
      meters.addAll(target.all());
    }
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    targets.clear();
    if (first != null) throw first;
  }

  private static final class TargetMeters {
    final Counter enqueued;
    final Counter success;
    final Counter retry;
    final Counter deferred;
    final Counter dead;
    final AtomicInteger pending = new AtomicInteger();
    final Gauge pendingGauge;

    TargetMeters(MeterRegistry registry, String prefix, String target) {
      enqueued = counter(registry, prefix + ".jobs.enqueued", "Jobs inserted into the queue", target);
      success = counter(registry, prefix + ".jobs.success", "Jobs completed", target);
      retry = counter(registry, prefix + ".jobs.retry", "Attempts rescheduled for retry", target);
      deferred = counter(registry, prefix + ".jobs.deferred", "Jobs deferred for rate limit or budget", target);
      dead = counter(registry, prefix + ".jobs.dead", "Jobs moved to DEAD", target);
      pendingGauge = Gauge.builder(prefix + ".jobs.pending", pending, AtomicInteger::get)
          .description("Pending jobs at the last fetch")
          .tag("target", target)
          .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description, String target) {
      return Counter.builder(name).description(description).tag("target", target).register(registry);
    }

    List<Meter> all() {
      return List.of(enqueued, success, retry, deferred, dead, pendingGauge);
    }
  }
}

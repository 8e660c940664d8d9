package syndicator.dispatch;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>When {@code ttlMs} is zero (the default) a key stays tracked until released. When
 * positive, a key older than the TTL can be claimed again, which recovers jobs stuck behind a
 * worker that died without releasing them.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Map<String, Long> inflight = new ConcurrentHashMap<>();
    private final long ttlMs;

    public DefaultInFlightTracker() {
        this(0L);
    }

    public DefaultInFlightTracker(long ttlMs) {
        if (ttlMs < 0) {
            throw new IllegalArgumentException("ttlMs must be >= 0");
        }
        this.ttlMs = ttlMs;
    }

    @Override
    public boolean tryAcquire(String jobKey) {
        long now = System.currentTimeMillis();
        Long existing = inflight.putIfAbsent(jobKey, now);
        if (existing == null) {
            return true;
        }
        if (ttlMs > 0 && now - existing > ttlMs) {
            // another thread may win the replace; then the key stays taken
            return inflight.replace(jobKey, existing, now);
        }
        return false;
    }

    @Override
    public void release(String jobKey) {
        inflight.remove(jobKey);
    }

    @Override
    public int size() {
        return inflight.size();
    }
}

package syndicator.model;

import com.github.f4b6a3.ulid.UlidCreator;
import syndicator.SourceItem;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable unit of dispatch work for one target.
 *
 * <p>{@code jobKey} is the idempotency key: a store keeps at most one row per key, so
 * re-enqueueing an existing key is a no-op. {@code jobId} is a monotonic ULID and fixes the
 * enqueue order among jobs due at the same time.
 *
 * @param jobId     monotonic id assigned at creation
 * @param jobKey    idempotency key, see {@link syndicator.dispatch.JobKeys}
 * @param target    target name
 * @param action    publish or delete
 * @param sourceId  source item id
 * @param payload   item to publish; {@code null} for delete jobs
 * @param status    current state
 * @param attempts  failed attempts so far
 * @param notBefore earliest dispatch time
 * @param createdAt creation time
 * @param lastError message of the last failure, or {@code null}
 */
public record Job(
    String jobId,
    String jobKey,
    String target,
    JobAction action,
    String sourceId,
    SourceItem payload,
    JobStatus status,
    int attempts,
    Instant notBefore,
    Instant createdAt,
    String lastError) {

  public Job {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(jobKey, "jobKey");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(notBefore, "notBefore");
    Objects.requireNonNull(createdAt, "createdAt");
    if (action == JobAction.PUBLISH && payload == null) {
      throw new IllegalArgumentException("publish job requires a payload");
    }
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
  }

  public static Job publish(String jobKey, String target, SourceItem item, Instant notBefore, Instant now) {
    return new Job(newJobId(), jobKey, target, JobAction.PUBLISH, item.id(), item,
        JobStatus.NEW, 0, notBefore, now, null);
  }

  public static Job delete(String jobKey, String target, String sourceId, Instant notBefore, Instant now) {
    return new Job(newJobId(), jobKey, target, JobAction.DELETE, sourceId, null,
        JobStatus.NEW, 0, notBefore, now, null);
  }

  /**
   * Copy of this job under a new key, due at {@code notBefore}, with attempts reset.
   */
  public Job deferredCopy(String derivedKey, Instant notBefore, Instant now) {
    return new Job(newJobId(), derivedKey, target, action, sourceId, payload,
        JobStatus.NEW, 0, notBefore, now, null);
  }

  public Job withStatus(JobStatus status) {
    return new Job(jobId, jobKey, target, action, sourceId, payload, status, attempts,
        notBefore, createdAt, lastError);
  }

  public boolean isPublish() {
    return action == JobAction.PUBLISH;
  }

  private static String newJobId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}

package syndicator.dispatch;

import syndicator.model.Job;
import syndicator.model.JobAction;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Deterministic idempotency keys for jobs.
 *
 * <p>The base key of a publish job is {@code <target>-<first 20 hex chars of sha256(sourceId)>};
 * delete jobs append {@code -delete}. Deferred re-attempts derive their key from the base key
 * of the job, never from another derived key, so repeated deferrals for the same cause and
 * bucket collapse onto one job.
 */
public final class JobKeys {
  private static final int HASH_CHARS = 20;

  private JobKeys() {}

  public static String publish(String target, String sourceId) {
    return target + "-" + hash(sourceId);
  }

  public static String delete(String target, String sourceId) {
    return publish(target, sourceId) + "-delete";
  }

  /** Base key of the work a job carries, whatever key the job itself has. */
  public static String base(Job job) {
    return job.action() == JobAction.PUBLISH
        ? publish(job.target(), job.sourceId())
        : delete(job.target(), job.sourceId());
  }

  /** Key of a job pushed to the next UTC day by the daily budget of {@code dayKey}. */
  public static String budgetDeferral(String baseKey, String dayKey) {
    return baseKey + "-defer-" + dayKey;
  }

  /** Key of a job pushed back by a rate limit until {@code resumeAt}, bucketed per second. */
  public static String rateLimitDeferral(String baseKey, Instant resumeAt) {
    return baseKey + "-rl-" + resumeAt.getEpochSecond();
  }

  static String hash(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(bytes).substring(0, HASH_CHARS);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}

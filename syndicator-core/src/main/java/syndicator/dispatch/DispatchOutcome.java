package syndicator.dispatch;

import java.time.Instant;
import java.util.List;

/**
 * Result of one dispatch attempt. Expected conditions are variants, not exceptions; the
 * dispatcher maps each variant onto a job state transition.
 */
public sealed interface DispatchOutcome {

  /**
   * Work completed. {@code remoteIds} holds the posted thread, the deleted ids, or nothing
   * when there was nothing left to do.
   */
  record Success(List<String> remoteIds) implements DispatchOutcome {
    public Success {
      remoteIds = List.copyOf(remoteIds);
    }

    public static Success nothingToDo() {
      return new Success(List.of());
    }
  }

  /** Reply parent not published on the target yet; retried with backoff. */
  record DependencyNotReady(String reason) implements DispatchOutcome {}

  /** Target rate limit hit; re-enqueued for {@code resumeAt} without counting an attempt. */
  record RateLimited(Instant resumeAt, String reason) implements DispatchOutcome {}

  /** Posting would exceed the daily budget of {@code dayKey}; re-enqueued for the next UTC day. */
  record BudgetExceeded(Instant resumeAt, String dayKey, int used, int requested) implements DispatchOutcome {
    public String reason() {
      return "daily budget exhausted for " + dayKey + ": " + used + " used, " + requested + " requested";
    }
  }

  /** Input rejected by the target; terminal. */
  record PermanentRejection(String reason) implements DispatchOutcome {}

  /** Network, server or unknown failure; retried up to the attempt cap. */
  record TransientFailure(String reason, Throwable cause) implements DispatchOutcome {}
}

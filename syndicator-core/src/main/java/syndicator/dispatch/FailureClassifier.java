package syndicator.dispatch;

import syndicator.PublishException;
import syndicator.RateLimitHints;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Maps publisher failures onto {@link DispatchOutcome} variants: status 429 is a rate limit,
 * any other 4xx a permanent rejection, everything else transient.
 */
public final class FailureClassifier {
  private final Duration rateLimitFloor;

  /**
   * @param rateLimitFloor minimum delay before a rate-limited job runs again
   */
  public FailureClassifier(Duration rateLimitFloor) {
    Objects.requireNonNull(rateLimitFloor, "rateLimitFloor");
    if (rateLimitFloor.isNegative()) {
      throw new IllegalArgumentException("rateLimitFloor must be >= 0");
    }
    this.rateLimitFloor = rateLimitFloor;
  }

  public DispatchOutcome classify(Throwable failure, Instant now) {
    String reason = describe(failure);
    if (failure instanceof PublishException pe) {
      if (pe.isRateLimited()) {
        RateLimitHints hints = pe.rateLimitHints() != null ? pe.rateLimitHints() : RateLimitHints.none();
        return new DispatchOutcome.RateLimited(hints.resumeAt(now, rateLimitFloor), reason);
      }
      if (pe.isClientError()) {
        return new DispatchOutcome.PermanentRejection(reason);
      }
    }
    return new DispatchOutcome.TransientFailure(reason, failure);
  }

  static String describe(Throwable failure) {
    String message = failure.getMessage();
    String base = message == null ? failure.getClass().getSimpleName() : message;
    if (failure instanceof PublishException pe && pe.statusCode() != null) {
      return base + " (status " + pe.statusCode() + ")";
    }
    return base;
  }
}

package syndicator;

/**
 * Structured failure raised by a {@link syndicator.spi.Publisher}.
 *
 * <p>Carries the target's status code, when there is one, and the rate-limit reset hints
 * parsed from the response. The dispatcher classifies the failure from these fields: 429
 * is a rate limit, any other 4xx is a permanent rejection, everything else is transient.
 * A delete that finds nothing to delete reports {@link #isNotFound()}.
 */
public class PublishException extends Exception {
    private final Integer statusCode;
    private final RateLimitHints rateLimitHints;
    private final boolean alreadyGone;

    public PublishException(String message) {
        this(message, null, null, false, null);
    }

    public PublishException(String message, Throwable cause) {
        this(message, null, null, false, cause);
    }

    public PublishException(String message, int statusCode) {
        this(message, statusCode, null, false, null);
    }

    public PublishException(String message, int statusCode, RateLimitHints rateLimitHints) {
        this(message, statusCode, rateLimitHints, false, null);
    }

    protected PublishException(String message, Integer statusCode, RateLimitHints rateLimitHints,
            boolean alreadyGone, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.rateLimitHints = rateLimitHints;
        this.alreadyGone = alreadyGone;
    }

    /**
     * The remote object no longer exists. Deletes treat this as success.
     */
    public static PublishException alreadyGone(String message) {
        return new PublishException(message, null, null, true, null);
    }

    public static PublishException rateLimited(String message, RateLimitHints hints) {
        return new PublishException(message, 429, hints);
    }

    /** HTTP-style status code, or {@code null} when the failure had none (network, timeout). */
    public Integer statusCode() {
        return statusCode;
    }

    /** Reset hints of a rate-limited response; {@code null} when absent. */
    public RateLimitHints rateLimitHints() {
        return rateLimitHints;
    }

    public boolean isRateLimited() {
        return statusCode != null && statusCode == 429;
    }

    public boolean isClientError() {
        return statusCode != null && statusCode >= 400 && statusCode < 500;
    }

    public boolean isNotFound() {
        return alreadyGone || (statusCode != null && statusCode == 404);
    }
}

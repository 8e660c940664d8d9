package syndicator;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reset time extracted from a rate-limited response.
 *
 * <p>{@link #fromHeaders} understands {@code Retry-After} (delta seconds or HTTP date) and the
 * epoch-second reset headers {@code x-rate-limit-reset}, {@code x-app-limit-24hour-reset} and
 * {@code x-user-limit-24hour-reset}. When several are present the latest one wins.
 *
 * @param resetAt earliest time the target accepts requests again, or {@code null} if unknown
 */
public record RateLimitHints(Instant resetAt) {

    static final List<String> EPOCH_RESET_HEADERS = List.of(
            "x-rate-limit-reset",
            "x-app-limit-24hour-reset",
            "x-user-limit-24hour-reset");

    public static RateLimitHints none() {
        return new RateLimitHints(null);
    }

    public static RateLimitHints at(Instant resetAt) {
        return new RateLimitHints(resetAt);
    }

    /**
     * Parses reset hints from response headers. Header names are matched case-insensitively;
     * unparseable values are ignored.
     *
     * @param headers response headers
     * @param now     reference time for relative {@code Retry-After} values
     */
    public static RateLimitHints fromHeaders(Map<String, String> headers, Instant now) {
        Instant latest = null;
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getKey() == null || header.getValue() == null) {
                continue;
            }
            String name = header.getKey().toLowerCase(Locale.ROOT);
            String value = header.getValue().trim();
            Instant candidate = null;
            if (name.equals("retry-after")) {
                candidate = parseRetryAfter(value, now);
            } else if (EPOCH_RESET_HEADERS.contains(name)) {
                candidate = parseEpochSeconds(value);
            }
            if (candidate != null && (latest == null || candidate.isAfter(latest))) {
                latest = candidate;
            }
        }
        return new RateLimitHints(latest);
    }

    /**
     * Time to resume at: the reset time, but never earlier than {@code now + floor}.
     */
    public Instant resumeAt(Instant now, Duration floor) {
        Instant earliest = now.plus(floor);
        if (resetAt == null || resetAt.isBefore(earliest)) {
            return earliest;
        }
        return resetAt;
    }

    private static Instant parseRetryAfter(String value, Instant now) {
        try {
            long seconds = Long.parseLong(value);
            return seconds < 0 ? null : now.plusSeconds(seconds);
        } catch (NumberFormatException notSeconds) {
            try {
                return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
    }

    private static Instant parseEpochSeconds(String value) {
        try {
            long epochSeconds = Long.parseLong(value);
            return epochSeconds <= 0 ? null : Instant.ofEpochSecond(epochSeconds);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
